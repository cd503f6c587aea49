package solver.impl;

import solver.contracts.HardModeChecker;
import solver.records.Mark;
import solver.records.Turn;

import java.util.List;

import static solver.constants.SolverConstants.WORD_LENGTH;

/**
 * Folds the history into a {@link Constraints} value on every call and tests the
 * guess against it. Holds no state between calls.
 */
public final class HardModeCheckerImpl implements HardModeChecker {

    @Override
    public boolean isLegal(List<Turn> history, String guess) {
        return Constraints.of(history).admits(guess);
    }

    /**
     * Hints revealed by a history.
     *
     * <ul>
     *   <li>{@code pinned[i]}: letter required at position {@code i}, or 0</li>
     *   <li>{@code required}: bit per letter that must appear somewhere</li>
     *   <li>{@code forbidden[i]}: bit per letter that may not sit at position {@code i}</li>
     * </ul>
     */
    static final class Constraints {
        final char[] pinned = new char[WORD_LENGTH];
        final int[] forbidden = new int[WORD_LENGTH];
        int required;

        static Constraints of(List<Turn> history) {
            Constraints c = new Constraints();
            for (Turn t : history) c.add(t);
            return c;
        }

        void add(Turn turn) {
            String g = turn.guess();
            for (int i = 0; i < WORD_LENGTH; i++) {
                Mark m = Patterns.markAt(turn.pattern(), i);
                char letter = g.charAt(i);
                if (m == Mark.EXACT) {
                    pinned[i] = letter;
                } else if (m == Mark.MISPLACED) {
                    int bit = bit(letter);
                    required |= bit;
                    forbidden[i] |= bit;
                }
            }
        }

        boolean admits(String guess) {
            int present = 0;
            for (int i = 0; i < WORD_LENGTH; i++) {
                char letter = guess.charAt(i);
                if (pinned[i] != 0 && letter != pinned[i]) return false;
                int bit = bit(letter);
                if ((forbidden[i] & bit) != 0) return false;
                present |= bit;
            }
            return (required & ~present) == 0;
        }

        private static int bit(char letter) {
            return 1 << (letter - 'a');
        }
    }
}
