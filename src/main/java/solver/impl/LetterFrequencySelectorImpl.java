package solver.impl;

import solver.contracts.HardModeChecker;

import java.util.Collection;
import java.util.List;

import static solver.constants.SolverConstants.*;

/**
 * Cheap heuristic: play the guess whose distinct letters occur in the most
 * candidates. Letters are counted once per word.
 */
public final class LetterFrequencySelectorImpl extends AbstractGuessSelector {

    public LetterFrequencySelectorImpl(HardModeChecker checker,
                                       OpeningBook openingBook,
                                       Collection<String> answers) {
        super(checker, openingBook, answers);
    }

    @Override
    public String strategyKey(boolean hardMode) {
        return STRATEGY_LETTER_FREQ;
    }

    @Override
    protected Scorer prepare(List<String> candidates) {
        final int[] wordsWithLetter = letterCounts(candidates);
        return new Scorer() {
            @Override
            public long cost(String guess) {
                return -coverage(guess, wordsWithLetter);
            }

            @Override
            public double score(long cost) {
                return -cost;
            }
        };
    }

    /** {@code counts[c]}: number of words containing letter {@code 'a' + c}. */
    static int[] letterCounts(Collection<String> words) {
        int[] counts = new int[26];
        for (String w : words) {
            int seen = 0;
            for (int i = 0; i < WORD_LENGTH; i++) {
                int c = w.charAt(i) - 'a';
                if ((seen & (1 << c)) == 0) {
                    seen |= 1 << c;
                    counts[c]++;
                }
            }
        }
        return counts;
    }

    static long coverage(String guess, int[] counts) {
        long score = 0;
        int seen = 0;
        for (int i = 0; i < WORD_LENGTH; i++) {
            int c = guess.charAt(i) - 'a';
            if ((seen & (1 << c)) == 0) {
                seen |= 1 << c;
                score += counts[c];
            }
        }
        return score;
    }
}
