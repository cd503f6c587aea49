package solver.impl;

import solver.errors.InvalidFeedbackException;
import solver.records.Mark;

import static solver.constants.SolverConstants.*;

/**
 * Conversions between packed patterns and the external {@code "20100"} notation.
 *
 * <p>Packing: {@code ((((m0*3 + m1)*3 + m2)*3 + m3)*3 + m4)} where {@code mi} is
 * the {@link Mark} ordinal at position {@code i}. The decimal digit string therefore
 * reads left to right in position order.</p>
 */
public final class Patterns {

    private static final int[] POW3 = {81, 27, 9, 3, 1};

    private Patterns() {}

    public static boolean isValid(String feedback) {
        if (feedback == null || feedback.length() != WORD_LENGTH) return false;
        for (int i = 0; i < WORD_LENGTH; i++) {
            char c = feedback.charAt(i);
            if (c < '0' || c > '2') return false;
        }
        return true;
    }

    /**
     * @throws InvalidFeedbackException unless the input is five of {@code 0/1/2}
     */
    public static int parse(String feedback) {
        if (!isValid(feedback)) throw new InvalidFeedbackException(feedback);
        int p = 0;
        for (int i = 0; i < WORD_LENGTH; i++) {
            p = p * MARK_COUNT + (feedback.charAt(i) - '0');
        }
        return p;
    }

    public static String format(int pattern) {
        requireValid(pattern);
        char[] out = new char[WORD_LENGTH];
        for (int i = 0; i < WORD_LENGTH; i++) {
            out[i] = Mark.fromDigit((pattern / POW3[i]) % MARK_COUNT).symbol();
        }
        return new String(out);
    }

    public static Mark markAt(int pattern, int position) {
        requireValid(pattern);
        return Mark.fromDigit((pattern / POW3[position]) % MARK_COUNT);
    }

    public static int of(Mark... marks) {
        if (marks.length != WORD_LENGTH) {
            throw new IllegalArgumentException("Need " + WORD_LENGTH + " marks, got " + marks.length);
        }
        int p = 0;
        for (Mark m : marks) p = p * MARK_COUNT + m.ordinal();
        return p;
    }

    public static boolean isSolved(int pattern) {
        return pattern == SOLVED_PATTERN;
    }

    public static int requireValid(int pattern) {
        if (pattern < 0 || pattern >= PATTERN_COUNT) {
            throw new IllegalArgumentException("Pattern out of range: " + pattern);
        }
        return pattern;
    }
}
