package solver.impl;

import solver.contracts.FeedbackEncoder;

import static solver.constants.SolverConstants.*;

/**
 * Two-pass scorer.
 *
 * <p>Pass 1 marks exact hits and consumes the secret letter at that position.
 * Pass 2 walks the remaining guess positions left to right; each one consumes the
 * leftmost unconsumed occurrence of its letter in the secret and is marked
 * misplaced, or is marked absent when none is left. A secret letter is therefore
 * credited at most as many times as it occurs.</p>
 *
 * <p>Consumption is tracked in a 5-bit mask so nothing is allocated per call.</p>
 */
public final class FeedbackEncoderImpl implements FeedbackEncoder {

    private static final int EXACT_DIGIT = 2;
    private static final int MISPLACED_DIGIT = 1;

    @Override
    public int encode(String guess, String secret) {
        int consumed = 0;   // bit i: secret[i] already credited
        int exact = 0;      // bit i: guess[i] is an exact hit

        // 1. exact hits
        for (int i = 0; i < WORD_LENGTH; i++) {
            if (guess.charAt(i) == secret.charAt(i)) {
                exact |= 1 << i;
                consumed |= 1 << i;
            }
        }

        // 2. misplaced, leftmost unconsumed occurrence first
        int pattern = 0;
        for (int i = 0; i < WORD_LENGTH; i++) {
            int digit = 0;
            if ((exact & (1 << i)) != 0) {
                digit = EXACT_DIGIT;
            } else {
                char g = guess.charAt(i);
                for (int j = 0; j < WORD_LENGTH; j++) {
                    if ((consumed & (1 << j)) == 0 && secret.charAt(j) == g) {
                        consumed |= 1 << j;
                        digit = MISPLACED_DIGIT;
                        break;
                    }
                }
            }
            pattern = pattern * MARK_COUNT + digit;
        }
        return pattern;
    }
}
