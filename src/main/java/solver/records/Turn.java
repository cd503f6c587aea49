package solver.records;

import solver.impl.Patterns;

import java.util.Objects;

/**
 * One played guess and the feedback it received.
 *
 * @param guess   the submitted word (lower case)
 * @param pattern packed feedback pattern, see {@link Patterns}
 */
public record Turn(String guess, int pattern) {

    public Turn {
        Objects.requireNonNull(guess, "guess");
    }

    public String patternString() {
        return Patterns.format(pattern);
    }

    @Override
    public String toString() {
        return guess + ":" + patternString();
    }
}
