package solver.contracts;

/**
 * Pure mapping (guess, secret) → packed feedback pattern.
 *
 * <p>Patterns are base-3 numbers with position 0 as the most significant digit,
 * digits being {@link solver.records.Mark} ordinals. Implementations must be
 * deterministic, allocation-free and safe to call from any thread.</p>
 */
public interface FeedbackEncoder {

    /**
     * @param guess  five-letter lower-case word
     * @param secret five-letter lower-case word
     * @return packed pattern in {@code [0, 243)}
     */
    int encode(String guess, String secret);
}
