package solver.records;

/**
 * Outcome of one guess selection.
 *
 * @param guess     chosen word
 * @param score     strategy score of the chosen word: expected remaining candidates for
 *                  minimax, letter coverage for letter frequency; {@code NaN} when nothing was scored
 * @param poolSize  number of words scored (0 when nothing was scored)
 * @param source    how the word was obtained
 */
public record Selection(String guess, double score, int poolSize, Source source) {

    public enum Source {
        /** Only one candidate was left. */
        SINGLETON,
        /** Served by the opening book for the untouched answer set. */
        OPENING,
        /** Computed by scoring the pool. */
        SCORED
    }

    public static Selection singleton(String word) {
        return new Selection(word, Double.NaN, 0, Source.SINGLETON);
    }

    public static Selection opening(String word) {
        return new Selection(word, Double.NaN, 0, Source.OPENING);
    }

    public boolean scored() {
        return source == Source.SCORED;
    }
}
