package solver.contracts;

/**
 * Supplies the feedback pattern for a played guess.
 */
@FunctionalInterface
public interface FeedbackOracle {

    int feedback(String guess);
}
