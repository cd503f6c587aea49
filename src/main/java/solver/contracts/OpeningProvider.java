package solver.contracts;

import java.util.Optional;

/**
 * One source of best first guesses for the untouched answer set.
 */
public interface OpeningProvider {

    Optional<String> opening(String strategyKey);

    /** Offers a freshly computed opening. Read-only providers ignore it. */
    default void remember(String strategyKey, String word) {}
}
