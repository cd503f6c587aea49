package solver.impl;

import solver.contracts.OpeningProvider;

import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of {@link OpeningProvider}s; the first provider that knows an
 * opening for a strategy wins.
 *
 * <p>Openings belong to one guess pool, normally the Guess Set. A selection made
 * from any other pool neither reads nor feeds the book.</p>
 */
public final class OpeningBook {

    private final List<OpeningProvider> providers;
    private final List<String> openingPool;

    /**
     * @param providers   consulted in order
     * @param openingPool the guess pool the openings were computed against
     */
    public OpeningBook(List<OpeningProvider> providers, List<String> openingPool) {
        this.providers = List.copyOf(providers);
        this.openingPool = List.copyOf(openingPool);
    }

    public static OpeningBook empty() {
        return new OpeningBook(List.of(), List.of());
    }

    /** Precomputed artifact first, then whatever this process already computed. */
    public static OpeningBook standard(PrecomputedOpeningProvider precomputed, List<String> guesses) {
        return new OpeningBook(List.of(precomputed, new MemoizedOpeningProvider()), guesses);
    }

    public boolean covers(List<String> guessPool) {
        return !providers.isEmpty() && openingPool.equals(guessPool);
    }

    public Optional<String> lookup(String strategyKey, List<String> guessPool) {
        if (!covers(guessPool)) return Optional.empty();
        for (OpeningProvider p : providers) {
            Optional<String> hit = p.opening(strategyKey);
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    public void remember(String strategyKey, List<String> guessPool, String word) {
        if (!covers(guessPool)) return;
        for (OpeningProvider p : providers) p.remember(strategyKey, word);
    }
}
