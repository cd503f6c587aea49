package solver.impl;

import solver.contracts.OpeningProvider;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Openings computed earlier in this process. */
public final class MemoizedOpeningProvider implements OpeningProvider {

    private final Map<String, String> openings = new ConcurrentHashMap<>();

    @Override
    public Optional<String> opening(String strategyKey) {
        return Optional.ofNullable(openings.get(strategyKey));
    }

    @Override
    public void remember(String strategyKey, String word) {
        openings.putIfAbsent(strategyKey, word);
    }
}
