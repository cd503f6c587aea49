package solver.impl;

import solver.contracts.HardModeChecker;
import solver.contracts.PatternCache;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static solver.constants.SolverConstants.*;

/**
 * Minimax-entropy strategy: play the guess whose feedback leaves the smallest
 * expected candidate set.
 *
 * <p>Partitioning the {@code n} candidates by pattern into buckets of size
 * {@code b}, a bucket is hit with probability {@code b/n} and then leaves {@code b}
 * words, so the expectation is {@code Σ b²/n}. Since {@code n} is fixed per call the
 * integer {@code Σ b²} is compared instead, which keeps ties exact.</p>
 */
public final class MinimaxSelectorImpl extends AbstractGuessSelector {

    private final PatternCache cache;

    public MinimaxSelectorImpl(PatternCache cache,
                               HardModeChecker checker,
                               OpeningBook openingBook,
                               Collection<String> answers) {
        super(checker, openingBook, answers);
        this.cache = cache;
    }

    @Override
    public String strategyKey(boolean hardMode) {
        return hardMode ? STRATEGY_MINIMAX_HARD : STRATEGY_MINIMAX;
    }

    @Override
    protected Scorer prepare(List<String> candidates) {
        final int n = candidates.size();
        final int[] secretIdx = new int[n];
        boolean allIndexed = true;
        for (int i = 0; i < n; i++) {
            secretIdx[i] = cache.secretIndex(candidates.get(i));
            allIndexed &= secretIdx[i] >= 0;
        }
        final boolean indexed = allIndexed;
        final int[] buckets = new int[PATTERN_COUNT];

        return new Scorer() {
            @Override
            public long cost(String guess) {
                Arrays.fill(buckets, 0);
                int g = cache.guessIndex(guess);
                if (indexed && g >= 0) {
                    for (int i = 0; i < n; i++) buckets[cache.lookupOrCompute(secretIdx[i], g)]++;
                } else {
                    for (int i = 0; i < n; i++) buckets[cache.lookupOrCompute(candidates.get(i), guess)]++;
                }
                long sumSq = 0;
                for (int b : buckets) sumSq += (long) b * b;
                return sumSq;
            }

            @Override
            public double score(long cost) {
                return (double) cost / n;
            }
        };
    }
}
