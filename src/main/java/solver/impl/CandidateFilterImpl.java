package solver.impl;

import solver.contracts.CandidateFilter;
import solver.contracts.PatternCache;
import solver.records.Turn;

import java.util.ArrayList;
import java.util.List;

/**
 * Cache-backed filter. Turns are applied in history order, each one shrinking the
 * list produced by the previous.
 */
public final class CandidateFilterImpl implements CandidateFilter {

    private final PatternCache cache;

    public CandidateFilterImpl(PatternCache cache) {
        this.cache = cache;
    }

    @Override
    public List<String> filter(List<String> candidates, List<Turn> history) {
        List<String> current = candidates;
        for (Turn turn : history) {
            if (current.isEmpty()) break;
            current = apply(current, turn);
        }
        return current == candidates ? new ArrayList<>(candidates) : current;
    }

    private List<String> apply(List<String> words, Turn turn) {
        int g = cache.guessIndex(turn.guess());
        List<String> kept = new ArrayList<>(words.size());
        for (String w : words) {
            int s = cache.secretIndex(w);
            int p = (s >= 0 && g >= 0)
                    ? cache.lookupOrCompute(s, g)
                    : cache.lookupOrCompute(w, turn.guess());
            if (p == turn.pattern()) kept.add(w);
        }
        return kept;
    }
}
