package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.GuessSelector;
import solver.contracts.HardModeChecker;
import solver.errors.NoCandidatesException;
import solver.records.Selection;
import solver.records.Turn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static solver.constants.SolverConstants.CANDIDATE_ONLY_POOL;

/**
 * Shared selection skeleton: degenerate cases, pool construction, hard-mode
 * restriction, the opening fast path and the tie-break. Subclasses only say how
 * much a guess costs.
 *
 * <p>Pool order is the guess pool as given followed by the candidates it does not
 * contain. Among guesses of minimal cost the first one in pool order that is
 * itself a candidate wins; if none is a candidate, the first one in pool order.</p>
 */
public abstract class AbstractGuessSelector implements GuessSelector {

    private static final Logger log = LoggerFactory.getLogger(AbstractGuessSelector.class);

    private final HardModeChecker checker;
    private final OpeningBook openingBook;
    private final Set<String> answerSet;

    /**
     * @param answers the full Answer Set; the opening book is only consulted when the
     *                candidates are exactly this set and the guess pool is the book's own
     */
    protected AbstractGuessSelector(HardModeChecker checker, OpeningBook openingBook, Collection<String> answers) {
        this.checker = checker;
        this.openingBook = openingBook;
        this.answerSet = Set.copyOf(answers);
    }

    /**
     * Per-call scoring state. Lower cost is better; costs are compared exactly.
     */
    protected interface Scorer {
        long cost(String guess);

        /** Score reported in the {@link Selection} for a given cost. */
        double score(long cost);
    }

    protected abstract Scorer prepare(List<String> candidates);

    /* ── GuessSelector ───────────────────────────────────────── */

    @Override
    public final Selection select(List<String> candidates, List<String> guessPool) {
        return choose(candidates, guessPool, strategyKey(false));
    }

    @Override
    public final Selection selectHardMode(List<String> candidates, List<String> guessPool, List<Turn> history) {
        List<String> legal = new ArrayList<>(guessPool.size());
        for (String g : guessPool) {
            if (checker.isLegal(history, g)) legal.add(g);
        }
        if (legal.isEmpty()) {
            log.debug("No hard-mode legal guess in pool of {}, using the whole pool", guessPool.size());
            legal = guessPool;
        }
        return choose(candidates, legal, strategyKey(true));
    }

    /* ── skeleton ────────────────────────────────────────────── */

    private Selection choose(List<String> candidates, List<String> guessPool, String key) {
        if (candidates.isEmpty()) {
            throw new NoCandidatesException("No possible answers remain");
        }
        if (candidates.size() == 1) {
            return Selection.singleton(candidates.get(0));
        }

        Set<String> pool = buildPool(candidates, guessPool);

        boolean untouched = isUntouched(candidates);
        if (untouched) {
            Optional<String> known = openingBook.lookup(key, guessPool);
            if (known.isPresent() && pool.contains(known.get())) {
                return Selection.opening(known.get());
            }
        }

        Selection s = score(candidates, pool);
        if (untouched) openingBook.remember(key, guessPool, s.guess());
        log.debug("{}: {} candidates, pool {} -> {} ({})",
                key, candidates.size(), pool.size(), s.guess(), s.score());
        return s;
    }

    private static Set<String> buildPool(List<String> candidates, List<String> guessPool) {
        if (candidates.size() <= CANDIDATE_ONLY_POOL) {
            return new LinkedHashSet<>(candidates);
        }
        LinkedHashSet<String> pool = new LinkedHashSet<>(guessPool);
        pool.addAll(candidates);
        return pool;
    }

    private boolean isUntouched(List<String> candidates) {
        return candidates.size() == answerSet.size() && answerSet.equals(new HashSet<>(candidates));
    }

    private Selection score(List<String> candidates, Set<String> pool) {
        Scorer scorer = prepare(candidates);
        Set<String> candidateSet = new HashSet<>(candidates);

        long best = Long.MAX_VALUE;
        String bestWord = null;
        String bestCandidate = null;
        for (String g : pool) {
            long cost = scorer.cost(g);
            if (cost < best) {
                best = cost;
                bestWord = g;
                bestCandidate = candidateSet.contains(g) ? g : null;
            } else if (cost == best && bestCandidate == null && candidateSet.contains(g)) {
                bestCandidate = g;
            }
        }
        String chosen = bestCandidate != null ? bestCandidate : bestWord;
        return new Selection(chosen, scorer.score(best), pool.size(), Selection.Source.SCORED);
    }
}
