package solver.impl;

import solver.contracts.CandidateFilter;
import solver.contracts.FeedbackOracle;
import solver.contracts.Game;
import solver.contracts.GameListener;
import solver.contracts.GuessSelector;
import solver.records.GameResult;
import solver.records.GameState;
import solver.records.RoundInfo;
import solver.records.Selection;
import solver.records.Turn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static solver.constants.SolverConstants.*;

/**
 * Default {@link Game}. The candidate list starts as the full Answer Set and is
 * narrowed by each recorded turn; filtering only the newest turn is equivalent to
 * re-filtering the answers with the whole history.
 */
public final class GameImpl implements Game {

    private final Vocabulary      vocabulary;
    private final GuessSelector   selector;
    private final CandidateFilter filter;
    private final boolean         hardMode;
    private final int             maxRounds;

    private final List<Turn> history = new ArrayList<>();
    private List<String> candidates;
    private GameState state = GameState.NOT_STARTED;

    /** last suggestion, attached to the round that plays it */
    private Selection pending;

    public GameImpl(Vocabulary vocabulary, GuessSelector selector, CandidateFilter filter, boolean hardMode) {
        this(vocabulary, selector, filter, hardMode, MAX_ROUNDS);
    }

    public GameImpl(Vocabulary vocabulary,
                    GuessSelector selector,
                    CandidateFilter filter,
                    boolean hardMode,
                    int maxRounds) {
        if (maxRounds < 1) throw new IllegalArgumentException("maxRounds must be >= 1");
        this.vocabulary = vocabulary;
        this.selector   = selector;
        this.filter     = filter;
        this.hardMode   = hardMode;
        this.maxRounds  = maxRounds;
        this.candidates = vocabulary.answers();
    }

    @Override
    public Selection suggest() {
        ensureOpen();
        Selection s = hardMode
                ? selector.selectHardMode(candidates, vocabulary.guesses(), history)
                : selector.select(candidates, vocabulary.guesses());
        if (state == GameState.NOT_STARTED) state = GameState.IN_PROGRESS;
        pending = s;
        return s;
    }

    @Override
    public RoundInfo record(String guess, int pattern) {
        ensureOpen();
        Patterns.requireValid(pattern);

        Turn turn = new Turn(guess, pattern);
        history.add(turn);
        candidates = filter.filter(candidates, List.of(turn));

        if (Patterns.isSolved(pattern)) {
            state = GameState.SOLVED;
        } else if (history.size() >= maxRounds) {
            state = GameState.EXHAUSTED;
        } else {
            state = GameState.IN_PROGRESS;
        }

        Selection played = (pending != null && pending.guess().equals(guess)) ? pending : null;
        pending = null;
        return new RoundInfo(history.size(), played, turn, candidates(), state);
    }

    @Override
    public GameResult play(FeedbackOracle oracle, GameListener listener) {
        while (!state.isTerminal()) {
            Selection s = suggest();
            // a lone candidate is the answer; no need to ask
            int pattern = candidates.size() == 1 ? SOLVED_PATTERN : oracle.feedback(s.guess());
            listener.onRound(record(s.guess(), pattern));
        }
        return new GameResult(null, history, state);
    }

    private void ensureOpen() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Game is over: " + state);
        }
    }

    @Override public GameState state() { return state; }
    @Override public int round() { return history.size(); }
    @Override public List<String> candidates() { return Collections.unmodifiableList(new ArrayList<>(candidates)); }
    @Override public List<Turn> history() { return Collections.unmodifiableList(new ArrayList<>(history)); }
    @Override public boolean hardMode() { return hardMode; }
}
