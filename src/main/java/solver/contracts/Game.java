package solver.contracts;

import solver.records.GameResult;
import solver.records.GameState;
import solver.records.RoundInfo;
import solver.records.Selection;
import solver.records.Turn;

import java.util.List;

/**
 * One game in progress: owns its candidate list and history, never shared
 * between threads.
 *
 * <p>{@code NOT_STARTED → IN_PROGRESS → SOLVED | EXHAUSTED}. A game is solved when
 * an all-exact pattern is recorded and exhausted when the sixth round ends unsolved.
 * No guess may be requested or recorded once a terminal state is reached.</p>
 */
public interface Game {

    /**
     * Proposes the next guess.
     *
     * @throws solver.errors.NoCandidatesException when the feedback so far is contradictory
     * @throws IllegalStateException               when the game is over
     */
    Selection suggest();

    /**
     * Appends a turn, filters the candidates and advances the state.
     *
     * @throws IllegalStateException when the game is over
     */
    RoundInfo record(String guess, int pattern);

    /**
     * Plays to completion, asking {@code oracle} for feedback. When a single candidate
     * is left the solved pattern is recorded without asking.
     */
    GameResult play(FeedbackOracle oracle, GameListener listener);

    GameState state();

    /** Rounds played so far. */
    int round();

    List<String> candidates();

    List<Turn> history();

    boolean hardMode();
}
