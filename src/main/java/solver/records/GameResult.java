package solver.records;

import solver.constants.SolverConstants;

import java.util.List;

/**
 * Final state of one game.
 *
 * @param secret secret word when known (simulation), otherwise {@code null}
 * @param turns  full history
 * @param state  {@link GameState#SOLVED} or {@link GameState#EXHAUSTED}
 */
public record GameResult(String secret, List<Turn> turns, GameState state) {

    public GameResult {
        turns = List.copyOf(turns);
    }

    /** Rounds needed, or {@link SolverConstants#FAILED_ROUNDS} when unsolved. */
    public int roundsToSolve() {
        return state == GameState.SOLVED ? turns.size() : SolverConstants.FAILED_ROUNDS;
    }

    public boolean solved() {
        return state == GameState.SOLVED;
    }
}
