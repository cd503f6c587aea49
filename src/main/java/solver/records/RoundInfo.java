package solver.records;

import java.util.List;

/**
 * Immutable snapshot of a finished round that a game hands to a
 * {@link solver.contracts.GameListener}.
 *
 * @param round      1-based round number
 * @param selection  how the guess was chosen
 * @param turn       the guess and the feedback it received
 * @param remaining  candidates left after filtering
 * @param state      game state after the round
 */
public record RoundInfo(
        int        round,
        Selection  selection,
        Turn       turn,
        List<String> remaining,
        GameState  state
) {}
