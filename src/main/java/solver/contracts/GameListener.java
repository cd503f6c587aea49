package solver.contracts;

import solver.records.RoundInfo;

/**
 * Callback for finished rounds. Console front-ends print them, test harnesses
 * record them.
 */
@FunctionalInterface
public interface GameListener {

    GameListener NONE = info -> {};

    void onRound(RoundInfo info);
}
