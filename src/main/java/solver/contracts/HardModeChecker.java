package solver.contracts;

import solver.records.Turn;

import java.util.List;

/**
 * Decides whether a guess respects every hint revealed so far.
 */
public interface HardModeChecker {

    boolean isLegal(List<Turn> history, String guess);
}
