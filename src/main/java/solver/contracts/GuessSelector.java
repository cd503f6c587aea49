package solver.contracts;

import solver.records.Selection;
import solver.records.Turn;

import java.util.List;

/**
 * Picks the next guess for a candidate set.
 */
public interface GuessSelector {

    /**
     * @param candidates words still consistent with the feedback, never modified
     * @param guessPool  words that may be submitted
     * @throws solver.errors.NoCandidatesException when {@code candidates} is empty
     */
    Selection select(List<String> candidates, List<String> guessPool);

    /**
     * Like {@link #select}, scoring only pool words that are legal under hard mode.
     * Falls back to the whole pool when no pool word is legal.
     */
    Selection selectHardMode(List<String> candidates, List<String> guessPool, List<Turn> history);

    /** Key under which openings of this strategy are stored. */
    String strategyKey(boolean hardMode);
}
