package solver.contracts;

import solver.records.Turn;

import java.util.List;

/**
 * Narrows a candidate list to the words consistent with every turn of a history.
 */
public interface CandidateFilter {

    /**
     * @return the words {@code w} of {@code candidates}, in their original order, for which
     *         {@code encode(turn.guess, w) == turn.pattern} holds for every turn. Empty when
     *         the history is contradictory.
     */
    List<String> filter(List<String> candidates, List<Turn> history);
}
