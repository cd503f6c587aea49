package solver.contracts;

import solver.records.BatchReport;
import solver.records.GameResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Plays games against known secrets.
 */
public interface Simulator {

    /**
     * @return rounds needed in {@code [1, 6]}, or 7 when the game was not solved or
     *         hit an internal inconsistency
     */
    int simulate(String secret);

    /** Full game record for one secret; rounds are reported to {@code listener}. */
    GameResult play(String secret, GameListener listener);

    /** One independent simulation per secret, spread over the worker pool. */
    BatchReport runBatch(List<String> secrets);

    /** Writes the average with four decimals followed by a newline. */
    void writeReport(BatchReport report, Path path) throws IOException;
}
