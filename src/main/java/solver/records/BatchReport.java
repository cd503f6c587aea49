package solver.records;

import java.util.List;
import java.util.Locale;

/**
 * Aggregate of a batch simulation.
 *
 * @param games        number of simulated secrets
 * @param average      arithmetic mean of rounds-to-solve (7 counts for a failure)
 * @param distribution {@code distribution.get(r)} games solved in {@code r} rounds, index 7 = failed
 * @param failures     games that hit an internal inconsistency
 * @param elapsedMs    wall-clock time of the batch
 */
public record BatchReport(
        int         games,
        double      average,
        List<Integer> distribution,
        int         failures,
        long        elapsedMs
) {
    public BatchReport {
        distribution = List.copyOf(distribution);
    }

    public String formattedAverage() {
        return String.format(Locale.ROOT, "%.4f", average);
    }
}
