package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.CandidateFilter;
import solver.contracts.FeedbackEncoder;
import solver.contracts.Game;
import solver.contracts.GameListener;
import solver.contracts.GuessSelector;
import solver.contracts.Simulator;
import solver.contracts.TaskPool;
import solver.errors.NoCandidatesException;
import solver.records.BatchReport;
import solver.records.GameResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import static solver.constants.SolverConstants.*;

/**
 * Plays games against known secrets, feedback coming straight from the encoder.
 *
 * <p>Each simulation owns its {@link Game}; the only state shared between the pool
 * workers is the vocabulary and the pattern cache behind the selector and filter.</p>
 */
public final class SimulatorImpl implements Simulator {

    private static final Logger log = LoggerFactory.getLogger(SimulatorImpl.class);

    private final Vocabulary      vocabulary;
    private final FeedbackEncoder encoder;
    private final GuessSelector   selector;
    private final CandidateFilter filter;
    private final boolean         hardMode;
    private final TaskPool        pool;

    public SimulatorImpl(Vocabulary vocabulary,
                         FeedbackEncoder encoder,
                         GuessSelector selector,
                         CandidateFilter filter,
                         boolean hardMode,
                         TaskPool pool) {
        this.vocabulary = vocabulary;
        this.encoder    = encoder;
        this.selector   = selector;
        this.filter     = filter;
        this.hardMode   = hardMode;
        this.pool       = pool;
    }

    /* ── single game ─────────────────────────────────────────── */

    @Override
    public int simulate(String secret) {
        try {
            return play(secret, GameListener.NONE).roundsToSolve();
        } catch (NoCandidatesException e) {
            log.warn("Simulation of '{}' ran out of candidates: {}", secret, e.getMessage());
            return FAILED_ROUNDS;
        }
    }

    @Override
    public GameResult play(String secret, GameListener listener) {
        Game game = new GameImpl(vocabulary, selector, filter, hardMode);
        GameResult r = game.play(guess -> encoder.encode(guess, secret), listener);
        return new GameResult(secret, r.turns(), r.state());
    }

    /* ── batch ───────────────────────────────────────────────── */

    private record Outcome(int rounds, boolean failed) {}

    @Override
    public BatchReport runBatch(List<String> secrets) {
        if (secrets.isEmpty()) throw new IllegalArgumentException("No secrets to simulate");
        long t0 = System.currentTimeMillis();

        List<Future<Outcome>> futures = new ArrayList<>(secrets.size());
        for (String secret : secrets) {
            futures.add(pool.submit(() -> outcome(secret)));
        }

        int[] distribution = new int[FAILED_ROUNDS + 1];
        long total = 0;
        int failures = 0;
        int done = 0;
        try {
            for (Future<Outcome> f : futures) {
                Outcome o = f.get();
                distribution[o.rounds()]++;
                total += o.rounds();
                if (o.failed()) failures++;
                if (++done % PROGRESS_INTERVAL == 0) {
                    log.info("Simulated {} games...", done);
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch interrupted after " + done + " games", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Batch worker failed", e.getCause());
        }

        List<Integer> dist = new ArrayList<>(distribution.length);
        for (int d : distribution) dist.add(d);
        double average = (double) total / secrets.size();
        BatchReport report = new BatchReport(secrets.size(), average, dist, failures,
                System.currentTimeMillis() - t0);
        log.info("{}Average number of tries: {} over {} games ({} failed, {} ms)",
                hardMode ? "[HARD MODE] " : "", report.formattedAverage(), report.games(),
                distribution[FAILED_ROUNDS], report.elapsedMs());
        return report;
    }

    private Outcome outcome(String secret) {
        try {
            return new Outcome(play(secret, GameListener.NONE).roundsToSolve(), false);
        } catch (RuntimeException e) {
            // counted as FAILED_ROUNDS, the batch goes on
            log.warn("Simulation of '{}' failed: {}", secret, e.toString());
            return new Outcome(FAILED_ROUNDS, true);
        }
    }

    @Override
    public void writeReport(BatchReport report, Path path) throws IOException {
        Files.writeString(path, report.formattedAverage() + "\n", StandardCharsets.UTF_8);
    }
}
