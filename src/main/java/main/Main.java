// File: Main.java
package main;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.*;
import solver.errors.CacheUnavailableException;
import solver.impl.*;
import solver.records.BatchReport;
import solver.records.Selection;
import solver.records.SolverConfig;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

import static solver.constants.SolverConstants.*;

/**
 * Wire everything together and run the selected mode.
 *
 * <pre>
 * java -jar lexis.jar [interactive|helper|batch|precompute|bench] [key=value ...]
 * </pre>
 * Settings come from {@code -Dsolver.*} properties, overridden by {@code key=value} arguments.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        String mode = "interactive";
        SolverConfig config;
        try {
            config = SolverConfig.fromSystemProperties();
            for (String a : args) {
                if (a.indexOf('=') > 0) config = config.with(a);
                else mode = a.toLowerCase(Locale.ROOT);
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            System.exit(2);
            return;
        }

        try {
            run(mode, config);
        } catch (CacheUnavailableException e) {
            log.error("{}: {}", e.getMessage(), e.getPath());
            System.exit(1);
        } catch (IOException e) {
            log.error("Cannot start: {}", e.getMessage());
            System.exit(1);
        }
    }

    static void run(String mode, SolverConfig config) throws IOException {
        Vocabulary vocabulary = Vocabulary.load(config.guessFile(), config.answerFile());
        ArtifactIO io = new ArtifactIO();

        try (TaskPool pool = new TaskPoolImpl(config.threads())) {
            FeedbackEncoder encoder = new FeedbackEncoderImpl();
            PatternCache cache = new PatternCacheImpl(encoder, vocabulary.answers(), vocabulary.allWords(), io, pool);
            CandidateFilter filter = new CandidateFilterImpl(cache);
            HardModeChecker checker = new HardModeCheckerImpl();

            if ("precompute".equals(mode)) {
                new CacheBootstrapper(vocabulary, cache, checker, io).run(config.cacheFile(), config.openingFile());
                return;
            }

            cache.load(config.cacheFile());
            if (config.precompute()) {
                cache.bulkPrecompute(vocabulary.answers(), vocabulary.allWords());
            }

            OpeningBook book = OpeningBook.standard(
                    PrecomputedOpeningProvider.load(config.openingFile(), io), vocabulary.guesses());
            Map<String, GuessSelector> selectors = Map.of(
                    STRATEGY_MINIMAX, new MinimaxSelectorImpl(cache, checker, book, vocabulary.answers()),
                    STRATEGY_LETTER_FREQ, new LetterFrequencySelectorImpl(checker, book, vocabulary.answers()));
            GuessSelector selector = selectors.get(config.strategy());

            try {
                switch (mode) {
                    case "interactive", "helper" -> {
                        SolverOptions opts = new SolverOptionsImpl(config, selectors, cache, pool, System.out);
                        InteractiveHandler handler = new InteractiveHandlerImpl(vocabulary, encoder, filter, checker,
                                opts, cache, config.cacheFile(), "helper".equals(mode), System.in, System.out);
                        handler.runLoop();
                    }
                    case "batch" -> runBatch(config, vocabulary, encoder, selector, filter, pool);
                    case "bench" -> runBench(vocabulary, cache, checker);
                    default -> System.err.println("Unknown mode: " + mode
                            + " (expected interactive, helper, batch, precompute or bench)");
                }
            } finally {
                if (!cache.flush(config.cacheFile())) {
                    log.warn("Pattern cache not saved to {}", config.cacheFile());
                }
            }
        }
    }

    private static void runBatch(SolverConfig config,
                                 Vocabulary vocabulary,
                                 FeedbackEncoder encoder,
                                 GuessSelector selector,
                                 CandidateFilter filter,
                                 TaskPool pool) throws IOException {
        Simulator simulator = new SimulatorImpl(vocabulary, encoder, selector, filter, config.hardMode(), pool);
        BatchReport report = simulator.runBatch(vocabulary.answers());
        simulator.writeReport(report, config.reportFile());

        System.out.println((config.hardMode() ? "[HARD MODE] " : "")
                + "Average number of tries: " + report.formattedAverage());
        System.out.println("Distribution (1..6, failed): " + report.distribution().subList(1, FAILED_ROUNDS + 1));
        System.out.println("Report written to " + config.reportFile());
    }

    /** Full first-guess search on the untouched Answer Set, opening book bypassed. */
    private static void runBench(Vocabulary vocabulary, PatternCache cache, HardModeChecker checker) {
        GuessSelector selector = new MinimaxSelectorImpl(cache, checker, OpeningBook.empty(), vocabulary.answers());
        long t0 = System.nanoTime();
        Selection s = selector.select(vocabulary.answers(), vocabulary.guesses());
        long ms = (System.nanoTime() - t0) / 1_000_000;

        System.out.printf(Locale.ROOT, "Best opening: %s (expected remaining %.2f)%n", s.guess(), s.score());
        System.out.printf(Locale.ROOT, "Scored %d guesses in %d ms%n", s.poolSize(), ms);
        System.out.println("benchok");
    }
}
