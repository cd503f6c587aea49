package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.GuessSelector;
import solver.contracts.HardModeChecker;
import solver.contracts.PatternCache;
import solver.errors.CacheUnavailableException;
import solver.records.Selection;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static solver.constants.SolverConstants.*;

/**
 * Offline preparation: fills the pattern cache for the whole vocabulary and finds
 * the best opening of every strategy by a full search against the untouched Answer
 * Set. Both artifacts are then picked up by later runs.
 *
 * <p>Openings are computed with the very selectors the solver plays with, each
 * given an empty opening book, so a served opening is what scoring would return.</p>
 */
public final class CacheBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(CacheBootstrapper.class);

    private final Vocabulary      vocabulary;
    private final PatternCache    cache;
    private final HardModeChecker checker;
    private final ArtifactIO      io;

    public CacheBootstrapper(Vocabulary vocabulary, PatternCache cache, HardModeChecker checker, ArtifactIO io) {
        this.vocabulary = vocabulary;
        this.cache      = cache;
        this.checker    = checker;
        this.io         = io;
    }

    /**
     * Precomputes and persists both artifacts.
     *
     * @return the openings written
     * @throws CacheUnavailableException if the opening artifact could not be written
     */
    public Map<String, String> run(Path cacheFile, Path openingFile) throws CacheUnavailableException {
        cache.load(cacheFile);
        cache.bulkPrecompute(vocabulary.answers(), vocabulary.allWords());
        if (!cache.flush(cacheFile)) {
            log.warn("Continuing without a persisted pattern cache");
        }

        Map<String, String> openings = computeOpenings();
        PrecomputedOpeningProvider.save(openingFile, openings, io);
        log.info("Saved first guesses {} to {}", openings, openingFile);
        return openings;
    }

    /** Best first guess per strategy key, recomputed from scratch. */
    public Map<String, String> computeOpenings() {
        List<String> answers = vocabulary.answers();
        List<String> guesses = vocabulary.guesses();

        GuessSelector minimax = new MinimaxSelectorImpl(cache, checker, OpeningBook.empty(), answers);
        GuessSelector letters = new LetterFrequencySelectorImpl(checker, OpeningBook.empty(), answers);

        Map<String, String> openings = new LinkedHashMap<>();
        openings.put(STRATEGY_MINIMAX, report(STRATEGY_MINIMAX, minimax.select(answers, guesses)));
        openings.put(STRATEGY_MINIMAX_HARD,
                report(STRATEGY_MINIMAX_HARD, minimax.selectHardMode(answers, guesses, List.of())));
        openings.put(STRATEGY_LETTER_FREQ, report(STRATEGY_LETTER_FREQ, letters.select(answers, guesses)));
        return openings;
    }

    private static String report(String key, Selection s) {
        log.info("Best first guess for {}: {} (score {})", key, s.guess(), String.format("%.1f", s.score()));
        return s.guess();
    }
}
