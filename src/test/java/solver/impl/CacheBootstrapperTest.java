package solver.impl;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import solver.contracts.FeedbackEncoder;
import solver.contracts.GuessSelector;
import solver.contracts.HardModeChecker;
import solver.contracts.PatternCache;
import solver.records.Selection;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static solver.constants.SolverConstants.*;

class CacheBootstrapperTest {

    private final FeedbackEncoder encoder = new FeedbackEncoderImpl();
    private final HardModeChecker checker = new HardModeCheckerImpl();
    private final ArtifactIO io = new ArtifactIO();

    @TempDir
    Path dir;

    @Test
    void writesBothArtifactsAndServesTheSameOpenings() throws Exception {
        Vocabulary vocabulary = WordFixtures.vocabulary();
        PatternCache cache = new PatternCacheImpl(encoder, vocabulary);
        Path cacheFile = dir.resolve("patterns.json.gz");
        Path openingFile = dir.resolve("openings.json");

        Map<String, String> openings = new CacheBootstrapper(vocabulary, cache, checker, io).run(cacheFile, openingFile);

        assertEquals(List.of(STRATEGY_MINIMAX, STRATEGY_MINIMAX_HARD, STRATEGY_LETTER_FREQ),
                List.copyOf(openings.keySet()));
        assertTrue(Files.exists(cacheFile));
        assertTrue(Files.exists(openingFile));
        assertFalse(cache.isDirty());
        assertEquals((long) vocabulary.answers().size() * vocabulary.allWords().size(), cache.size());

        // a fresh process picks both up
        PatternCache reloaded = new PatternCacheImpl(encoder, vocabulary);
        assertTrue(reloaded.load(cacheFile));
        assertEquals(cache.size(), reloaded.size());

        PrecomputedOpeningProvider provider = PrecomputedOpeningProvider.load(openingFile, io);
        assertEquals(openings, provider.openings());

        GuessSelector served = new MinimaxSelectorImpl(reloaded, checker, OpeningBook.standard(provider, vocabulary.guesses()), vocabulary.answers());
        GuessSelector computed = new MinimaxSelectorImpl(reloaded, checker, OpeningBook.empty(), vocabulary.answers());

        Selection fast = served.select(vocabulary.answers(), vocabulary.guesses());
        assertEquals(Selection.Source.OPENING, fast.source());
        assertEquals(computed.select(vocabulary.answers(), vocabulary.guesses()).guess(), fast.guess());
    }

    @Test
    void hardModeOpeningMatchesStandardOnEmptyHistory() {
        Vocabulary vocabulary = WordFixtures.vocabulary();
        PatternCache cache = new PatternCacheImpl(encoder, vocabulary);
        Map<String, String> openings = new CacheBootstrapper(vocabulary, cache, checker, io).computeOpenings();

        assertEquals(openings.get(STRATEGY_MINIMAX), openings.get(STRATEGY_MINIMAX_HARD));
        assertTrue(vocabulary.isValidGuess(openings.get(STRATEGY_LETTER_FREQ)));
    }

    @Test
    void brokenOpeningArtifactIsIgnored() throws Exception {
        Path openingFile = dir.resolve("broken.json");
        Files.writeString(openingFile, "[1, 2, 3");
        assertTrue(PrecomputedOpeningProvider.load(openingFile, io).openings().isEmpty());

        Files.writeString(openingFile, "{\"minimax_entropy\": \"toolongword\", \"letter_freq\": \"SLATE\"}");
        assertEquals(Map.of(STRATEGY_LETTER_FREQ, "slate"), PrecomputedOpeningProvider.load(openingFile, io).openings());
    }
}
