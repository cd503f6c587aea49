package solver.impl;

import org.junit.jupiter.api.*;
import solver.contracts.CandidateFilter;
import solver.contracts.FeedbackEncoder;
import solver.contracts.GuessSelector;
import solver.contracts.HardModeChecker;
import solver.contracts.PatternCache;
import solver.errors.NoCandidatesException;
import solver.records.Selection;
import solver.records.Turn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static solver.constants.SolverConstants.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class GuessSelectorTest {

    private final FeedbackEncoder encoder = new FeedbackEncoderImpl();
    private final HardModeChecker checker = new HardModeCheckerImpl();
    private Vocabulary vocabulary;
    private PatternCache cache;

    @BeforeAll
    void setUp() {
        vocabulary = WordFixtures.vocabulary();
        cache = new PatternCacheImpl(encoder, vocabulary);
        cache.bulkPrecompute(vocabulary.answers(), vocabulary.allWords());
    }

    private GuessSelector minimax(OpeningBook book) {
        return new MinimaxSelectorImpl(cache, checker, book, vocabulary.answers());
    }

    private GuessSelector minimax() {
        return minimax(OpeningBook.empty());
    }

    /* ── degenerate cases ─────────────────────────────────────── */

    @Test
    void singleCandidateIsReturnedUnscored() {
        Selection s = minimax().select(List.of("crane"), vocabulary.guesses());
        assertEquals("crane", s.guess());
        assertEquals(Selection.Source.SINGLETON, s.source());
        assertTrue(Double.isNaN(s.score()));
    }

    @Test
    void noCandidatesIsAnError() {
        assertThrows(NoCandidatesException.class, () -> minimax().select(List.of(), vocabulary.guesses()));
        assertThrows(NoCandidatesException.class,
                () -> minimax().selectHardMode(List.of(), vocabulary.guesses(), List.of()));
    }

    @Test
    void twoCandidatesOnlyScoreThemselves() {
        Selection s = minimax().select(List.of("crane", "crate"), vocabulary.guesses());
        assertEquals("crane", s.guess());
        assertEquals(2, s.poolSize());
        assertEquals(1.0, s.score(), 1e-9);

        assertEquals("crate", minimax().select(List.of("crate", "crane"), vocabulary.guesses()).guess());
    }

    /* ── scoring and tie-break ────────────────────────────────── */

    @Test
    void selectionIsDeterministicAndInPool() {
        List<String> candidates = vocabulary.answers();
        Selection a = minimax().select(candidates, vocabulary.guesses());
        Selection b = minimax().select(candidates, vocabulary.guesses());
        assertEquals(a, b);
        assertEquals(Selection.Source.SCORED, a.source());
        assertTrue(vocabulary.allWords().contains(a.guess()));
        assertTrue(a.score() >= 1.0 && a.score() <= candidates.size());
    }

    @Test
    void chosenWordHasMinimalSumOfSquares() {
        List<String> candidates = vocabulary.answers();
        Selection s = minimax().select(candidates, vocabulary.guesses());
        long best = sumOfSquares(s.guess(), candidates);
        for (String g : vocabulary.allWords()) {
            assertTrue(best <= sumOfSquares(g, candidates), g);
        }
        assertEquals((double) best / candidates.size(), s.score(), 1e-9);
    }

    private long sumOfSquares(String guess, List<String> candidates) {
        int[] buckets = new int[PATTERN_COUNT];
        for (String c : candidates) buckets[encoder.encode(guess, c)]++;
        long sum = 0;
        for (int b : buckets) sum += (long) b * b;
        return sum;
    }

    @Test
    void tiePrefersACandidateOverAnEarlierPoolWord() {
        // fzzzz and fghij both split the three candidates apart
        Selection s = minimax().select(List.of("fghij", "abcde", "abcdf"), List.of("fzzzz"));
        assertEquals("fghij", s.guess());
        assertEquals(1.0, s.score(), 1e-9);
    }

    @Test
    void tieWithoutCandidatesTakesFirstInPoolOrder() {
        // candidates only split into {1, 2}; both pool words split fully
        Selection s = minimax().select(List.of("abcde", "abcdf", "abcdg"), List.of("fgxyz", "gfxyz"));
        assertEquals("fgxyz", s.guess());
        assertEquals(1.0, s.score(), 1e-9);

        Selection r = minimax().select(List.of("abcde", "abcdf", "abcdg"), List.of("gfxyz", "fgxyz"));
        assertEquals("gfxyz", r.guess());
    }

    /* ── hard mode ────────────────────────────────────────────── */

    @Test
    void hardModeGuessRespectsHistory() {
        CandidateFilter filter = new CandidateFilterImpl(cache);
        List<Turn> history = List.of(new Turn("roate", encoder.encode("roate", "crane")));
        List<String> candidates = filter.filter(vocabulary.answers(), history);

        Selection s = minimax().selectHardMode(candidates, vocabulary.guesses(), history);
        assertTrue(checker.isLegal(history, s.guess()), s.guess());
    }

    @Test
    void hardModeFallsBackToWholePoolWhenNothingIsLegal() {
        List<Turn> history = List.of(new Turn("crane", Patterns.parse("22220")));
        List<String> candidates = List.of("cranb", "cranc", "crand");

        Selection s = minimax().selectHardMode(candidates, List.of("roate", "slick"), history);
        assertEquals(5, s.poolSize());
    }

    @Test
    void hardModeOpeningUsesItsOwnKey() {
        OpeningBook book = new OpeningBook(List.of(new PrecomputedOpeningProvider(
                Map.of(STRATEGY_MINIMAX, "slick", STRATEGY_MINIMAX_HARD, "dwarf"))), vocabulary.guesses());
        GuessSelector selector = minimax(book);
        assertEquals("slick", selector.select(vocabulary.answers(), vocabulary.guesses()).guess());
        assertEquals("dwarf", selector.selectHardMode(vocabulary.answers(), vocabulary.guesses(), List.of()).guess());
    }

    /* ── opening fast path ────────────────────────────────────── */

    @Test
    void precomputedOpeningIsServedForUntouchedAnswers() {
        OpeningBook book = new OpeningBook(List.of(new PrecomputedOpeningProvider(Map.of(STRATEGY_MINIMAX, "slick"))), vocabulary.guesses());
        Selection s = minimax(book).select(vocabulary.answers(), vocabulary.guesses());
        assertEquals("slick", s.guess());
        assertEquals(Selection.Source.OPENING, s.source());
    }

    @Test
    void openingIsIgnoredOnceCandidatesShrink() {
        OpeningBook book = new OpeningBook(List.of(new PrecomputedOpeningProvider(Map.of(STRATEGY_MINIMAX, "slick"))), vocabulary.guesses());
        List<String> fewer = vocabulary.answers().subList(0, 20);
        assertEquals(Selection.Source.SCORED, minimax(book).select(fewer, vocabulary.guesses()).source());
    }

    @Test
    void openingOutsideThePoolIsIgnored() {
        OpeningBook book = new OpeningBook(List.of(new PrecomputedOpeningProvider(Map.of(STRATEGY_MINIMAX, "qqqqq"))), vocabulary.guesses());
        Selection s = minimax(book).select(vocabulary.answers(), vocabulary.guesses());
        assertEquals(Selection.Source.SCORED, s.source());
    }

    @Test
    void memoizedOpeningEqualsComputedOne() {
        GuessSelector selector = minimax(OpeningBook.standard(PrecomputedOpeningProvider.none(), vocabulary.guesses()));
        Selection first = selector.select(vocabulary.answers(), vocabulary.guesses());
        Selection second = selector.select(vocabulary.answers(), vocabulary.guesses());

        assertEquals(Selection.Source.SCORED, first.source());
        assertEquals(Selection.Source.OPENING, second.source());
        assertEquals(first.guess(), second.guess());
        assertEquals(minimax().select(vocabulary.answers(), vocabulary.guesses()).guess(), second.guess());
    }

    @Test
    void openingFromAnotherPoolIsNotReused() {
        GuessSelector selector = minimax(OpeningBook.standard(PrecomputedOpeningProvider.none(), vocabulary.guesses()));
        Selection narrow = selector.select(vocabulary.answers(), List.of());
        Selection full = selector.select(vocabulary.answers(), vocabulary.guesses());

        assertEquals(Selection.Source.SCORED, narrow.source());
        assertEquals(Selection.Source.SCORED, full.source());
        assertEquals(minimax().select(vocabulary.answers(), vocabulary.guesses()).guess(), full.guess());
        assertEquals(minimax().select(vocabulary.answers(), List.of()).guess(), narrow.guess());
    }

    @Test
    void precomputedOpeningOnlyAppliesToItsOwnPool() {
        OpeningBook book = new OpeningBook(List.of(new PrecomputedOpeningProvider(Map.of(STRATEGY_MINIMAX, "slick"))),
                vocabulary.guesses());
        List<String> reordered = new ArrayList<>(vocabulary.guesses());
        Collections.reverse(reordered);
        assertTrue(reordered.contains("slick"));
        assertEquals(Selection.Source.SCORED, minimax(book).select(vocabulary.answers(), reordered).source());
        assertEquals(Selection.Source.OPENING, minimax(book).select(vocabulary.answers(), vocabulary.guesses()).source());
    }

    /* ── letter frequency ─────────────────────────────────────── */

    @Test
    void letterFrequencyCountsDistinctLettersPerWord() {
        int[] counts = LetterFrequencySelectorImpl.letterCounts(List.of("eerie", "theme"));
        assertEquals(2, counts['e' - 'a']);
        assertEquals(1, counts['r' - 'a']);
        assertEquals(1, counts['t' - 'a']);
        assertEquals(0, counts['z' - 'a']);
        assertEquals(3, LetterFrequencySelectorImpl.coverage("eeeet", counts));
    }

    @Test
    void letterFrequencyPrefersHighestCoverage() {
        GuessSelector letters = new LetterFrequencySelectorImpl(checker, OpeningBook.empty(), vocabulary.answers());
        Selection s = letters.select(List.of("abcde", "abcdf", "abcdg"), List.of("zzzzz"));
        assertEquals("abcde", s.guess());
        assertEquals(13.0, s.score(), 1e-9);
        assertEquals(STRATEGY_LETTER_FREQ, letters.strategyKey(true));
    }

    @Test
    void letterFrequencyResultIsMaximal() {
        GuessSelector letters = new LetterFrequencySelectorImpl(checker, OpeningBook.empty(), vocabulary.answers());
        Selection s = letters.select(vocabulary.answers(), vocabulary.guesses());
        int[] counts = LetterFrequencySelectorImpl.letterCounts(vocabulary.answers());
        Set<String> pool = new HashSet<>(vocabulary.allWords());
        for (String g : pool) {
            assertTrue(LetterFrequencySelectorImpl.coverage(s.guess(), counts)
                    >= LetterFrequencySelectorImpl.coverage(g, counts), g);
        }
    }
}
