package solver.impl;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import solver.contracts.*;
import solver.errors.NoCandidatesException;
import solver.records.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static solver.constants.SolverConstants.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class GameImplTest {

    private final FeedbackEncoder encoder = new FeedbackEncoderImpl();
    private final HardModeChecker checker = new HardModeCheckerImpl();
    private Vocabulary vocabulary;
    private CandidateFilter filter;
    private GuessSelector selector;

    @BeforeAll
    void setUp() {
        vocabulary = WordFixtures.vocabulary();
        PatternCache cache = new PatternCacheImpl(encoder, vocabulary);
        filter = new CandidateFilterImpl(cache);
        selector = new MinimaxSelectorImpl(cache, checker,
                OpeningBook.standard(PrecomputedOpeningProvider.none(), vocabulary.guesses()), vocabulary.answers());
    }

    private Game newGame(boolean hardMode) {
        return new GameImpl(vocabulary, selector, filter, hardMode);
    }

    /* ── state machine ────────────────────────────────────────── */

    @Test
    void freshGameHasAllAnswers() {
        Game g = newGame(false);
        assertEquals(GameState.NOT_STARTED, g.state());
        assertEquals(0, g.round());
        assertEquals(vocabulary.answers(), g.candidates());
        assertTrue(g.history().isEmpty());
    }

    @Test
    void suggestStartsTheGame() {
        Game g = newGame(false);
        Selection s = g.suggest();
        assertNotNull(s.guess());
        assertEquals(GameState.IN_PROGRESS, g.state());
        assertEquals(0, g.round());
    }

    @Test
    void solvedPatternEndsTheGame() {
        Game g = newGame(false);
        RoundInfo info = g.record("crane", SOLVED_PATTERN);
        assertEquals(GameState.SOLVED, info.state());
        assertEquals(List.of("crane"), info.remaining());
        assertThrows(IllegalStateException.class, g::suggest);
        assertThrows(IllegalStateException.class, () -> g.record("slate", 0));
    }

    @Test
    void sixthUnsolvedRoundExhaustsTheGame() {
        Game g = newGame(false);
        int pattern = encoder.encode("roate", "crane");
        for (int i = 1; i < MAX_ROUNDS; i++) {
            assertEquals(GameState.IN_PROGRESS, g.record("roate", pattern).state());
        }
        RoundInfo last = g.record("roate", pattern);
        assertEquals(MAX_ROUNDS, last.round());
        assertEquals(GameState.EXHAUSTED, last.state());
        assertThrows(IllegalStateException.class, g::suggest);
    }

    @Test
    void solvingOnTheLastRoundCountsAsSolved() {
        Game g = newGame(false);
        int pattern = encoder.encode("roate", "crane");
        for (int i = 1; i < MAX_ROUNDS; i++) g.record("roate", pattern);
        assertEquals(GameState.SOLVED, g.record("crane", SOLVED_PATTERN).state());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, PATTERN_COUNT, 1000})
    void outOfRangePatternIsRejected(int pattern) {
        Game g = newGame(false);
        assertThrows(IllegalArgumentException.class, () -> g.record("crane", pattern));
        assertEquals(0, g.round());
    }

    @Test
    void contradictoryFeedbackLeavesNoCandidates() {
        Game g = newGame(false);
        RoundInfo info = g.record("crane", Patterns.parse("22220"));
        assertTrue(info.remaining().isEmpty());
        assertThrows(NoCandidatesException.class, g::suggest);
    }

    @Test
    void selectionIsAttachedOnlyToTheSuggestedWord() {
        Game g = newGame(false);
        Selection s = g.suggest();
        RoundInfo played = g.record(s.guess(), encoder.encode(s.guess(), "lemon"));
        assertSame(s, played.selection());

        g.suggest();
        RoundInfo manual = g.record("slick", encoder.encode("slick", "lemon"));
        assertNull(manual.selection());
    }

    @Test
    void viewsAreDefensiveCopies() {
        Game g = newGame(false);
        g.record("roate", encoder.encode("roate", "crane"));
        assertThrows(UnsupportedOperationException.class, () -> g.candidates().clear());
        assertThrows(UnsupportedOperationException.class, () -> g.history().clear());
    }

    /* ── play ─────────────────────────────────────────────────── */

    @Test
    void playSolvesAgainstTheEncoder() {
        Game g = newGame(false);
        List<RoundInfo> rounds = new ArrayList<>();
        GameResult r = g.play(guess -> encoder.encode(guess, "crane"), rounds::add);

        assertTrue(r.solved());
        assertTrue(r.roundsToSolve() <= MAX_ROUNDS);
        Turn last = r.turns().get(r.turns().size() - 1);
        assertEquals("crane", last.guess());
        assertEquals("22222", last.patternString());
        assertEquals(r.turns().size(), rounds.size());
        for (int i = 0; i < rounds.size(); i++) assertEquals(i + 1, rounds.get(i).round());
    }

    @Test
    void loneCandidateIsRecordedWithoutAskingTheOracle() {
        Vocabulary single = Vocabulary.of(vocabulary.guesses(), List.of("crane"));
        PatternCache cache = new PatternCacheImpl(encoder, single);
        GuessSelector sel = new MinimaxSelectorImpl(cache, checker, OpeningBook.empty(), single.answers());
        Game g = new GameImpl(single, sel, new CandidateFilterImpl(cache), false);

        GameResult r = g.play(guess -> { throw new AssertionError("oracle asked for " + guess); }, GameListener.NONE);
        assertEquals(1, r.roundsToSolve());
        assertEquals("crane", r.turns().get(0).guess());
    }

    @Test
    void hardModeGuessesStayLegal() {
        for (String secret : List.of("crane", "vivid", "mamma", "fjord", "kayak")) {
            Game g = newGame(true);
            assertTrue(g.hardMode());
            GameResult r = g.play(guess -> encoder.encode(guess, secret), GameListener.NONE);
            List<Turn> turns = r.turns();
            for (int i = 1; i < turns.size(); i++) {
                List<Turn> before = turns.subList(0, i);
                // the whole pool is used when no guess word is legal
                boolean restricted = vocabulary.guesses().stream().anyMatch(w -> checker.isLegal(before, w));
                if (restricted) {
                    assertTrue(checker.isLegal(before, turns.get(i).guess()), secret + ": " + turns);
                }
            }
        }
    }
}
