package solver.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import solver.contracts.HardModeChecker;
import solver.records.Turn;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HardModeCheckerImplTest {

    private final HardModeChecker checker = new HardModeCheckerImpl();

    private static Turn turn(String guess, String feedback) {
        return new Turn(guess, Patterns.parse(feedback));
    }

    @Test
    void emptyHistoryAllowsEverything() {
        assertTrue(checker.isLegal(List.of(), "crane"));
        assertTrue(checker.isLegal(List.of(), "qqqqq"));
    }

    /* crate scored 02000: r pinned at position 1 */
    @ParameterizedTest(name = "{0} legal={1}")
    @CsvSource({
            "brine, true",
            "crane, true",
            "trace, true",
            "touch, false",
            "rover, false",
    })
    void exactLetterIsPinned(String guess, boolean legal) {
        assertEquals(legal, checker.isLegal(List.of(turn("crate", "02000")), guess));
    }

    /* crate scored 10000: c somewhere, but not first */
    @ParameterizedTest(name = "{0} legal={1}")
    @CsvSource({
            "cynic, false",
            "lodge, false",
            "touch, true",
            "civic, false",
            "vouch, true",
    })
    void misplacedLetterIsRequiredElsewhere(String guess, boolean legal) {
        assertEquals(legal, checker.isLegal(List.of(turn("crate", "10000")), guess));
    }

    @Test
    void absentLettersMayBeReused() {
        assertTrue(checker.isLegal(List.of(turn("crane", "00000")), "crane"));
    }

    @Test
    void constraintsAccumulateOverTurns() {
        List<Turn> history = List.of(turn("crate", "02000"), turn("brine", "02002"));
        assertTrue(checker.isLegal(history, "grime"));
        assertFalse(checker.isLegal(history, "brink"));
        assertFalse(checker.isLegal(history, "mound"));
        assertTrue(checker.isLegal(history, "crane"));
    }

    @Test
    void everyCandidateIsLegal() {
        Vocabulary v = WordFixtures.vocabulary();
        FeedbackEncoderImpl encoder = new FeedbackEncoderImpl();
        for (String secret : v.answers()) {
            List<Turn> history = List.of(
                    new Turn("roate", encoder.encode("roate", secret)),
                    new Turn("slick", encoder.encode("slick", secret)));
            assertTrue(checker.isLegal(history, secret), secret);
        }
    }
}
