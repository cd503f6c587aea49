package solver.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.contracts.*;
import solver.errors.InvalidFeedbackException;
import solver.errors.NoCandidatesException;
import solver.records.GameResult;
import solver.records.GameState;
import solver.records.RoundInfo;
import solver.records.Selection;
import solver.records.Turn;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

import static solver.constants.SolverConstants.*;

/**
 * Console front-end.
 *
 * <p>One game is open at a time. The loop prints a suggestion, then reads either
 * the five-digit feedback for it or a command:</p>
 * <ul>
 *   <li>{@code guess WORD PATTERN} records a guess of the user's own choosing</li>
 *   <li>{@code candidates} lists every remaining answer</li>
 *   <li>{@code new}, {@code options}, {@code setoption ...}, {@code save}</li>
 *   <li>{@code simulate WORD} plays a whole game against a known secret</li>
 *   <li>{@code quit} / {@code exit}</li>
 * </ul>
 * Malformed feedback only re-prompts. Option changes take effect with the next game.
 */
public final class InteractiveHandlerImpl implements InteractiveHandler {

    private static final Logger log = LoggerFactory.getLogger(InteractiveHandlerImpl.class);

    /* ── collaborators ─────────────────────────────────────────── */
    private final Vocabulary      vocabulary;
    private final FeedbackEncoder encoder;
    private final CandidateFilter filter;
    private final HardModeChecker checker;
    private final SolverOptions   opts;
    private final PatternCache    cache;
    private final Path            cacheFile;
    private final boolean         helper;
    private final InputStream     in;
    private final PrintStream     out;

    /* ── current game ──────────────────────────────────────────── */
    private Game game;
    /** suggestion awaiting feedback (nullable) */
    private Selection suggestion;

    public InteractiveHandlerImpl(Vocabulary vocabulary,
                                  FeedbackEncoder encoder,
                                  CandidateFilter filter,
                                  HardModeChecker checker,
                                  SolverOptions opts,
                                  PatternCache cache,
                                  Path cacheFile,
                                  boolean helper,
                                  InputStream in,
                                  PrintStream out) {
        this.vocabulary = vocabulary;
        this.encoder    = encoder;
        this.filter     = filter;
        this.checker    = checker;
        this.opts       = opts;
        this.cache      = cache;
        this.cacheFile  = cacheFile;
        this.helper     = helper;
        this.in         = in;
        this.out        = out;
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override public void runLoop() {
        banner();
        startGame();
        try (Scanner sc = new Scanner(in, StandardCharsets.UTF_8)) {
            while (sc.hasNextLine()) {
                String line = sc.nextLine().trim();
                if (!line.isEmpty() && handle(line)) break;   // "quit" → exit
            }
        }
        flushCache();
        out.println("Goodbye.");
    }

    /* ── router ───────────────────────────────────────────────── */
    private boolean handle(String cmd) {
        String[] t = cmd.split("\\s+");

        return switch (t[0].toLowerCase(Locale.ROOT)) {
            case "quit", "exit" -> true;
            case "new"          -> { out.println("Starting a new game."); startGame(); yield false; }
            case "candidates"   -> { cmdCandidates(); yield false; }
            case "guess"        -> { cmdGuess(t);     yield false; }
            case "simulate"     -> { cmdSimulate(t);  yield false; }
            case "options"      -> { opts.printOptions(); yield false; }
            case "setoption"    -> { opts.setOption(cmd); yield false; }
            case "save"         -> { flushCache(); yield false; }
            case "help"         -> { help(); yield false; }
            default -> {
                if (t.length == 1) cmdFeedback(t[0]);
                else out.println("Unknown command: " + cmd);
                yield false;
            }
        };
    }

    /* ── commands ─────────────────────────────────────────────── */

    private void cmdFeedback(String feedback) {
        if (suggestion == null) {
            out.println("No suggestion pending. Use 'guess WORD PATTERN' or 'new'.");
            return;
        }
        int pattern;
        try {
            pattern = Patterns.parse(feedback);
        } catch (InvalidFeedbackException e) {
            out.println(e.getMessage() + ". Please try again.");
            return;
        }
        play(suggestion.guess(), pattern);
    }

    private void cmdGuess(String[] t) {
        if (t.length != 3) {
            out.println("Usage: guess WORD PATTERN");
            return;
        }
        String word = t[1].toLowerCase(Locale.ROOT);
        if (!vocabulary.isValidGuess(word)) {
            out.println("'" + word + "' is not in the word lists. Please try again.");
            return;
        }
        if (game.hardMode() && !checker.isLegal(game.history(), word)) {
            out.println("'" + word + "' breaks the hard-mode rules. Please try again.");
            return;
        }
        int pattern;
        try {
            pattern = Patterns.parse(t[2]);
        } catch (InvalidFeedbackException e) {
            out.println(e.getMessage() + ". Please try again.");
            return;
        }
        play(word, pattern);
    }

    private void cmdCandidates() {
        List<String> c = game.candidates();
        out.println(c.size() + " possible answers:");
        for (int i = 0; i < c.size(); i += WORDS_PER_ROW) {
            out.println(String.join(" ", c.subList(i, Math.min(c.size(), i + WORDS_PER_ROW))));
        }
    }

    private void cmdSimulate(String[] t) {
        if (t.length != 2 || !vocabulary.isAnswer(t[1].toLowerCase(Locale.ROOT))) {
            out.println("Usage: simulate WORD (WORD from the answer list)");
            return;
        }
        String secret = t[1].toLowerCase(Locale.ROOT);
        Game sim = new GameImpl(vocabulary, opts.selector(), filter, opts.hardMode());
        try {
            GameResult r = sim.play(guess -> encoder.encode(guess, secret),
                    info -> out.println("  " + info.round() + ". " + info.turn()
                            + "  (" + info.remaining().size() + " left)"));
            out.println(r.solved()
                    ? "Solved '" + secret + "' in " + r.roundsToSolve() + " guesses."
                    : "Failed to solve '" + secret + "'.");
        } catch (NoCandidatesException e) {
            out.println("Simulation stopped: " + e.getMessage());
        }
    }

    /* ── game flow ────────────────────────────────────────────── */

    private void startGame() {
        game = new GameImpl(vocabulary, opts.selector(), filter, opts.hardMode());
        log.debug("New game, strategy {}", opts.selector().strategyKey(opts.hardMode()));
        if (opts.hardMode()) out.println("[HARD MODE]");
        suggestNext();
    }

    private void suggestNext() {
        try {
            suggestion = game.suggest();
        } catch (NoCandidatesException e) {
            out.println(e.getMessage() + ". The feedback entered so far is inconsistent.");
            out.println("Starting a new game.");
            startGame();
            return;
        }
        int attempt = game.round() + 1;
        String word = suggestion.guess().toUpperCase(Locale.ROOT);
        out.println((helper ? "Suggestion " : "Attempt ") + attempt + ": " + word);

        // lone candidate is the answer; the first turn always asks (one-word answer lists)
        if (suggestion.source() == Selection.Source.SINGLETON && game.round() > 0) {
            out.println("Only " + word + " is left.");
            play(suggestion.guess(), SOLVED_PATTERN);
            return;
        }
        if (helper) {
            out.println("Enter feedback for it, or 'guess WORD PATTERN' for your own word:");
        } else {
            out.println("Enter feedback (0 = absent, 1 = misplaced, 2 = correct):");
        }
    }

    private void play(String guess, int pattern) {
        RoundInfo info = game.record(guess, pattern);
        suggestion = null;

        if (info.state() == GameState.SOLVED) {
            out.println("Solved in " + info.round() + " guesses! The answer was "
                    + guess.toUpperCase(Locale.ROOT) + ".");
            endGame();
            return;
        }
        if (info.state() == GameState.EXHAUSTED) {
            out.println("Failed to solve the puzzle.");
            endGame();
            return;
        }
        showRemaining(info.remaining());
        suggestNext();
    }

    private void showRemaining(List<String> remaining) {
        int n = remaining.size();
        if (n == 0) return;   // reported by suggestNext
        if (n <= opts.showLimit()) {
            out.println("Remaining candidates (" + n + "): " + String.join(", ", remaining));
        } else {
            out.println("Remaining candidates (" + n + "): "
                    + String.join(", ", remaining.subList(0, PREVIEW_SIZE)) + ", ...");
        }
    }

    private void endGame() {
        List<Turn> h = game.history();
        log.debug("Game over after {}", h);
        flushCache();
        out.println();
        out.println("Starting a new game.");
        startGame();
    }

    private void flushCache() {
        if (cache.isDirty() && !cache.flush(cacheFile)) {
            out.println("Warning: pattern cache could not be saved to " + cacheFile);
        }
    }

    /* ── text ─────────────────────────────────────────────────── */

    private void banner() {
        if (helper) {
            out.println("Wordle helper: enter the word you played and the feedback you got.");
        } else {
            out.println("Wordle solver: play the suggested word and enter the feedback you got.");
        }
        out.println("Feedback is five digits, e.g. 20100. Type 'help' for commands.");
    }

    private void help() {
        out.println("Commands:");
        out.println("  <5 digits>             feedback for the current suggestion");
        out.println("  guess WORD PATTERN     record your own guess");
        out.println("  candidates             list remaining answers");
        out.println("  new                    abandon the game and start over");
        out.println("  simulate WORD          play a full game against WORD");
        out.println("  options                show options");
        out.println("  setoption name N value V");
        out.println("  save                   write the pattern cache");
        out.println("  quit | exit");
    }
}
