package solver.constants;

/**
 * Central place for <em>all</em> solver-wide compile-time constants.
 */
public final class SolverConstants {

    private SolverConstants() {}

    /* ────────────── Word geometry ────────────── */
    public static final int WORD_LENGTH = 5;
    public static final int MARK_COUNT = 3;

    /** 3^5 distinct feedback patterns. */
    public static final int PATTERN_COUNT = 243;

    /** Packed "22222". */
    public static final int SOLVED_PATTERN = PATTERN_COUNT - 1;

    /** Cache slot that has not been computed yet. Never a valid pattern. */
    public static final byte NO_PATTERN = (byte) 0xFF;

    /* ────────────── Game limits ────────────── */
    public static final int MAX_ROUNDS = 6;

    /** Rounds-to-solve reported for a game that was not solved. */
    public static final int FAILED_ROUNDS = MAX_ROUNDS + 1;

    /** Candidate count at or below which only candidates are scored. */
    public static final int CANDIDATE_ONLY_POOL = 2;

    /* ────────────── Strategy keys (opening artifact) ────────────── */
    public static final String STRATEGY_MINIMAX = "minimax_entropy";
    public static final String STRATEGY_MINIMAX_HARD = "minimax_entropy_hard_mode";
    public static final String STRATEGY_LETTER_FREQ = "letter_freq";

    /* ────────────── Default artifacts ────────────── */
    public static final String DEFAULT_GUESS_FILE = "allowed_wordle_guesses.txt";
    public static final String DEFAULT_ANSWER_FILE = "possible_wordle_answers.txt";
    public static final String DEFAULT_CACHE_FILE = "feedback_patterns_cache.json.gz";
    public static final String DEFAULT_OPENING_FILE = "first_guesses_cache.json";
    public static final String DEFAULT_REPORT_FILE = "average_tries.txt";
    public static final String DEFAULT_HARD_REPORT_FILE = "average_tries_hard_mode.txt";

    /* ────────────── Reporting ────────────── */
    public static final int PROGRESS_INTERVAL = 100;
    public static final int SHOW_ALL_LIMIT = 10;
    public static final int PREVIEW_SIZE = 5;
    public static final int WORDS_PER_ROW = 5;
}
