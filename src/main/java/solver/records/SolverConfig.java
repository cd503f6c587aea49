package solver.records;

import solver.constants.SolverConstants;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Immutable set of <em>run-time settings</em> for the solver drivers.
 *
 * Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param guessFile    line-delimited Guess Set
 * @param answerFile   line-delimited Answer Set
 * @param cacheFile    persisted pattern cache ({@code .gz} suffix enables compression)
 * @param openingFile  precomputed best-first-guess map
 * @param reportFile   batch report target (hard-mode default differs)
 * @param threads      batch worker count
 * @param hardMode     restrict guesses to hard-mode legal words
 * @param strategy     {@link SolverConstants#STRATEGY_MINIMAX} or {@link SolverConstants#STRATEGY_LETTER_FREQ}
 * @param precompute   fill the whole pattern cache before playing
 */
public record SolverConfig(
        Path    guessFile,
        Path    answerFile,
        Path    cacheFile,
        Path    openingFile,
        Path    reportFile,
        int     threads,
        boolean hardMode,
        String  strategy,
        boolean precompute
) {

    public static SolverConfig defaults() {
        return new Builder().build();
    }

    /**
     * Defaults overridden by {@code -Dsolver.*} system properties.
     */
    public static SolverConfig fromSystemProperties() {
        Builder b = new Builder();
        String v;
        if ((v = System.getProperty("solver.guesses")) != null) b.guessFile(Path.of(v));
        if ((v = System.getProperty("solver.answers")) != null) b.answerFile(Path.of(v));
        if ((v = System.getProperty("solver.cache")) != null) b.cacheFile(Path.of(v));
        if ((v = System.getProperty("solver.openings")) != null) b.openingFile(Path.of(v));
        if ((v = System.getProperty("solver.report")) != null) b.reportFile(Path.of(v));
        if ((v = System.getProperty("solver.threads")) != null) b.threads(Integer.parseInt(v.trim()));
        if ((v = System.getProperty("solver.hardMode")) != null) b.hardMode(Boolean.parseBoolean(v.trim()));
        if ((v = System.getProperty("solver.strategy")) != null) b.strategy(v.trim());
        if ((v = System.getProperty("solver.precompute")) != null) b.precompute(Boolean.parseBoolean(v.trim()));
        return b.build();
    }

    public Builder toBuilder() {
        // a default report path follows the mode, so it is not carried over
        Path modeDefault = defaultReportFile(hardMode);
        return new Builder()
                .guessFile(guessFile).answerFile(answerFile)
                .cacheFile(cacheFile).openingFile(openingFile)
                .reportFile(modeDefault.equals(reportFile) ? null : reportFile)
                .threads(threads)
                .hardMode(hardMode).strategy(strategy)
                .precompute(precompute);
    }

    /**
     * Applies one {@code key=value} override, as passed on the command line.
     *
     * @throws IllegalArgumentException for an unknown key or a malformed pair
     */
    public SolverConfig with(String assignment) {
        int eq = assignment.indexOf('=');
        if (eq <= 0) throw new IllegalArgumentException("Expected key=value but got: " + assignment);
        String key = assignment.substring(0, eq).trim().toLowerCase(Locale.ROOT);
        String value = assignment.substring(eq + 1).trim();
        Builder b = toBuilder();
        switch (key) {
            case "guesses"    -> b.guessFile(Path.of(value));
            case "answers"    -> b.answerFile(Path.of(value));
            case "cache"      -> b.cacheFile(Path.of(value));
            case "openings"   -> b.openingFile(Path.of(value));
            case "report"     -> b.reportFile(Path.of(value));
            case "threads"    -> b.threads(Integer.parseInt(value));
            case "hardmode"   -> b.hardMode(Boolean.parseBoolean(value));
            case "strategy"   -> b.strategy(value);
            case "precompute" -> b.precompute(Boolean.parseBoolean(value));
            default -> throw new IllegalArgumentException("Unknown setting: " + key);
        }
        return b.build();
    }

    private static Path defaultReportFile(boolean hardMode) {
        return Path.of(hardMode ? SolverConstants.DEFAULT_HARD_REPORT_FILE
                                : SolverConstants.DEFAULT_REPORT_FILE);
    }

    /**
     * A builder for creating {@link SolverConfig} instances.
     */
    public static class Builder {
        private Path guessFile = Path.of(SolverConstants.DEFAULT_GUESS_FILE);
        private Path answerFile = Path.of(SolverConstants.DEFAULT_ANSWER_FILE);
        private Path cacheFile = Path.of(SolverConstants.DEFAULT_CACHE_FILE);
        private Path openingFile = Path.of(SolverConstants.DEFAULT_OPENING_FILE);
        private Path reportFile = null;
        private int threads = Runtime.getRuntime().availableProcessors();
        private boolean hardMode = false;
        private String strategy = SolverConstants.STRATEGY_MINIMAX;
        private boolean precompute = false;

        public Builder guessFile(Path guessFile) { this.guessFile = guessFile; return this; }
        public Builder answerFile(Path answerFile) { this.answerFile = answerFile; return this; }
        public Builder cacheFile(Path cacheFile) { this.cacheFile = cacheFile; return this; }
        public Builder openingFile(Path openingFile) { this.openingFile = openingFile; return this; }
        public Builder reportFile(Path reportFile) { this.reportFile = reportFile; return this; }
        public Builder threads(int threads) { this.threads = threads; return this; }
        public Builder hardMode(boolean hardMode) { this.hardMode = hardMode; return this; }
        public Builder strategy(String strategy) { this.strategy = strategy; return this; }
        public Builder precompute(boolean precompute) { this.precompute = precompute; return this; }

        public SolverConfig build() {
            if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
            if (!SolverConstants.STRATEGY_MINIMAX.equals(strategy)
                    && !SolverConstants.STRATEGY_LETTER_FREQ.equals(strategy)) {
                throw new IllegalArgumentException("Unknown strategy: " + strategy);
            }
            Path report = reportFile != null ? reportFile : defaultReportFile(hardMode);
            return new SolverConfig(guessFile, answerFile, cacheFile, openingFile, report,
                    threads, hardMode, strategy, precompute);
        }
    }
}
