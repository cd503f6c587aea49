package solver.records;

/** Life-cycle of a single game. */
public enum GameState {
    NOT_STARTED,
    IN_PROGRESS,
    SOLVED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SOLVED || this == EXHAUSTED;
    }
}
