package solver.contracts;

/**
 * Registry of settings that can be changed while the interactive loop runs.
 */
public interface SolverOptions {

    /**
     * Parses a {@code setoption name <name> [value <value>]} line and applies it.
     *
     * @return {@code false} if the option is unknown or the value was rejected
     */
    boolean setOption(String line);

    /** Prints every option with its current value. */
    void printOptions();

    String getOptionValue(String name);

    boolean hardMode();

    /** Maximum candidates listed after each round. */
    int showLimit();

    /** Selector for the current strategy option. */
    GuessSelector selector();
}
