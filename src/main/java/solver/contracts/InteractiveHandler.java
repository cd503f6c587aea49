package solver.contracts;

/**
 * Console front-end. An implementation reads feedback and commands line by line
 * and prints suggestions until "quit"/"exit" or the end of input.
 */
public interface InteractiveHandler {

    /**
     * Starts the main loop that continuously reads and processes lines until a
     * quit command is received or the input stream is closed.
     */
    void runLoop();
}
