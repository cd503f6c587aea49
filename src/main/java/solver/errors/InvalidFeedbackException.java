package solver.errors;

/**
 * A feedback string is not five characters drawn from {@code 0}, {@code 1} and {@code 2}.
 */
public class InvalidFeedbackException extends IllegalArgumentException {

    private final String input;

    public InvalidFeedbackException(String input) {
        super("Invalid feedback '" + input + "': expected 5 digits, each 0, 1 or 2");
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
