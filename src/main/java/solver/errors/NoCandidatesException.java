package solver.errors;

/**
 * A guess was requested while no candidate is consistent with the feedback
 * received so far. Either the feedback source made a mistake or a filter is broken.
 */
public class NoCandidatesException extends IllegalStateException {

    public NoCandidatesException(String message) {
        super(message);
    }
}
