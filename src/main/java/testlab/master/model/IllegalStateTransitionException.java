package testlab.master.model;

/**
 * Thrown when a device or job is asked to move to a state its transition
 * table does not allow.
 */
public class IllegalStateTransitionException extends IllegalStateException {

    private final String from;
    private final String to;

    public IllegalStateTransitionException(String entity, String from, String to) {
        super("Illegal " + entity + " transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }
}
