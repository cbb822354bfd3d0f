package FSA.Model;

/**
 * Base class of the errors raised when an automaton cannot be built or processed as requested.
 */
public abstract class AutomatonException extends IllegalArgumentException {

    protected AutomatonException(String message) {
        super(message);
    }
}
