package FSA.Model;

/**
 * An operation that needs a deterministic automaton was given one with epsilon edges or multiple destinations.
 */
public class NotDeterministicException extends AutomatonException {

    public NotDeterministicException(String message) {
        super(message);
    }
}
