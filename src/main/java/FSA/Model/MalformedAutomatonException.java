package FSA.Model;

/**
 * The start state, an accepting state, or a transition refers to a state or symbol that was not declared.
 */
public class MalformedAutomatonException extends AutomatonException {

    public MalformedAutomatonException(String message) {
        super(message);
    }
}
