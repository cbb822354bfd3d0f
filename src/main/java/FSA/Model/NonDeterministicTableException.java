package FSA.Model;

/**
 * A transition table given for a DFA has an epsilon row, more than one destination for a (state, symbol) pair,
 * or (outside partial mode) no destination for one.
 */
public class NonDeterministicTableException extends AutomatonException {

    public NonDeterministicTableException(String message) {
        super(message);
    }
}
