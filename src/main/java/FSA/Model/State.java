package FSA.Model;

/**
 * A state of an {@link Automaton}. States are compared and ordered by their canonical label.
 */
public interface State extends Comparable<State> {

    /**
     * @return the canonical label used for ordering, tie-breaking and display
     */
    String label();

    @Override
    default int compareTo(State other) {
        return label().compareTo(other.label());
    }
}
