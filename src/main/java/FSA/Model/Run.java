package FSA.Model;

import java.util.List;
import java.util.SortedSet;

/**
 * Result of simulating an automaton on a word.
 *
 * @param trace    current states before the first symbol and after every consumed symbol
 * @param accepted whether the word is accepted
 * @param dead     whether the run stopped on a symbol with no outgoing transition
 */
public record Run(List<SortedSet<State>> trace, boolean accepted, boolean dead) {

    public Run {
        trace = List.copyOf(trace);
    }

    /**
     * @return number of symbols consumed before the run ended
     */
    public int consumed() {
        return trace.size() - 1;
    }

    public SortedSet<State> finalStates() {
        return trace.get(trace.size() - 1);
    }
}
