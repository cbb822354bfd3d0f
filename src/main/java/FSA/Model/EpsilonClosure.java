package FSA.Model;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Smallest superset of a state set that is closed under epsilon transitions.
 */
public final class EpsilonClosure {

    private EpsilonClosure() {
    }

    /**
     * Worklist traversal: every state reached by one epsilon edge from a state already in the set is added,
     * until nothing new appears.
     *
     * @return a fresh, mutable set; {@code states} is not modified
     */
    public static SortedSet<State> of(Automaton automaton, Collection<? extends State> states) {
        SortedSet<State> closure = new TreeSet<>(states);
        Deque<State> worklist = new ArrayDeque<>(closure);
        while (!worklist.isEmpty()) {
            State s = worklist.pop();
            for (State t : automaton.getEpsilonTransitions(s)) {
                if (closure.add(t)) {
                    worklist.push(t);
                }
            }
        }
        return closure;
    }
}
