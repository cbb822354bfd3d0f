package FSA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * A DFA state standing for a set of states of the automaton it was derived from.
 * Identity is the member set; the label lists the members in sorted order, e.g. {@code {q0,q1}}.
 */
public final class CompositeState implements State {
    private final SortedSet<State> members;
    private final String label;

    public CompositeState(Collection<? extends State> members) {
        this.members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
        this.label = canonicalLabel(this.members);
    }

    /**
     * Canonical key of a set of states: sorted member labels, comma-joined, in set notation.
     * Two collections with the same members always produce the same key.
     */
    public static String canonicalLabel(Collection<? extends State> states) {
        StringJoiner joiner = new StringJoiner(",", "{", "}");
        for (State s : new TreeSet<State>(states)) {
            joiner.add(s.label());
        }
        return joiner.toString();
    }

    public SortedSet<State> members() {
        return members;
    }

    public boolean contains(State state) {
        return members.contains(state);
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompositeState other)) {
            return false;
        }
        return members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
