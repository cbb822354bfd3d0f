package FSA.Minimize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import FSA.Model.State;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Split of a state set into disjoint groups. Group ids are list indices, assigned in order of each group's
 * smallest member, so equal partitions always carry equal ids.
 */
public final class Partition {
    private final List<SortedSet<State>> groups;
    private final Object2IntMap<State> groupOf;

    Partition(List<? extends SortedSet<State>> groups) {
        List<SortedSet<State>> frozen = new ArrayList<>(groups.size());
        this.groupOf = new Object2IntOpenHashMap<>();
        this.groupOf.defaultReturnValue(-1);
        for (int id = 0; id < groups.size(); id++) {
            SortedSet<State> group = Collections.unmodifiableSortedSet(new TreeSet<>(groups.get(id)));
            frozen.add(group);
            for (State s : group) {
                groupOf.put(s, id);
            }
        }
        this.groups = Collections.unmodifiableList(frozen);
    }

    public int groupCount() {
        return groups.size();
    }

    public List<SortedSet<State>> getGroups() {
        return groups;
    }

    public SortedSet<State> getGroup(int id) {
        return groups.get(id);
    }

    /**
     * @return the id of the group holding {@code state}
     * @throws IllegalArgumentException if the state is not partitioned here
     */
    public int groupOf(State state) {
        int id = groupOf.getInt(state);
        if (id < 0) {
            throw new IllegalArgumentException(state.label() + " is not part of this partition");
        }
        return id;
    }

    public boolean contains(State state) {
        return groupOf.containsKey(state);
    }

    /**
     * @return the group's smallest member label, which also labels the group in the minimized DFA
     */
    public State representative(int id) {
        return groups.get(id).first();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Partition other && groups.equals(other.groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        List<String> out = new ArrayList<>(groups.size());
        for (SortedSet<State> g : groups) {
            List<String> labels = new ArrayList<>(g.size());
            for (State s : g) {
                labels.add(s.label());
            }
            out.add("{" + String.join(", ", labels) + "}");
        }
        return String.join(" ", out);
    }
}
