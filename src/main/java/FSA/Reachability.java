package FSA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import FSA.Model.Automaton;
import FSA.Model.State;

public class Reachability {

    private Reachability() {
    }

    /**
     * States reachable from the start state over any symbol, epsilon included.
     */
    public static Set<State> accessibleStates(Automaton automaton) {
        final Set<State> seen = new LinkedHashSet<>();
        final Deque<State> stack = new ArrayDeque<>();
        seen.add(automaton.getStartState());
        stack.push(automaton.getStartState());
        while (!stack.isEmpty()) {
            State s = stack.pop();
            for (SortedSet<State> targets : automaton.getTransitions(s).values()) {
                for (State t : targets) {
                    if (seen.add(t)) {
                        stack.push(t);
                    }
                }
            }
        }
        return seen;
    }

    /**
     * States from which some accepting state is reachable, epsilon edges included.
     */
    public static Set<State> coAccessibleStates(Automaton automaton) {
        final Map<State, Set<State>> predecessors = new HashMap<>();
        for (State s : automaton.getStates()) {
            for (SortedSet<State> targets : automaton.getTransitions(s).values()) {
                for (State t : targets) {
                    predecessors.computeIfAbsent(t, k -> new HashSet<>()).add(s);
                }
            }
        }

        final Set<State> seen = new LinkedHashSet<>(automaton.getAcceptingStates());
        final Deque<State> stack = new ArrayDeque<>(seen);
        while (!stack.isEmpty()) {
            State t = stack.pop();
            for (State s : predecessors.getOrDefault(t, Set.of())) {
                if (seen.add(s)) {
                    stack.push(s);
                }
            }
        }
        return seen;
    }

    /**
     * @return {@code automaton} itself if every state is reachable, otherwise a copy restricted to reachable states
     */
    public static Automaton trim(Automaton automaton) {
        final Set<State> states = accessibleStates(automaton);
        if (states.size() == automaton.size()) {
            return automaton;
        }

        final Automaton.Builder out = Automaton.builder(automaton.getType())
            .partial(true)
            .alphabet(automaton.getAlphabet())
            .start(automaton.getStartState());
        for (State s : states) {
            out.addState(s);
            if (automaton.isAccepting(s)) {
                out.addAccepting(s);
            }
            for (Map.Entry<String, SortedSet<State>> e : automaton.getTransitions(s).entrySet()) {
                for (State t : e.getValue()) {
                    out.addTransition(s, e.getKey(), t);
                }
            }
        }
        return out.build();
    }
}
