package FSA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import FSA.Model.Automaton;
import FSA.Model.CompositeState;
import FSA.Model.EpsilonClosure;
import FSA.Model.State;

/**
 * NFA to DFA conversion by subset construction. The DFA's states are {@link CompositeState}s holding the NFA
 * states they represent, and empty targets are left out, so the result is a partial DFA.
 */
public class SubsetConstruction {
    public static boolean DEBUG = false;

    private SubsetConstruction() {
    }

    /**
     * @param nfa any automaton; epsilon edges are followed through closures
     * @return the DFA together with every move explored to build it
     */
    public static Result determinize(Automaton nfa) {
        final Automaton.Builder out = Automaton.builder(Automaton.Type.DFA)
            .partial(true)
            .alphabet(nfa.getAlphabet());
        final List<Step> steps = new ArrayList<>();

        // composite states are looked up by canonical key, never by discovery order
        Map<String, CompositeState> outStateMap = new HashMap<>();
        Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        SortedSet<State> init = EpsilonClosure.of(nfa, Collections.singleton(nfa.getStartState()));
        CompositeState initOut = register(nfa, init, out, outStateMap);
        out.start(initOut);
        stack.push(new DeterminizeRecord(init, initOut));

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();

            for (String sym : nfa.getAlphabet()) {
                Set<State> move = new LinkedHashSet<>();
                for (State s : curr.inputState()) {
                    move.addAll(nfa.getTransitions(s, sym));
                }
                SortedSet<State> succ = EpsilonClosure.of(nfa, move);

                if (succ.isEmpty()) {
                    steps.add(new Step(curr.outputState(), sym, move, null));
                    continue;
                }
                CompositeState outSucc = outStateMap.get(CompositeState.canonicalLabel(succ));
                if (outSucc == null) {
                    // add new state to DFA and to stack
                    outSucc = register(nfa, succ, out, outStateMap);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.addTransition(curr.outputState(), sym, outSucc);
                steps.add(new Step(curr.outputState(), sym, move, outSucc));
            }
        }

        Automaton dfa = out.build();
        if (DEBUG) {
            System.out.println("DEBUG: Subset construction: " + nfa.size() + " NFA states -> " + dfa.size() + " DFA states");
        }
        return new Result(dfa, steps);
    }

    private static CompositeState register(Automaton nfa,
                                           SortedSet<State> members,
                                           Automaton.Builder out,
                                           Map<String, CompositeState> outStateMap) {
        CompositeState composite = new CompositeState(members);
        out.addState(composite);
        for (State s : members) {
            if (nfa.isAccepting(s)) {
                out.addAccepting(composite);
                break;
            }
        }
        outStateMap.put(composite.label(), composite);
        if (DEBUG) {
            System.out.println("DEBUG: Discovered " + composite.label());
        }
        return composite;
    }

    /**
     * One explored move of the construction.
     *
     * @param source composite state the move starts from
     * @param symbol input symbol
     * @param move   union of the members' direct successors on {@code symbol}, before closure
     * @param target epsilon closure of {@code move}, or {@code null} when it is empty and no transition is emitted
     */
    public record Step(CompositeState source, String symbol, Set<State> move, CompositeState target) {

        public Step {
            move = Collections.unmodifiableSet(new LinkedHashSet<>(move));
        }

        @Override
        public String toString() {
            return source + " -" + symbol + "-> " + (target == null ? "∅" : target.label());
        }
    }

    public record Result(Automaton dfa, List<Step> steps) {

        public Result {
            steps = List.copyOf(steps);
        }
    }

    private record DeterminizeRecord(SortedSet<State> inputState, CompositeState outputState) { }
}
