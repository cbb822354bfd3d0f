package FSA;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import FSA.Model.Automaton;
import FSA.Model.EpsilonClosure;
import FSA.Model.NotDeterministicException;
import FSA.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion of engine automata into AutomataLib's compact representations. State {@code i} of the result is the
 * {@code i}-th state of {@link Automaton#getStates()}.
 */
public class AutomataLibExport {

    private AutomataLibExport() {
    }

    /**
     * Epsilon edges are removed: a state accepts if its closure holds an accepting state, and its successors on
     * a symbol are the closure of what its closure reaches on that symbol.
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(automaton.getAlphabet());
        final CompactNFA<String> out = new CompactNFA<>(alphabet, automaton.size());
        final Map<State, Integer> ids = new HashMap<>();

        for (State s : automaton.getStates()) {
            boolean acc = false;
            for (State c : EpsilonClosure.of(automaton, Collections.singleton(s))) {
                acc |= automaton.isAccepting(c);
            }
            ids.put(s, out.addState(acc));
        }
        out.setInitial(ids.get(automaton.getStartState()), true);

        for (State s : automaton.getStates()) {
            SortedSet<State> closure = EpsilonClosure.of(automaton, Collections.singleton(s));
            for (String a : alphabet) {
                Set<State> move = new LinkedHashSet<>();
                for (State c : closure) {
                    move.addAll(automaton.getTransitions(c, a));
                }
                for (State t : EpsilonClosure.of(automaton, move)) {
                    out.addTransition(ids.get(s), a, ids.get(t));
                }
            }
        }
        return out;
    }

    /**
     * @return a DFA with the same (possibly partial) transition structure
     * @throws NotDeterministicException if {@code dfa} is not deterministic
     */
    public static CompactDFA<String> toCompactDFA(Automaton dfa) {
        if (!dfa.isDeterministic()) {
            throw new NotDeterministicException("only deterministic automata can be exported as a DFA");
        }
        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        final CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());
        final Map<State, Integer> ids = new HashMap<>();

        for (State s : dfa.getStates()) {
            ids.put(s, out.addState(dfa.isAccepting(s)));
        }
        out.setInitialState(ids.get(dfa.getStartState()));

        for (State s : dfa.getStates()) {
            for (String a : alphabet) {
                State t = dfa.getSuccessor(s, a);
                if (t != null) {
                    out.setTransition(ids.get(s), a, ids.get(t));
                }
            }
        }
        return out;
    }
}
