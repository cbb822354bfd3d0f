package FSA.Minimize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

import FSA.Model.Automaton;
import FSA.Model.NotDeterministicException;
import FSA.Model.State;
import FSA.Reachability;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * DFA minimization by Moore's partition refinement.
 * <p>
 * Partial DFAs are handled without completing them. A missing transition and a transition into a state that
 * cannot reach acceptance both contribute {@link Signature#DEAD} to a state's signature, so they count as the
 * same invisible dead class. That class becomes a state of the result only when it holds a declared state,
 * e.g. an explicit trap.
 */
public class MooreMinimizer {
    public static boolean DEBUG = false;

    private MooreMinimizer() {
    }

    /**
     * Minimizes {@code dfa} after dropping unreachable states. Each group of the final partition becomes one
     * state, labelled by (and being) its member with the lexicographically smallest label.
     *
     * @param dfa a deterministic automaton, complete or partial
     * @return the minimized DFA and the partitions P0..Pk that led to it
     * @throws NotDeterministicException if {@code dfa} has epsilon edges or several destinations for a pair
     */
    public static MinimizationResult minimize(Automaton dfa) {
        if (!dfa.isDeterministic()) {
            throw new NotDeterministicException("minimization needs a deterministic automaton; determinize it first");
        }
        final Automaton reachable = Reachability.trim(dfa);
        final List<State> states = new ArrayList<>(reachable.getStates());
        final List<String> alphabet = new ArrayList<>(reachable.getAlphabet());
        final Set<State> live = Reachability.coAccessibleStates(reachable);
        final List<RefinementStep> steps = new ArrayList<>();

        Map<State, Signature> initial = new LinkedHashMap<>();
        Partition prev = partitionBy(states,
            s -> new Signature(reachable.isAccepting(s) ? 1 : 0, Collections.emptyList()), initial);
        steps.add(new RefinementStep(0, prev, initial));
        debug(0, prev);

        // each round either splits a group or leaves the partition unchanged, so at most |states| rounds
        for (int round = 1; ; round++) {
            final Partition current = prev;
            Map<State, Signature> signatures = new LinkedHashMap<>();
            Partition next = partitionBy(states, s -> signature(reachable, alphabet, live, current, s), signatures);
            steps.add(new RefinementStep(round, next, signatures));
            debug(round, next);
            if (next.groupCount() == current.groupCount()) {
                break;
            }
            prev = next;
        }

        return new MinimizationResult(quotient(reachable, prev), steps);
    }

    private static Signature signature(Automaton dfa, List<String> alphabet, Set<State> live,
                                       Partition partition, State s) {
        List<Integer> successors = new ArrayList<>(alphabet.size());
        for (String a : alphabet) {
            State t = dfa.getSuccessor(s, a);
            successors.add(t == null || !live.contains(t) ? Signature.DEAD : partition.groupOf(t));
        }
        return new Signature(partition.groupOf(s), successors);
    }

    /**
     * Groups {@code states} by equal signature. Iterating in sorted order makes every group's id the order of
     * its smallest member.
     */
    private static Partition partitionBy(List<State> states,
                                         Function<State, Signature> signatureOf,
                                         Map<State, Signature> signatures) {
        final Object2IntMap<Signature> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(-1);
        final List<SortedSet<State>> groups = new ArrayList<>();
        for (State s : states) {
            Signature sig = signatureOf.apply(s);
            signatures.put(s, sig);
            int id = ids.getInt(sig);
            if (id < 0) {
                id = groups.size();
                ids.put(sig, id);
                groups.add(new TreeSet<>());
            }
            groups.get(id).add(s);
        }
        return new Partition(groups);
    }

    /**
     * Collapses every group into its representative. Members of a group agree on acceptance and on the group
     * of each successor, so the representative's transitions stand for all of them.
     */
    private static Automaton quotient(Automaton dfa, Partition partition) {
        final Automaton.Builder out = Automaton.builder(Automaton.Type.DFA)
            .partial(true)
            .alphabet(dfa.getAlphabet());
        for (int id = 0; id < partition.groupCount(); id++) {
            State rep = partition.representative(id);
            out.addState(rep);
            if (dfa.isAccepting(rep)) {
                out.addAccepting(rep);
            }
            for (String a : dfa.getAlphabet()) {
                State t = dfa.getSuccessor(rep, a);
                if (t != null) {
                    out.addTransition(rep, a, partition.representative(partition.groupOf(t)));
                }
            }
        }
        out.start(partition.representative(partition.groupOf(dfa.getStartState())));
        return out.build();
    }

    private static void debug(int round, Partition partition) {
        if (DEBUG) {
            System.out.println("DEBUG: Round " + round + ": " + partition.groupCount() + " groups - " + partition);
        }
    }
}
