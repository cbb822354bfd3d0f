package FSA.Diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import FSA.Model.Automaton;
import FSA.Model.State;

public class DiagramGenerator {
    /** Edge label of epsilon transitions. */
    public static final String EPSILON_LABEL = "ε";

    private DiagramGenerator() {
    }

    /**
     * Describes {@code automaton} for display. Parallel edges are merged into one whose label lists the symbols
     * in sorted order, epsilon last. Missing transitions produce nothing.
     */
    public static DiagramDescription describe(Automaton automaton) {
        final List<DiagramDescription.Node> nodes = new ArrayList<>(automaton.size());
        for (State s : automaton.getStates()) {
            nodes.add(new DiagramDescription.Node(
                s.label(), s.equals(automaton.getStartState()), automaton.isAccepting(s)));
        }

        final List<DiagramDescription.Edge> edges = new ArrayList<>();
        for (State s : automaton.getStates()) {
            // target -> symbols, both in state/symbol order
            Map<State, SortedSet<String>> merged = new TreeMap<>();
            automaton.getTransitions(s).forEach((symbol, targets) -> {
                for (State t : targets) {
                    merged.computeIfAbsent(t, k -> new TreeSet<>()).add(symbol);
                }
            });
            merged.forEach((t, symbols) -> edges.add(
                new DiagramDescription.Edge(s.label(), t.label(), edgeLabel(symbols))));
        }
        return new DiagramDescription(nodes, edges);
    }

    private static String edgeLabel(SortedSet<String> symbols) {
        List<String> parts = new ArrayList<>(symbols.size());
        boolean epsilon = false;
        for (String symbol : symbols) {
            if (Automaton.EPSILON.equals(symbol)) {
                epsilon = true;
            } else {
                parts.add(symbol);
            }
        }
        if (epsilon) {
            parts.add(EPSILON_LABEL);
        }
        return String.join(",", parts);
    }
}
