package FSA.Diagram;

import java.util.List;

/**
 * Renderer-agnostic picture of an automaton: one node per state and one edge per connected ordered pair of
 * states. Node labels are unique and both lists are sorted, so equal automata give equal descriptions.
 */
public record DiagramDescription(List<Node> nodes, List<Edge> edges) {

    public DiagramDescription {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Node startNode() {
        for (Node n : nodes) {
            if (n.start()) {
                return n;
            }
        }
        throw new IllegalStateException("diagram has no start node");
    }

    public record Node(String label, boolean start, boolean accepting) { }

    /**
     * @param label comma-joined, sorted symbols driving {@code source} to {@code target}
     */
    public record Edge(String source, String target, String label) { }
}
