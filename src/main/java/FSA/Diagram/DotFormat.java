package FSA.Diagram;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Writes a {@link DiagramDescription} as Graphviz DOT text.
 */
public class DotFormat {

    private DotFormat() {
    }

    public static void write(DiagramDescription diagram, Appendable out) throws IOException {
        final String marker = startMarker(diagram);
        out.append("digraph automaton {\n");
        out.append("  rankdir=LR;\n");
        out.append("  ").append(marker).append(" [shape=point];\n");
        for (DiagramDescription.Node node : diagram.nodes()) {
            out.append("  ").append(quote(node.label()))
                .append(" [shape=").append(node.accepting() ? "doublecircle" : "circle").append("];\n");
        }
        for (DiagramDescription.Node node : diagram.nodes()) {
            if (node.start()) {
                out.append("  ").append(marker).append(" -> ").append(quote(node.label())).append(";\n");
            }
        }
        for (DiagramDescription.Edge edge : diagram.edges()) {
            out.append("  ").append(quote(edge.source()))
                .append(" -> ").append(quote(edge.target()))
                .append(" [label=").append(quote(edge.label())).append("];\n");
        }
        out.append("}\n");
    }

    public static String toDot(DiagramDescription diagram) {
        StringBuilder sb = new StringBuilder();
        try {
            write(diagram, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * ID of the invisible node pointing at the start state. DOT treats {@code __start} and {@code "__start"} as
     * the same node, so underscores are prepended until no state has that label.
     */
    static String startMarker(DiagramDescription diagram) {
        final Set<String> labels = new HashSet<>();
        for (DiagramDescription.Node node : diagram.nodes()) {
            labels.add(node.label());
        }
        String marker = "__start";
        while (labels.contains(marker)) {
            marker = "_" + marker;
        }
        return marker;
    }

    static String quote(String id) {
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
