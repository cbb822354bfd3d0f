package FSA;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import FSA.Model.Automaton;
import FSA.Model.TransitionTable;
import net.automatalib.exception.FormatException;

/**
 * Plain-text transition tables:
 * <pre>
 * # comment
 * type: nfa            (nfa, dfa or partial-dfa; nfa if absent)
 * alphabet: 0,1
 * states: q0,q1,q2
 * start: q0
 * accepting: q2
 * q0,ε,q1
 * q1,0,q2
 * </pre>
 * An epsilon row uses {@code ε}, {@code eps} or an empty symbol.
 */
public class TableFormat {
    public static final String NFA = "nfa";
    public static final String DFA = "dfa";
    public static final String PARTIAL_DFA = "partial-dfa";

    private TableFormat() {
    }

    public static TransitionTable readTable(Reader reader) throws IOException, FormatException {
        return parse(reader).table();
    }

    /**
     * Reads a table and builds the automaton its {@code type} line asks for.
     *
     * @throws FormatException if the text is not a table
     * @throws FSA.Model.AutomatonException if the table does not describe a valid automaton of that type
     */
    public static Automaton read(Reader reader) throws IOException, FormatException {
        Parsed parsed = parse(reader);
        return switch (parsed.type()) {
            case NFA -> Automaton.nfa(parsed.table());
            case DFA -> Automaton.dfa(parsed.table());
            case PARTIAL_DFA -> Automaton.dfa(parsed.table(), true);
            default -> throw new FormatException("Unknown automaton type: " + parsed.type());
        };
    }

    public static Automaton getTableFile(String filePath) {
        try (Reader reader = new FileReader(filePath, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    private static Parsed parse(Reader reader) throws IOException, FormatException {
        final TransitionTable.Builder builder = TransitionTable.builder();
        String type = NFA;
        final BufferedReader in = new BufferedReader(reader);
        String line;
        int lineNo = 0;
        while ((line = in.readLine()) != null) {
            lineNo++;
            line = line.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int colon = line.indexOf(':');
            String key = colon < 0 ? null : line.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            if (key != null && isHeader(key)) {
                String value = line.substring(colon + 1).strip();
                switch (key) {
                    case "type" -> type = value.toLowerCase(Locale.ROOT);
                    case "alphabet" -> builder.alphabet(split(value));
                    case "states" -> builder.states(split(value));
                    case "start" -> builder.start(value);
                    case "accepting" -> builder.accepting(split(value));
                    default -> throw new IllegalStateException("Unexpected header: " + key);
                }
                continue;
            }
            String[] cells = line.split(",", -1);
            if (cells.length != 3) {
                throw new FormatException("Line " + lineNo + ": expected source,symbol,destination but got '" + line + "'");
            }
            String symbol = cells[1].strip();
            if (isEpsilon(symbol)) {
                builder.epsilon(cells[0].strip(), cells[2].strip());
            } else {
                builder.transition(cells[0].strip(), symbol, cells[2].strip());
            }
        }
        return new Parsed(builder.build(), type);
    }

    private static boolean isHeader(String key) {
        return switch (key) {
            case "type", "alphabet", "states", "start", "accepting" -> true;
            default -> false;
        };
    }

    static boolean isEpsilon(String symbol) {
        return symbol.isEmpty() || "ε".equals(symbol) || "eps".equalsIgnoreCase(symbol) || "epsilon".equalsIgnoreCase(symbol);
    }

    private static List<String> split(String value) {
        List<String> out = new ArrayList<>();
        if (value.isEmpty()) {
            return out;
        }
        for (String part : value.split(",")) {
            String p = part.strip();
            if (!p.isEmpty()) {
                out.add(p);
            }
        }
        return out;
    }

    private record Parsed(TransitionTable table, String type) { }
}
