package FSA;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

import FSA.Model.Automaton;
import FSA.Model.State;

/**
 * Regular expression of an automaton's language, by state elimination on a generalized NFA.
 * <p>
 * Output syntax: juxtaposition for concatenation, {@code |}, {@code *}, parentheses, and {@code ()} for the empty
 * word. Inside a symbol, the operator characters {@code |*()} and the backslash are escaped with a backslash, so
 * the output is also a valid {@link java.util.regex.Pattern}. Multi-character symbols are parenthesized.
 */
public class RegexConverter {
    private static final int UNION = 0;
    private static final int CONCAT = 1;
    private static final int STAR = 2;
    private static final int ATOM = 3;
    private static final String OPERATORS = "|*()\\";

    private RegexConverter() {
    }

    /**
     * @return the expression, or empty if the automaton accepts no word at all
     */
    public static Optional<String> toRegex(Automaton automaton) {
        final List<State> states = new ArrayList<>(automaton.getStates());
        final int n = states.size();
        final int init = n;
        final int fin = n + 1;
        final Map<State, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(states.get(i), i);
        }

        // r[i][j]: expression for going from i to j; null means no edge
        final Rx[][] r = new Rx[n + 2][n + 2];
        r[init][index.get(automaton.getStartState())] = Rx.EMPTY_WORD;
        for (State s : states) {
            int i = index.get(s);
            if (automaton.isAccepting(s)) {
                r[i][fin] = Rx.EMPTY_WORD;
            }
            for (Map.Entry<String, SortedSet<State>> e : automaton.getTransitions(s).entrySet()) {
                Rx symbol = Automaton.EPSILON.equals(e.getKey()) ? Rx.EMPTY_WORD : Rx.symbol(e.getKey());
                for (State t : e.getValue()) {
                    int j = index.get(t);
                    r[i][j] = union(r[i][j], symbol);
                }
            }
        }

        // eliminate states in label order; init and fin are never eliminated
        for (int k = 0; k < n; k++) {
            Rx loop = star(r[k][k]);
            for (int i = k + 1; i < n + 2; i++) {
                if (r[i][k] == null) {
                    continue;
                }
                for (int j = k + 1; j < n + 2; j++) {
                    if (r[k][j] != null) {
                        r[i][j] = union(r[i][j], concat(concat(r[i][k], loop), r[k][j]));
                    }
                }
            }
        }

        Rx result = r[init][fin];
        return result == null ? Optional.empty() : Optional.of(result.render());
    }

    private static Rx union(Rx a, Rx b) {
        if (a == null) {
            return b;
        }
        if (b == null || a.equals(b)) {
            return a;
        }
        return new Rx(a.render() + "|" + b.render(), UNION);
    }

    private static Rx concat(Rx a, Rx b) {
        if (a.isEmptyWord()) {
            return b;
        }
        if (b.isEmptyWord()) {
            return a;
        }
        return new Rx(a.wrapBelow(CONCAT) + b.wrapBelow(CONCAT), CONCAT);
    }

    private static Rx star(Rx a) {
        if (a == null || a.isEmptyWord()) {
            return Rx.EMPTY_WORD;
        }
        if (a.precedence() == STAR) {
            return a;
        }
        return new Rx(a.wrapBelow(ATOM) + "*", STAR);
    }

    private record Rx(String text, int precedence) {
        static final Rx EMPTY_WORD = new Rx("", ATOM);

        static Rx symbol(String symbol) {
            StringBuilder escaped = new StringBuilder(symbol.length() + 2);
            for (char c : symbol.toCharArray()) {
                if (OPERATORS.indexOf(c) >= 0) {
                    escaped.append('\\');
                }
                escaped.append(c);
            }
            return symbol.codePointCount(0, symbol.length()) == 1
                ? new Rx(escaped.toString(), ATOM)
                : new Rx("(" + escaped + ")", ATOM);
        }

        boolean isEmptyWord() {
            return text.isEmpty();
        }

        String render() {
            return isEmptyWord() ? "()" : text;
        }

        String wrapBelow(int required) {
            return precedence < required ? "(" + render() + ")" : render();
        }
    }
}
