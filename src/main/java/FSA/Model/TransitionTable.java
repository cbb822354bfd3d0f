package FSA.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Caller-supplied description of an automaton in terms of plain labels: declared states, alphabet,
 * start state, accepting states and {@code (source, symbol, destination)} rows. Nothing is checked here;
 * {@link Automaton#nfa(TransitionTable)} and {@link Automaton#dfa(TransitionTable, boolean)} validate.
 */
public final class TransitionTable {
    /** Symbol of an epsilon row. */
    public static final String EPSILON = "";

    private final Set<String> states;
    private final Set<String> alphabet;
    private final String start;
    private final Set<String> accepting;
    private final List<Row> rows;

    private TransitionTable(Builder builder) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(builder.alphabet));
        this.start = builder.start;
        this.accepting = Collections.unmodifiableSet(new LinkedHashSet<>(builder.accepting));
        this.rows = List.copyOf(builder.rows);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getStates() {
        return states;
    }

    public Set<String> getAlphabet() {
        return alphabet;
    }

    public String getStart() {
        return start;
    }

    public Set<String> getAccepting() {
        return accepting;
    }

    public List<Row> getRows() {
        return rows;
    }

    public record Row(String source, String symbol, String destination) {

        public Row {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(destination, "destination");
        }

        public boolean isEpsilon() {
            return EPSILON.equals(symbol);
        }

        @Override
        public String toString() {
            return source + " -" + (isEpsilon() ? "ε" : symbol) + "-> " + destination;
        }
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> accepting = new LinkedHashSet<>();
        private final List<Row> rows = new ArrayList<>();
        private String start;

        private Builder() {
        }

        public Builder states(String... labels) {
            return states(Arrays.asList(labels));
        }

        public Builder states(Collection<String> labels) {
            states.addAll(labels);
            return this;
        }

        public Builder alphabet(String... symbols) {
            return alphabet(Arrays.asList(symbols));
        }

        public Builder alphabet(Collection<String> symbols) {
            alphabet.addAll(symbols);
            return this;
        }

        public Builder start(String label) {
            this.start = label;
            return this;
        }

        public Builder accepting(String... labels) {
            return accepting(Arrays.asList(labels));
        }

        public Builder accepting(Collection<String> labels) {
            accepting.addAll(labels);
            return this;
        }

        public Builder transition(String source, String symbol, String destination) {
            rows.add(new Row(source, symbol, destination));
            return this;
        }

        /** Adds one row per destination. */
        public Builder transitions(String source, String symbol, String... destinations) {
            for (String destination : destinations) {
                transition(source, symbol, destination);
            }
            return this;
        }

        public Builder epsilon(String source, String destination) {
            return transition(source, EPSILON, destination);
        }

        public TransitionTable build() {
            return new TransitionTable(this);
        }
    }
}
