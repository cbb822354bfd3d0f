package FSA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable NFA or DFA over string symbols.
 * <p>
 * A DFA may be partial: a missing {@code (state, symbol)} entry stands for an implicit, non-accepting dead state
 * that is never part of {@link #getStates()}. Simulating such a symbol rejects immediately.
 * <p>
 * Instances are only created through {@link #nfa(TransitionTable)}, {@link #dfa(TransitionTable, boolean)} or a
 * {@link Builder}; all of them validate the structure before an automaton becomes visible.
 */
public final class Automaton {
    public static final String EPSILON = TransitionTable.EPSILON;

    public enum Type { NFA, DFA }

    private final Type type;
    private final SortedSet<String> alphabet;
    private final SortedSet<State> states;
    private final State start;
    private final SortedSet<State> accepting;
    private final Map<State, SortedMap<String, SortedSet<State>>> transitions;
    private final Map<String, State> byLabel;

    private Automaton(Type type,
                      SortedSet<String> alphabet,
                      SortedSet<State> states,
                      State start,
                      SortedSet<State> accepting,
                      Map<State, SortedMap<String, SortedSet<State>>> transitions) {
        this.type = type;
        this.alphabet = Collections.unmodifiableSortedSet(alphabet);
        this.states = Collections.unmodifiableSortedSet(states);
        this.start = start;
        this.accepting = Collections.unmodifiableSortedSet(accepting);
        this.transitions = transitions;
        this.byLabel = new HashMap<>();
        for (State s : states) {
            byLabel.put(s.label(), s);
        }
    }

    /**
     * Builds an NFA from a transition table. Epsilon rows are allowed.
     *
     * @throws MalformedAutomatonException if the table refers to undeclared states or symbols
     */
    public static Automaton nfa(TransitionTable table) {
        return fromTable(table, Type.NFA, false);
    }

    /**
     * Builds a complete DFA: every (state, symbol) pair needs exactly one destination.
     *
     * @throws MalformedAutomatonException if the table refers to undeclared states or symbols
     * @throws NonDeterministicTableException if the table is not deterministic and complete
     */
    public static Automaton dfa(TransitionTable table) {
        return dfa(table, false);
    }

    /**
     * Builds a DFA.
     *
     * @param partial whether (state, symbol) pairs without a destination are allowed
     * @throws MalformedAutomatonException if the table refers to undeclared states or symbols
     * @throws NonDeterministicTableException if a pair has several destinations, an epsilon row exists,
     *                                        or (outside partial mode) a pair has none
     */
    public static Automaton dfa(TransitionTable table, boolean partial) {
        return fromTable(table, Type.DFA, partial);
    }

    private static Automaton fromTable(TransitionTable table, Type type, boolean partial) {
        Builder builder = new Builder(type).partial(partial);
        builder.alphabet(table.getAlphabet());
        for (String label : table.getStates()) {
            builder.addState(AtomicState.of(label));
        }
        if (table.getStart() != null) {
            builder.start(AtomicState.of(table.getStart()));
        }
        for (String label : table.getAccepting()) {
            builder.addAccepting(AtomicState.of(label));
        }
        for (TransitionTable.Row row : table.getRows()) {
            builder.addTransition(AtomicState.of(row.source()), row.symbol(), AtomicState.of(row.destination()));
        }
        return builder.build();
    }

    public static Builder builder(Type type) {
        return new Builder(type);
    }

    public Type getType() {
        return type;
    }

    public SortedSet<String> getAlphabet() {
        return alphabet;
    }

    public SortedSet<State> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public State getStartState() {
        return start;
    }

    public SortedSet<State> getAcceptingStates() {
        return accepting;
    }

    public boolean isAccepting(State state) {
        return accepting.contains(state);
    }

    /**
     * @return the state with the given label, or {@code null}
     */
    public State getState(String label) {
        return byLabel.get(label);
    }

    /**
     * @return all outgoing transitions of {@code state}, keyed by symbol (epsilon included)
     */
    public SortedMap<String, SortedSet<State>> getTransitions(State state) {
        SortedMap<String, SortedSet<State>> out = transitions.get(state);
        return out == null ? Collections.emptySortedMap() : out;
    }

    /**
     * @return the destinations of {@code (state, symbol)}; empty if there are none
     */
    public SortedSet<State> getTransitions(State state, String symbol) {
        SortedSet<State> targets = getTransitions(state).get(symbol);
        return targets == null ? Collections.emptySortedSet() : targets;
    }

    public SortedSet<State> getEpsilonTransitions(State state) {
        return getTransitions(state, EPSILON);
    }

    /**
     * @return the unique destination of {@code (state, symbol)}, or {@code null} for the implicit dead state
     * @throws NotDeterministicException if the pair has several destinations
     */
    public State getSuccessor(State state, String symbol) {
        SortedSet<State> targets = getTransitions(state, symbol);
        if (targets.isEmpty()) {
            return null;
        }
        if (targets.size() > 1) {
            throw new NotDeterministicException(
                state.label() + " has " + targets.size() + " transitions on '" + symbol + "'");
        }
        return targets.first();
    }

    public boolean hasEpsilonTransitions() {
        for (State s : states) {
            if (!getEpsilonTransitions(s).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Structural determinism: no epsilon edges and at most one destination per (state, symbol).
     * An automaton of type {@link Type#NFA} may still be deterministic.
     */
    public boolean isDeterministic() {
        for (SortedMap<String, SortedSet<State>> out : transitions.values()) {
            for (Map.Entry<String, SortedSet<State>> e : out.entrySet()) {
                if (EPSILON.equals(e.getKey()) || e.getValue().size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return whether every (state, symbol) pair has at least one destination
     */
    public boolean isComplete() {
        for (State s : states) {
            for (String a : alphabet) {
                if (getTransitions(s, a).isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean accepts(List<String> word) {
        return run(word).accepted();
    }

    /**
     * Convenience for alphabets of one-character symbols: every character of {@code word} is one symbol.
     */
    public boolean accepts(String word) {
        return accepts(symbols(word));
    }

    /**
     * Simulates the automaton on {@code word}, recording the (epsilon-closed) set of current states after each
     * symbol. The run stops early, and is rejected, once no state is left.
     */
    public Run run(List<String> word) {
        List<SortedSet<State>> trace = new ArrayList<>(word.size() + 1);
        SortedSet<State> current = EpsilonClosure.of(this, Collections.singleton(start));
        trace.add(Collections.unmodifiableSortedSet(current));
        for (String symbol : word) {
            if (!alphabet.contains(symbol)) {
                return new Run(trace, false, true);
            }
            Set<State> moved = new LinkedHashSet<>();
            for (State s : current) {
                moved.addAll(getTransitions(s, symbol));
            }
            if (moved.isEmpty()) {
                return new Run(trace, false, true);
            }
            current = EpsilonClosure.of(this, moved);
            trace.add(Collections.unmodifiableSortedSet(current));
        }
        boolean acc = false;
        for (State s : current) {
            acc |= accepting.contains(s);
        }
        return new Run(trace, acc, false);
    }

    public Run run(String word) {
        return run(symbols(word));
    }

    static List<String> symbols(String word) {
        List<String> symbols = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }

    @Override
    public String toString() {
        return type + "[states=" + states + ", alphabet=" + alphabet + ", start=" + start
            + ", accepting=" + accepting + "]";
    }

    /**
     * Accumulates states, symbols and transitions; {@link #build()} validates and freezes them.
     */
    public static final class Builder {
        private final Type type;
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<State> states = new LinkedHashSet<>();
        private final Set<State> accepting = new LinkedHashSet<>();
        private final Map<State, Map<String, Set<State>>> transitions = new LinkedHashMap<>();
        private State start;
        private boolean partial;

        private Builder(Type type) {
            this.type = type;
        }

        public Builder partial(boolean partial) {
            this.partial = partial;
            return this;
        }

        public Builder alphabet(Collection<String> symbols) {
            alphabet.addAll(symbols);
            return this;
        }

        public Builder addState(State state) {
            states.add(state);
            return this;
        }

        public Builder start(State state) {
            this.start = state;
            return this;
        }

        public Builder addAccepting(State state) {
            accepting.add(state);
            return this;
        }

        public Builder addTransition(State source, String symbol, State destination) {
            transitions.computeIfAbsent(source, k -> new LinkedHashMap<>())
                .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                .add(destination);
            return this;
        }

        public Automaton build() {
            validateStructure();
            if (type == Type.DFA) {
                validateDeterminism();
            }

            Map<State, SortedMap<String, SortedSet<State>>> frozen = new HashMap<>();
            for (Map.Entry<State, Map<String, Set<State>>> e : transitions.entrySet()) {
                SortedMap<String, SortedSet<State>> out = new TreeMap<>();
                for (Map.Entry<String, Set<State>> t : e.getValue().entrySet()) {
                    out.put(t.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(t.getValue())));
                }
                frozen.put(e.getKey(), Collections.unmodifiableSortedMap(out));
            }
            return new Automaton(type, new TreeSet<>(alphabet), new TreeSet<>(states), start,
                new TreeSet<>(accepting), frozen);
        }

        private void validateStructure() {
            Set<String> labels = new HashSet<>();
            for (State s : states) {
                if (!labels.add(s.label())) {
                    throw new MalformedAutomatonException("two distinct states are labelled " + s.label());
                }
            }
            if (alphabet.contains(EPSILON)) {
                throw new MalformedAutomatonException("the alphabet must not contain the epsilon symbol");
            }
            if (start == null) {
                throw new MalformedAutomatonException("no start state given");
            }
            if (!states.contains(start)) {
                throw new MalformedAutomatonException("start state " + start.label() + " is not a declared state");
            }
            for (State s : accepting) {
                if (!states.contains(s)) {
                    throw new MalformedAutomatonException("accepting state " + s.label() + " is not a declared state");
                }
            }
            for (Map.Entry<State, Map<String, Set<State>>> e : transitions.entrySet()) {
                State source = e.getKey();
                if (!states.contains(source)) {
                    throw new MalformedAutomatonException("transition source " + source.label() + " is not a declared state");
                }
                for (Map.Entry<String, Set<State>> t : e.getValue().entrySet()) {
                    String symbol = t.getKey();
                    if (!EPSILON.equals(symbol) && !alphabet.contains(symbol)) {
                        throw new MalformedAutomatonException(
                            "transition " + source.label() + " -" + symbol + "-> uses undeclared symbol '" + symbol + "'");
                    }
                    for (State destination : t.getValue()) {
                        if (!states.contains(destination)) {
                            throw new MalformedAutomatonException(
                                "transition destination " + destination.label() + " is not a declared state");
                        }
                    }
                }
            }
        }

        private void validateDeterminism() {
            for (State s : states) {
                Map<String, Set<State>> out = transitions.getOrDefault(s, Collections.emptyMap());
                if (out.containsKey(EPSILON)) {
                    throw new NonDeterministicTableException("epsilon transition from " + s.label() + " in a DFA");
                }
                for (String a : alphabet) {
                    int count = out.getOrDefault(a, Collections.emptySet()).size();
                    if (count > 1) {
                        throw new NonDeterministicTableException(
                            s.label() + " has " + count + " destinations on '" + a + "'");
                    }
                    if (count == 0 && !partial) {
                        throw new NonDeterministicTableException(
                            s.label() + " has no destination on '" + a + "' and partial mode was not requested");
                    }
                }
            }
        }
    }
}
