package FSA;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import FSA.Model.AtomicState;
import FSA.Model.Automaton;
import FSA.Model.State;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * Reading and writing automata in the BA format
 * (<a href="https://languageinclusion.org/doku.php?id=tools">described here</a>).
 */
public class BAFormat {
    /** Label of the extra start state added when a BA file has several initial states. */
    public static final String INIT_LABEL = "init";

    /*
    Parsing is AutomataLib's; we convert from the CompactNFA<String> it returns
     */
    public static Automaton read(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        final int states = automaton.size();

        final Automaton.Builder out = Automaton.builder(Automaton.Type.NFA)
            .alphabet(automaton.getInputAlphabet());
        final List<State> labelled = new ArrayList<>(states);
        for (int i = 0; i < states; i++) {
            State s = AtomicState.of("s" + i);
            labelled.add(s);
            out.addState(s);
            if (automaton.isAccepting(i)) {
                out.addAccepting(s);
            }
        }

        Set<Integer> initialStates = automaton.getInitialStates();
        if (initialStates.size() == 1) {
            out.start(labelled.get(initialStates.iterator().next()));
        } else {
            State init = AtomicState.of(INIT_LABEL);
            out.addState(init).start(init);
            for (int i : initialStates) {
                out.addTransition(init, Automaton.EPSILON, labelled.get(i));
            }
        }

        for (int i = 0; i < states; i++) {
            for (String a : automaton.getInputAlphabet()) {
                for (int t : automaton.getTransitions(i, a)) {
                    out.addTransition(labelled.get(i), a, labelled.get(t));
                }
            }
        }
        return out.build();
    }

    /**
     * Deterministic automata are written as a DFA, anything else as its epsilon-free NFA.
     */
    public static void write(OutputStream os, Automaton automaton) throws IOException {
        if (automaton.isDeterministic()) {
            final CompactDFA<String> compact = AutomataLibExport.toCompactDFA(automaton);
            new BAWriter<String>().writeModel(os, compact, compact.getInputAlphabet());
        } else {
            final CompactNFA<String> compact = AutomataLibExport.toCompactNFA(automaton);
            new BAWriter<String>().writeModel(os, compact, compact.getInputAlphabet());
        }
    }

    static Automaton getBAFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    static void writeBAFile(String filePath, Automaton automaton) {
        try (OutputStream os = new FileOutputStream(filePath)) {
            write(os, automaton);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
