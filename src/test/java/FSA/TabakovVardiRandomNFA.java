package FSA;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import FSA.Model.Automaton;
import FSA.Model.TransitionTable;
import net.automatalib.common.util.random.RandomUtil;

public class TabakovVardiRandomNFA {
    public static final List<String> BINARY = List.of("0", "1");

    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi, plus a number of epsilon edges.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param edgeNum
     *      number of edges (per letter)
     * @param acceptNum
     *      number of accepting states (at least one)
     * @param epsilonNum
     *      number of epsilon edges
     * @return
     *      a random NFA over {0,1}, not necessarily connected
     */
    public static Automaton generateNFA(Random r, int size, int edgeNum, int acceptNum, int epsilonNum) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size*size;

        TransitionTable.Builder table = basicTable(size);

        // per the paper, the first state is always initial and accepting.
        // The other acceptNum-1 final states come from [1,size).
        table.accepting(label(0));
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            table.accepting(label(f));
        }

        for (String a : BINARY) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size*size)) {
                table.transition(label(edgeIndex / size), a, label(edgeIndex % size));
            }
        }
        for (int edgeIndex : RandomUtil.distinctIntegers(r, epsilonNum, size*size)) {
            table.epsilon(label(edgeIndex / size), label(edgeIndex % size));
        }
        return Automaton.nfa(table.build());
    }

    public static Automaton getRandomAutomaton(int randomSeed, int size) {
        final float td = 1.25f;
        final float ad = 0.5f;
        final Random random = new Random(randomSeed);
        return generateNFA(random, size, Math.round(td * size), Math.max(1, Math.round(ad * size)), size / 3);
    }

    /**
     * Random DFA over {0,1}; each transition is left out with probability {@code missing}.
     */
    public static Automaton getRandomDFA(int randomSeed, int size, double missing) {
        final Random random = new Random(randomSeed);
        TransitionTable.Builder table = basicTable(size);
        for (int i = 0; i < size; i++) {
            if (random.nextBoolean()) {
                table.accepting(label(i));
            }
            for (String a : BINARY) {
                if (random.nextDouble() >= missing) {
                    table.transition(label(i), a, label(random.nextInt(size)));
                }
            }
        }
        return Automaton.dfa(table.build(), missing > 0);
    }

    /**
     * @return every word over {@code alphabet} of length at most {@code maxLength}, shortest first
     */
    public static List<List<String>> allWords(List<String> alphabet, int maxLength) {
        List<List<String>> words = new ArrayList<>();
        words.add(List.of());
        int from = 0;
        for (int len = 1; len <= maxLength; len++) {
            int to = words.size();
            for (int w = from; w < to; w++) {
                for (String a : alphabet) {
                    List<String> longer = new ArrayList<>(words.get(w));
                    longer.add(a);
                    words.add(longer);
                }
            }
            from = to;
        }
        return words;
    }

    static String label(int i) {
        return "q" + i;
    }

    static TransitionTable.Builder basicTable(int size) {
        TransitionTable.Builder table = TransitionTable.builder().alphabet(BINARY).start(label(0));
        for (int i = 0; i < size; i++) {
            table.states(label(i));
        }
        return table;
    }
}
