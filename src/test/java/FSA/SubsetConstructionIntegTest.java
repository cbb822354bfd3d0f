package FSA;

import java.util.List;

import FSA.Model.Automaton;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("IntegTest")
public class SubsetConstructionIntegTest {
    private static final List<List<String>> WORDS = TabakovVardiRandomNFA.allWords(TabakovVardiRandomNFA.BINARY, 8);

    @Test
    void testLanguagePreserved() {
        for (int size = 2; size < 12; size++) {
            for (int randomSeed = 0; randomSeed < 100; randomSeed++) {
                Automaton nfa = TabakovVardiRandomNFA.getRandomAutomaton(randomSeed, size);
                Automaton dfa = SubsetConstruction.determinize(nfa).dfa();
                CompactNFA<String> reference = AutomataLibExport.toCompactNFA(nfa);
                String debug = randomSeed + "; " + size;
                for (List<String> word : WORDS) {
                    boolean expected = reference.accepts(word);
                    Assertions.assertEquals(expected, nfa.accepts(word), debug + "; " + word);
                    Assertions.assertEquals(expected, dfa.accepts(word), debug + "; " + word);
                }
            }
        }
    }
}
