package FSA;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import FSA.Model.Automaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FSACommandLineTest {
  // operation -> size of the automaton it returns for epsilon_nfa.txt
  private static final Map<String, Integer> ALL_OPS =
      Map.of("determinize", 2, "minimize", 2, "regex", 3, "describe", 3, "accepts", 3);

  private static String getFilePath(String resourcePath) throws URISyntaxException {
    Path path = Paths.get(Objects.requireNonNull(
        FSACommandLineTest.class.getClassLoader().getResource(resourcePath)).toURI());
    return path.toAbsolutePath().toString();
  }

  @Test
  void testAllOperations() throws URISyntaxException {
    Automaton nfa = FSACommandLine.readAutomaton(getFilePath("epsilon_nfa.txt"));
    for (Map.Entry<String, Integer> op : ALL_OPS.entrySet()) {
      Automaton result = FSACommandLine.allOperations(op.getKey(), nfa, List.of("0", "1"));
      Assertions.assertEquals(op.getValue().intValue(), result.size(), op.getKey());
    }
  }

  @Test
  void testMinimizeDFAFile() throws URISyntaxException {
    Automaton dfa = FSACommandLine.readAutomaton(getFilePath("four_state_dfa.txt"));
    Assertions.assertEquals(3, FSACommandLine.allOperations("minimize", dfa, List.of()).size());
  }

  @Test
  void testBAFile() throws URISyntaxException {
    Automaton nfa = FSACommandLine.readAutomaton(getFilePath("ab_star.ba"));
    Assertions.assertTrue(FSACommandLine.allOperations("determinize", nfa, List.of()).accepts("ab"));
  }

  @Test
  void testWriteBAForNFAResult(@TempDir File tmp) throws URISyntaxException {
    String output = new File(tmp, "described.ba").getAbsolutePath();
    FSACommandLine.main(new String[]{"--writeBA", output, "describe", getFilePath("epsilon_nfa.txt")});

    Automaton written = BAFormat.getBAFile(output);
    Assertions.assertTrue(written.accepts("0"));
    Assertions.assertFalse(written.accepts(""));
    Assertions.assertFalse(written.accepts("1"));
    Assertions.assertFalse(written.accepts("00"));
  }

  @Test
  void testWriteBAForDFAResult(@TempDir File tmp) throws URISyntaxException {
    String output = new File(tmp, "minimized.ba").getAbsolutePath();
    FSACommandLine.main(new String[]{"--writeBA", output, "minimize", getFilePath("epsilon_nfa.txt")});

    Automaton written = BAFormat.getBAFile(output);
    Assertions.assertTrue(written.accepts("0"));
    Assertions.assertFalse(written.accepts("01"));
  }

  @Test
  void testUnknownOperation() {
    Automaton nfa = SubsetConstructionTest.epsilonNFA();
    Assertions.assertThrows(IllegalStateException.class, () -> FSACommandLine.allOperations("brz", nfa, List.of()));
  }
}
