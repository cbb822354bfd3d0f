package FSA;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

import FSA.Diagram.DiagramDescription;
import FSA.Diagram.DiagramGenerator;
import FSA.Diagram.DotFormat;
import FSA.Minimize.MinimizationResult;
import FSA.Minimize.MooreMinimizer;
import FSA.Minimize.RefinementStep;
import FSA.Model.Automaton;
import FSA.Model.State;

public class FSACommandLine {
  public static void main(String[] args) {
    String baFilename = null;
    String dotFilename = null;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        SubsetConstruction.DEBUG = true;
        MooreMinimizer.DEBUG = true;
      } else if ("--writeBA".equalsIgnoreCase(arg) || "--writeDot".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for " + arg);
          printUsageAndExit(); // exits
        }
        if ("--writeBA".equalsIgnoreCase(arg)) {
          baFilename = args[++i];
        } else {
          dotFilename = args[++i];
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }

    String operation = positional.get(0);
    String filePath = positional.get(1);
    List<String> words = positional.subList(2, positional.size());

    final Automaton automaton = readAutomaton(filePath);
    System.out.println("Input " + automaton.getType() + " size: " + automaton.size());
    System.out.println("Alphabet size: " + automaton.getAlphabet().size());

    long before = System.currentTimeMillis();
    Automaton result = allOperations(operation, automaton, words);
    long after = System.currentTimeMillis();
    System.out.println(operation + " result size: " + result.size());
    System.out.println(operation + " duration: " + ((after - before) / 1000f) + "s");

    if (baFilename != null) {
      System.out.println("Writing to file: " + baFilename);
      BAFormat.writeBAFile(baFilename, result);
    }
    if (dotFilename != null) {
      writeDotFile(dotFilename, result);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "FSA [--debug] [--writeBA <BA output file>] [--writeDot <DOT output file>] <operation> <input file> [word...]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--writeBA <BA output file>] : Write the resulting automaton to the specified file");
    System.out.println("[--writeDot <DOT output file>] : Write the resulting automaton's diagram as DOT");
    System.out.println();
    System.out.println("<operation> : one of the choices below:");
    System.out.println("  determinize: Subset construction.");
    System.out.println("  minimize: Subset construction (for an NFA), then Moore's partition refinement.");
    System.out.println("  regex: Regular expression by state elimination.");
    System.out.println("  describe: Print the automaton's diagram description.");
    System.out.println("  accepts: Test each following word (one character per symbol).");
    System.out.println();
    System.out.println("<input file> : a .ba file (BA format) or a transition table:");
    System.out.println("  type: nfa|dfa|partial-dfa, alphabet: ..., states: ..., start: ..., accepting: ...");
    System.out.println("  followed by source,symbol,destination rows (ε for epsilon).");
    System.exit(0);
  }

  static Automaton readAutomaton(String filePath) {
    if (filePath.toLowerCase().endsWith(".ba")) {
      return BAFormat.getBAFile(filePath);
    }
    return TableFormat.getTableFile(filePath);
  }

  /**
   * Run the chosen operation.
   * @param operation - operation passed in from command-line
   * @param automaton - input automaton
   * @param words - words to test, for "accepts"
   * @return - the resulting automaton; the input itself for operations that don't build one
   */
  static Automaton allOperations(String operation, Automaton automaton, List<String> words) {
    System.out.println();
    System.out.println("Invoking operation:" + operation);
    return switch (operation.toLowerCase()) {
      case "determinize" -> determinize(automaton);
      case "minimize" -> minimize(automaton);
      case "regex" -> {
        System.out.println("Regex: " + RegexConverter.toRegex(automaton).orElse("∅ (empty language)"));
        yield automaton;
      }
      case "describe" -> {
        printDiagram(automaton);
        yield automaton;
      }
      case "accepts" -> {
        for (String word : words) {
          System.out.println("'" + word + "': " + (automaton.accepts(word) ? "accepted" : "rejected"));
        }
        yield automaton;
      }
      default -> throw new IllegalStateException("Unexpected operation choice: " + operation);
    };
  }

  private static Automaton determinize(Automaton automaton) {
    SubsetConstruction.Result result = SubsetConstruction.determinize(automaton);
    for (SubsetConstruction.Step step : result.steps()) {
      System.out.println("  " + step);
    }
    printDiagram(result.dfa());
    return result.dfa();
  }

  private static Automaton minimize(Automaton automaton) {
    Automaton dfa = automaton;
    if (!automaton.isDeterministic()) {
      dfa = SubsetConstruction.determinize(automaton).dfa();
      System.out.println("Unminimized SC DFA size: " + dfa.size());
    }
    MinimizationResult result = MooreMinimizer.minimize(dfa);
    for (RefinementStep step : result.steps()) {
      System.out.println("  " + step);
      for (SortedSet<State> group : step.partition().getGroups()) {
        for (State s : group) {
          System.out.println("    " + s.label() + " " + step.signatureOf(s));
        }
      }
    }
    printDiagram(result.minimized());
    return result.minimized();
  }

  private static void printDiagram(Automaton automaton) {
    DiagramDescription diagram = DiagramGenerator.describe(automaton);
    for (DiagramDescription.Node node : diagram.nodes()) {
      System.out.println("  node " + node.label()
          + (node.start() ? " [start]" : "") + (node.accepting() ? " [accepting]" : ""));
    }
    for (DiagramDescription.Edge edge : diagram.edges()) {
      System.out.println("  edge " + edge.source() + " -" + edge.label() + "-> " + edge.target());
    }
  }

  private static void writeDotFile(String filename, Automaton automaton) {
    System.out.println("Writing to file: " + filename);
    try (Writer w = new FileWriter(filename, StandardCharsets.UTF_8)) {
      DotFormat.write(DiagramGenerator.describe(automaton), w);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
