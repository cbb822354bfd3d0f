package FSA;

import java.util.List;

import FSA.Diagram.DiagramGenerator;
import FSA.Model.AtomicState;
import FSA.Model.Automaton;
import FSA.Model.CompositeState;
import FSA.Model.State;
import FSA.Model.TransitionTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SubsetConstructionTest {

  static Automaton epsilonNFA() {
    return Automaton.nfa(TransitionTable.builder()
        .states("q0", "q1", "q2").alphabet("0", "1").start("q0").accepting("q2")
        .epsilon("q0", "q1")
        .transition("q1", "0", "q2")
        .build());
  }

  @Test
  void testEpsilonScenario() {
    SubsetConstruction.Result result = SubsetConstruction.determinize(epsilonNFA());
    Automaton dfa = result.dfa();

    Assertions.assertEquals(Automaton.Type.DFA, dfa.getType());
    Assertions.assertEquals(2, dfa.size());
    State start = dfa.getStartState();
    Assertions.assertEquals("{q0,q1}", start.label());
    Assertions.assertFalse(dfa.isAccepting(start));

    State q2 = dfa.getSuccessor(start, "0");
    Assertions.assertEquals(new CompositeState(List.of(AtomicState.of("q2"))), q2);
    Assertions.assertTrue(dfa.isAccepting(q2));
    Assertions.assertNull(dfa.getSuccessor(start, "1"));
    Assertions.assertTrue(dfa.getTransitions(q2).isEmpty());

    Assertions.assertTrue(dfa.accepts("0"));
    Assertions.assertFalse(dfa.accepts("1"));
    Assertions.assertFalse(dfa.accepts("00"));
    Assertions.assertFalse(dfa.accepts(""));
  }

  @Test
  void testTrace() {
    SubsetConstruction.Result result = SubsetConstruction.determinize(epsilonNFA());
    // two composite states, two symbols each
    Assertions.assertEquals(4, result.steps().size());
    long emitted = result.steps().stream().filter(s -> s.target() != null).count();
    Assertions.assertEquals(1, emitted);

    SubsetConstruction.Step first = result.steps().get(0);
    Assertions.assertEquals("{q0,q1}", first.source().label());
    Assertions.assertEquals("0", first.symbol());
    Assertions.assertEquals("{q2}", first.target().label());
    Assertions.assertEquals(List.of(AtomicState.of("q2")), List.copyOf(first.move()));
  }

  @Test
  void testRediscoveredSetsAreShared() {
    // both branches reach {q1,q2} through different paths and orders
    Automaton nfa = Automaton.nfa(TransitionTable.builder()
        .states("q0", "q1", "q2", "q3").alphabet("a", "b").start("q0").accepting("q2")
        .transitions("q0", "a", "q1", "q2")
        .transitions("q0", "b", "q3")
        .transitions("q3", "a", "q2", "q1")
        .transitions("q1", "a", "q1")
        .transitions("q2", "a", "q2")
        .build());
    Automaton dfa = SubsetConstruction.determinize(nfa).dfa();
    Assertions.assertEquals(3, dfa.size()); // {q0}, {q3}, {q1,q2}
    State viaA = dfa.getSuccessor(dfa.getStartState(), "a");
    State viaBA = dfa.getSuccessor(dfa.getSuccessor(dfa.getStartState(), "b"), "a");
    Assertions.assertSame(viaA, viaBA);
    Assertions.assertEquals(viaA, dfa.getSuccessor(viaA, "a"));
  }

  @Test
  void testDeterministicLabels() {
    for (int seed = 0; seed < 20; seed++) {
      Automaton nfa = TabakovVardiRandomNFA.getRandomAutomaton(seed, 7);
      Assertions.assertEquals(
          DiagramGenerator.describe(SubsetConstruction.determinize(nfa).dfa()),
          DiagramGenerator.describe(SubsetConstruction.determinize(nfa).dfa()));
    }
  }

  @Test
  void testNoEmptyCompositeState() {
    for (int seed = 0; seed < 50; seed++) {
      Automaton dfa = SubsetConstruction.determinize(TabakovVardiRandomNFA.getRandomAutomaton(seed, 6)).dfa();
      Assertions.assertTrue(dfa.isDeterministic());
      for (State s : dfa.getStates()) {
        Assertions.assertFalse(((CompositeState) s).members().isEmpty(), "seed " + seed);
      }
    }
  }
}
