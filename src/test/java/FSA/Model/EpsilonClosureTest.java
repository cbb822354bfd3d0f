package FSA.Model;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import FSA.TabakovVardiRandomNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class EpsilonClosureTest {

  @Test
  void testChainAndCycle() {
    Automaton nfa = Automaton.nfa(TransitionTable.builder()
        .states("a", "b", "c", "d").alphabet("x").start("a")
        .epsilon("a", "b").epsilon("b", "c").epsilon("c", "a")
        .transition("c", "x", "d")
        .build());
    SortedSet<State> closure = EpsilonClosure.of(nfa, Set.of(AtomicState.of("a")));
    Assertions.assertEquals("{a,b,c}", CompositeState.canonicalLabel(closure));

    closure = EpsilonClosure.of(nfa, Set.of(AtomicState.of("d")));
    Assertions.assertEquals(Set.of(AtomicState.of("d")), closure);

    Assertions.assertTrue(EpsilonClosure.of(nfa, Collections.emptySet()).isEmpty());
  }

  @Test
  void testInputNotModified() {
    Automaton nfa = Automaton.nfa(TransitionTable.builder()
        .states("a", "b").alphabet("x").start("a").epsilon("a", "b").build());
    Set<State> input = new HashSet<>(List.of(AtomicState.of("a")));
    EpsilonClosure.of(nfa, input);
    Assertions.assertEquals(1, input.size());
  }

  @Test
  void testIdempotence() {
    for (int seed = 0; seed < 50; seed++) {
      Automaton nfa = TabakovVardiRandomNFA.getRandomAutomaton(seed, 8);
      for (State s : nfa.getStates()) {
        SortedSet<State> once = EpsilonClosure.of(nfa, Set.of(s));
        Assertions.assertTrue(once.contains(s));
        Assertions.assertEquals(once, EpsilonClosure.of(nfa, once), "seed " + seed);
      }
    }
  }
}
