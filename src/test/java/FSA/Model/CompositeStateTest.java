package FSA.Model;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class CompositeStateTest {

  @Test
  void testIdentityIsTheMemberSet() {
    CompositeState a = new CompositeState(List.of(AtomicState.of("q1"), AtomicState.of("q0")));
    CompositeState b = new CompositeState(Set.of(AtomicState.of("q0"), AtomicState.of("q1")));
    Assertions.assertEquals(a, b);
    Assertions.assertEquals(a.hashCode(), b.hashCode());
    Assertions.assertEquals("{q0,q1}", a.label());
    Assertions.assertEquals("{q0,q1}", b.toString());
    Assertions.assertTrue(a.contains(AtomicState.of("q1")));
    Assertions.assertNotEquals(a, new CompositeState(List.of(AtomicState.of("q0"))));
    Assertions.assertNotEquals(a, AtomicState.of("{q0,q1}"));
  }

  @Test
  void testLabels() {
    Assertions.assertEquals("{}", new CompositeState(List.of()).label());
    CompositeState nested = new CompositeState(List.of(
        new CompositeState(List.of(AtomicState.of("q2"))),
        new CompositeState(List.of(AtomicState.of("q0"), AtomicState.of("q1")))));
    Assertions.assertEquals("{{q0,q1},{q2}}", nested.label());
  }
}
