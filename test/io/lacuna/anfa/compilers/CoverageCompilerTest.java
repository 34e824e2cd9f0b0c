package io.lacuna.anfa.compilers;

import io.lacuna.anfa.ANFA;
import io.lacuna.anfa.AutomataRef;
import io.lacuna.anfa.DanglingStateException;
import io.lacuna.anfa.Transition;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static io.lacuna.anfa.Simulator.accepts;
import static io.lacuna.anfa.Simulator.snapshot;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class CoverageCompilerTest {

  private CoverageCompiler<Character> compiler;
  private ANFA<Character> anfa;

  @Before
  public void setUp() {
    compiler = new CoverageCompiler<>();
    anfa = new ANFA<>();
  }

  @Test
  public void testConcatenateAddsJunction() {
    AutomataRef a = compiler.literal(anfa, 'a');
    AutomataRef b = compiler.literal(anfa, 'b');
    AutomataRef ab = compiler.concatenate(anfa, a, b);

    assertThat(anfa.size(), is(5));
    assertThat(ab, is(new AutomataRef(a.q0(), b.f())));
    assertThat(anfa.transition(a.f()), is(Transition.<Character>epsilon(4)));
    assertThat(anfa.transition(4), is(Transition.<Character>epsilon(b.q0())));

    assertThat(compiler.provenance(4).get(), is(new Provenance(2, Operation.CONCATENATE)));
    assertThat(compiler.statesOf(2).size(), is(1L));
  }

  @Test
  public void testProvenance() {
    AutomataRef a = compiler.literal(anfa, 'a');
    AutomataRef star = compiler.star(anfa, a);
    compiler.union(anfa, star, compiler.nothing(anfa));

    assertThat(compiler.operationCount(), is(4));
    assertThat(compiler.operation(0), is(Operation.LITERAL));
    assertThat(compiler.operation(1), is(Operation.STAR));
    assertThat(compiler.operation(2), is(Operation.NOTHING));
    assertThat(compiler.operation(3), is(Operation.UNION));

    for (int q = 0; q < anfa.size(); q++) {
      assertTrue("state " + q, compiler.provenance(q).isPresent());
    }

    ISet<Integer> starStates = compiler.statesOf(1);
    assertThat(starStates.size(), is(3L));
    assertTrue(starStates.contains(star.q0()));
    assertTrue(starStates.contains(star.f()));

    IMap<Provenance, ISet<Integer>> coverage = compiler.coverage();
    assertThat(coverage.size(), is(4L));
    assertThat(coverage.get(new Provenance(3, Operation.UNION)).get().size(), is(2L));
  }

  @Test
  public void testFailedOperationIsNotRecorded() {
    AutomataRef a = compiler.literal(anfa, 'a');
    AutomataRef b = compiler.literal(anfa, 'b');
    compiler.concatenate(anfa, a, b);

    assertThrows(DanglingStateException.class, () -> compiler.concatenate(anfa, a, compiler.epsilon(anfa)));
    assertThat(compiler.operationCount(), is(4));
    assertThat(anfa.size(), is(6));
  }

  @Test
  public void testForeignRef() {
    AutomataRef a = compiler.literal(anfa, 'a');
    AutomataRef b = compiler.literal(anfa, 'b');
    AutomataRef foreign = new AutomataRef(99, a.f());
    List<Transition<Character>> before = snapshot(anfa);

    assertThrows(IndexOutOfBoundsException.class, () -> compiler.concatenate(anfa, foreign, b));
    assertThrows(IndexOutOfBoundsException.class, () -> compiler.concatenate(anfa, b, foreign));
    assertThrows(IndexOutOfBoundsException.class, () -> compiler.union(anfa, foreign, b));

    assertThat(snapshot(anfa), is(before));
    assertThat(compiler.operationCount(), is(2));
  }

  @Test
  public void testSingleAutomaton() {
    compiler.epsilon(anfa);
    assertThrows(IllegalArgumentException.class, () -> compiler.epsilon(new ANFA<>()));
    assertThat(compiler.operationCount(), is(1));
  }

  @Test
  public void testSameLanguageAsForward() {
    // a(b|c)*d
    ForwardCompiler<Character> forward = new ForwardCompiler<>();
    ANFA<Character> forwardAnfa = new ANFA<>();
    build(forward, forwardAnfa);
    build(compiler, anfa);

    assertTrue(anfa.size() > forwardAnfa.size());
    for (String s : new String[]{"ad", "abd", "acd", "abcbcd", "", "a", "d", "abc", "bd", "adx"}) {
      boolean expected = s.matches("a[bc]*d");
      assertThat(s, accepts(forwardAnfa, s), is(expected));
      assertThat(s, accepts(anfa, s), is(expected));
    }
  }

  @Test
  public void testOperationOutOfRange() {
    assertThrows(IndexOutOfBoundsException.class, () -> compiler.operation(0));
    assertFalse(compiler.provenance(0).isPresent());
  }

  private static void build(Compiler<Character> c, ANFA<Character> anfa) {
    AutomataRef a = c.literal(anfa, 'a');
    AutomataRef bc = c.union(anfa, c.literal(anfa, 'b'), c.literal(anfa, 'c'));
    AutomataRef tail = c.concatenate(anfa, c.star(anfa, bc), c.literal(anfa, 'd'));
    c.finish(anfa, c.concatenate(anfa, a, tail));
  }
}
