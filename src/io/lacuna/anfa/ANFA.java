package io.lacuna.anfa;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An automaton built with Thompson's construction. Primitive builders append the states of a new fragment to the
 * table and return a ref to it, compositions patch the dangling final states of their operands to wire fragments
 * together. Refs are threaded between calls by the caller, and {@link #finish(AutomataRef)} selects the fragment
 * which the automaton as a whole represents.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class ANFA<S> {

  private static final Logger logger = Logger.getLogger("io.lacuna.anfa");
  private static final Level level = Level.FINER;

  private static final int UNSET = -1;

  private final Delta<S> delta;
  private int q0 = UNSET, f = UNSET;

  public ANFA() {
    this.delta = new Delta<>();
  }

  /**
   * @param capacity the number of states to allocate room for up front
   */
  public ANFA(int capacity) {
    this.delta = new Delta<>(capacity);
  }

  /**
   * @return a finished automaton which accepts nothing
   */
  public static <S> ANFA<S> fromNothing() {
    ANFA<S> anfa = new ANFA<>();
    anfa.finish(anfa.nothing());
    return anfa;
  }

  /**
   * @return a finished automaton which accepts only the empty input
   */
  public static <S> ANFA<S> fromEpsilon() {
    ANFA<S> anfa = new ANFA<>();
    anfa.finish(anfa.epsilon());
    return anfa;
  }

  /**
   * @return a finished automaton which accepts only {@code signal}
   */
  public static <S> ANFA<S> fromLiteral(S signal) {
    ANFA<S> anfa = new ANFA<>();
    anfa.finish(anfa.literal(signal));
    return anfa;
  }

  /// acceptors

  /**
   * Appends two unconnected states, so the final state can never be reached.
   *
   * @return a fragment which accepts nothing
   */
  public AutomataRef nothing() {
    int q0 = delta.append(Transition.empty());
    int f = delta.append(Transition.empty());
    return built("nothing", new AutomataRef(q0, f));
  }

  /**
   * Appends a single state which is both the entry and the final state.
   *
   * @return a fragment which accepts only the empty input
   */
  public AutomataRef epsilon() {
    int q = delta.append(Transition.empty());
    return built("epsilon", new AutomataRef(q, q));
  }

  /**
   * @return a fragment which accepts only {@code signal}
   */
  public AutomataRef literal(S signal) {
    int q0 = delta.size();
    int f = q0 + 1;
    delta.append(Transition.signal(signal, f));
    delta.append(Transition.empty());
    return built("literal " + signal, new AutomataRef(q0, f));
  }

  /// combinators

  /**
   * Points the final state of {@code a} at the entry of {@code b}. No states are appended.
   *
   * @return a fragment which matches {@code a} followed by {@code b}
   * @throws DanglingStateException if the final state of {@code a} is already patched
   */
  public AutomataRef concatenate(AutomataRef a, AutomataRef b) {
    delta.get(a.q0());
    delta.get(b.q0());
    delta.requireDangling(a.f());
    delta.requireDangling(b.f());
    requireDistinct(a, b);
    delta.patch(a.f(), Transition.epsilon(b.q0()));
    return built("concatenate", new AutomataRef(a.q0(), b.f()));
  }

  /**
   * Appends an entry, a fork which either enters {@code a} or exits, and a new final state. The final state of
   * {@code a} loops back to the fork.
   *
   * @return a fragment which matches {@code a} zero or more times
   * @throws DanglingStateException if the final state of {@code a} is already patched
   */
  public AutomataRef star(AutomataRef a) {
    delta.get(a.q0());
    delta.requireDangling(a.f());

    int entry = delta.size();
    int fork = entry + 1;
    int f = entry + 2;
    delta.append(Transition.epsilon(fork));
    delta.append(Transition.fork(a.q0(), f));
    delta.append(Transition.empty());
    delta.patch(a.f(), Transition.epsilon(fork));

    return built("star", new AutomataRef(entry, f));
  }

  /**
   * Appends a fork into {@code a} and {@code b}, and a new final state which both of their final states lead to.
   *
   * @return a fragment which matches either {@code a} or {@code b}
   * @throws DanglingStateException if the final state of either operand is already patched
   */
  public AutomataRef union(AutomataRef a, AutomataRef b) {
    delta.get(a.q0());
    delta.get(b.q0());
    delta.requireDangling(a.f());
    delta.requireDangling(b.f());
    requireDistinct(a, b);

    int fork = delta.append(Transition.fork(a.q0(), b.q0()));
    int f = delta.append(Transition.empty());
    delta.patch(a.f(), Transition.epsilon(f));
    delta.patch(b.f(), Transition.epsilon(f));

    return built("union", new AutomataRef(fork, f));
  }

  ///

  /**
   * Marks {@code ref} as the entry and final state of the whole automaton. May be called again, the last call wins.
   */
  public void finish(AutomataRef ref) {
    delta.get(ref.q0());
    delta.get(ref.f());
    this.q0 = ref.q0();
    this.f = ref.f();
    logger.log(level, "finished automaton of {0} states on {1}", new Object[]{delta.size(), ref});
  }

  public boolean isFinished() {
    return q0 != UNSET;
  }

  public int q0() {
    requireFinished();
    return q0;
  }

  public int f() {
    requireFinished();
    return f;
  }

  /**
   * @return the entry and final state of the whole automaton
   */
  public AutomataRef ref() {
    requireFinished();
    return new AutomataRef(q0, f);
  }

  public Delta<S> delta() {
    return delta;
  }

  public Transition<S> transition(int state) {
    return delta.get(state);
  }

  public int size() {
    return delta.size();
  }

  private void requireFinished() {
    if (!isFinished()) {
      throw new IllegalStateException("automaton has not been finished");
    }
  }

  private static void requireDistinct(AutomataRef a, AutomataRef b) {
    if (a.f() == b.f()) {
      throw new IllegalArgumentException("a fragment cannot be composed with itself: " + a);
    }
  }

  private AutomataRef built(String operation, AutomataRef ref) {
    logger.log(level, "{0} -> {1}, {2} states", new Object[]{operation, ref, delta.size()});
    return ref;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("anfa[");
    if (isFinished()) {
      sb.append("q0=").append(q0).append(", f=").append(f);
    } else {
      sb.append("unfinished");
    }
    sb.append("]\n").append(delta);
    return sb.toString();
  }
}
