package io.lacuna.anfa.compilers;

import io.lacuna.anfa.ANFA;
import io.lacuna.anfa.AutomataRef;

/**
 * A strategy for building fragments into an automaton owned by the caller. Different compilers may lay out
 * different states for the same operation, but every compiler must produce a fragment for every operation it is
 * given, so the same sequence of operations can be replayed against several compilers at once.
 *
 * @param <S> the signals that trigger transitions between states
 */
public interface Compiler<S> {

  /**
   * @return a fragment which accepts nothing
   */
  AutomataRef nothing(ANFA<S> anfa);

  /**
   * @return a fragment which accepts only the empty input
   */
  AutomataRef epsilon(ANFA<S> anfa);

  /**
   * @return a fragment which accepts only {@code signal}
   */
  AutomataRef literal(ANFA<S> anfa, S signal);

  /**
   * @return a fragment which matches {@code a} followed by {@code b}
   */
  AutomataRef concatenate(ANFA<S> anfa, AutomataRef a, AutomataRef b);

  /**
   * @return a fragment which matches {@code a} zero or more times
   */
  AutomataRef star(ANFA<S> anfa, AutomataRef a);

  /**
   * @return a fragment which matches either {@code a} or {@code b}
   */
  AutomataRef union(ANFA<S> anfa, AutomataRef a, AutomataRef b);

  default void finish(ANFA<S> anfa, AutomataRef ref) {
    anfa.finish(ref);
  }
}
