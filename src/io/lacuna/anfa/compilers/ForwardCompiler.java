package io.lacuna.anfa.compilers;

import io.lacuna.anfa.ANFA;
import io.lacuna.anfa.AutomataRef;

/**
 * Builds the standard Thompson automaton, suitable for matching.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class ForwardCompiler<S> implements Compiler<S> {

  @Override
  public AutomataRef nothing(ANFA<S> anfa) {
    return anfa.nothing();
  }

  @Override
  public AutomataRef epsilon(ANFA<S> anfa) {
    return anfa.epsilon();
  }

  @Override
  public AutomataRef literal(ANFA<S> anfa, S signal) {
    return anfa.literal(signal);
  }

  @Override
  public AutomataRef concatenate(ANFA<S> anfa, AutomataRef a, AutomataRef b) {
    return anfa.concatenate(a, b);
  }

  @Override
  public AutomataRef star(ANFA<S> anfa, AutomataRef a) {
    return anfa.star(a);
  }

  @Override
  public AutomataRef union(ANFA<S> anfa, AutomataRef a, AutomataRef b) {
    return anfa.union(a, b);
  }

  @Override
  public String toString() {
    return "forward";
  }
}
