package io.lacuna.anfa.compilers;

import io.lacuna.anfa.AutomataRef;

/**
 * The refs produced by one logical operation of a {@link DualCompiler}, one per automaton. The two refs generally
 * point at different states, since each compiler lays out its own automaton.
 */
public final class DualRef {

  private final AutomataRef forward, coverage;

  public DualRef(AutomataRef forward, AutomataRef coverage) {
    this.forward = forward;
    this.coverage = coverage;
  }

  public AutomataRef forward() {
    return forward;
  }

  public AutomataRef coverage() {
    return coverage;
  }

  @Override
  public int hashCode() {
    return 31 * forward.hashCode() + coverage.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof DualRef) {
      DualRef r = (DualRef) obj;
      return forward.equals(r.forward) && coverage.equals(r.coverage);
    }
    return false;
  }

  @Override
  public String toString() {
    return "{forward " + forward + ", coverage " + coverage + "}";
  }
}
