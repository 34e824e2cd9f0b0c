package io.lacuna.anfa;

/**
 * The entry and exit states of a fragment. While a ref is live its exit state {@code f} has no transition, and
 * composing the ref patches that state. Once a ref has been passed to a composition it should not be composed again.
 */
public final class AutomataRef {

  private final int q0, f;

  public AutomataRef(int q0, int f) {
    if (q0 < 0 || f < 0) {
      throw new IllegalArgumentException("state ids are non-negative, got [" + q0 + ", " + f + "]");
    }
    this.q0 = q0;
    this.f = f;
  }

  public int q0() {
    return q0;
  }

  public int f() {
    return f;
  }

  @Override
  public int hashCode() {
    return 31 * q0 + f;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof AutomataRef) {
      AutomataRef r = (AutomataRef) obj;
      return q0 == r.q0 && f == r.f;
    }
    return false;
  }

  @Override
  public String toString() {
    return "[" + q0 + ", " + f + "]";
  }
}
