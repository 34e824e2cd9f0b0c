package io.lacuna.anfa;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.Objects;

/**
 * The outgoing edges of a single state. A state has no edge, a single edge which is either labeled with a signal or
 * unlabeled (epsilon), or a fork of two unlabeled edges. Forks are the only source of non-determinism.
 *
 * @param <S> the signals that trigger transitions between states
 */
public final class Transition<S> {

  private static final int NONE = -1;

  private static final Transition EMPTY = new Transition<>(null, NONE, NONE);

  private final S signal;
  private final int first, second;

  private Transition(S signal, int first, int second) {
    this.signal = signal;
    this.first = first;
    this.second = second;
  }

  /// factories

  /**
   * @return a transition with no outgoing edges
   */
  public static <S> Transition<S> empty() {
    return EMPTY;
  }

  /**
   * @return an unlabeled edge to {@code state}
   */
  public static <S> Transition<S> epsilon(int state) {
    return new Transition<>(null, checkState(state), NONE);
  }

  /**
   * @return an edge to {@code state} which is only followed on {@code signal}
   */
  public static <S> Transition<S> signal(S signal, int state) {
    if (signal == null) {
      throw new IllegalArgumentException("a labeled edge requires a non-null signal, use epsilon() instead");
    }
    return new Transition<>(signal, checkState(state), NONE);
  }

  /**
   * @return a pair of unlabeled edges, with {@code first} preferred over {@code second}
   */
  public static <S> Transition<S> fork(int first, int second) {
    return new Transition<>(null, checkState(first), checkState(second));
  }

  private static int checkState(int state) {
    if (state < 0) {
      throw new IllegalArgumentException("state ids are non-negative, got " + state);
    }
    return state;
  }

  /// queries

  public boolean isEmpty() {
    return first == NONE;
  }

  public boolean isFork() {
    return second != NONE;
  }

  /**
   * @return true if this is a single unlabeled edge
   */
  public boolean isEpsilon() {
    return !isEmpty() && !isFork() && signal == null;
  }

  /**
   * @return the label of the single edge, or null if the edge is unlabeled or there is no single edge
   */
  public S signal() {
    return signal;
  }

  /**
   * @return true if the transition is followed without consuming a signal
   */
  public boolean isUnlabeled() {
    return signal == null;
  }

  /**
   * @return the destination states, in order of preference
   */
  public IList<Integer> destinations() {
    if (isEmpty()) {
      return LinearList.of();
    } else if (isFork()) {
      return LinearList.of(first, second);
    } else {
      return LinearList.of(first);
    }
  }

  /**
   * @return the destination of a single edge, or the preferred edge of a fork
   */
  public int first() {
    if (isEmpty()) {
      throw new IllegalStateException("an empty transition has no destination");
    }
    return first;
  }

  /**
   * @return the second destination of a fork
   */
  public int second() {
    if (!isFork()) {
      throw new IllegalStateException("only a fork has a second destination");
    }
    return second;
  }

  @Override
  public int hashCode() {
    return Objects.hash(signal, first, second);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition<?> t = (Transition<?>) obj;
    return first == t.first && second == t.second && Objects.equals(signal, t.signal);
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return "[]";
    } else if (isFork()) {
      return "[ε -> " + first + ", ε -> " + second + "]";
    } else {
      return "[" + (signal == null ? "ε" : signal) + " -> " + first + "]";
    }
  }
}
