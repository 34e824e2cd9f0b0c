package io.lacuna.anfa;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import java.util.Iterator;

/**
 * An append-only table of transitions, indexed by state id. Ids are handed out in order and stay valid for the
 * lifetime of the table, nothing is ever removed or renumbered. The only mutation of an existing state is
 * {@link #patch(int, Transition)}, which fills in a state that has no transition yet.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class Delta<S> implements Iterable<Transition<S>> {

  private final LinearList<Transition<S>> transitions;

  public Delta() {
    this(16);
  }

  public Delta(int capacity) {
    this.transitions = new LinearList<>(capacity);
  }

  /**
   * @return the id of a new state with transition {@code t}
   */
  public int append(Transition<S> t) {
    int state = size();
    transitions.addLast(t);
    return state;
  }

  public Transition<S> get(int state) {
    checkBounds(state);
    return transitions.nth(state);
  }

  /**
   * Sets the transition of a dangling state.
   *
   * @throws DanglingStateException if {@code state} already has a transition
   */
  public void patch(int state, Transition<S> t) {
    requireDangling(state);
    transitions.set(state, t);
  }

  /**
   * @throws DanglingStateException if {@code state} already has a transition
   */
  public void requireDangling(int state) {
    Transition<S> current = get(state);
    if (!current.isEmpty()) {
      throw new DanglingStateException(state, current);
    }
  }

  public int size() {
    return (int) transitions.size();
  }

  @Override
  public Iterator<Transition<S>> iterator() {
    return transitions.iterator();
  }

  private void checkBounds(int state) {
    if (state < 0 || state >= size()) {
      throw new IndexOutOfBoundsException("state " + state + " is not in a table of " + size() + " states");
    }
  }

  /// reachability

  /**
   * @return {@code states}, plus every state reachable from them along unlabeled edges
   */
  public ISet<Integer> epsilonClosure(ISet<Integer> states) {
    LinearSet<Integer> accumulator = new LinearSet<>();
    states.forEach(s -> epsilonClosure(s, accumulator));
    return accumulator;
  }

  private void epsilonClosure(int state, LinearSet<Integer> accumulator) {
    LinearList<Integer> stack = LinearList.of(state);
    while (stack.size() > 0) {
      int s = stack.popLast();
      if (!accumulator.contains(s)) {
        accumulator.add(s);
        Transition<S> t = get(s);
        if (!t.isEmpty() && t.isUnlabeled()) {
          t.destinations().forEach(stack::addLast);
        }
      }
    }
  }

  /**
   * @return the states entered by following edges labeled {@code signal} out of {@code states}, without closure
   */
  public ISet<Integer> step(ISet<Integer> states, S signal) {
    LinearSet<Integer> result = new LinearSet<>();
    for (int s : states) {
      Transition<S> t = get(s);
      if (!t.isEmpty() && signal.equals(t.signal())) {
        result.add(t.first());
      }
    }
    return result;
  }

  /**
   * @return every state reachable from {@code state} along any edge, including {@code state} itself
   */
  public ISet<Integer> reachable(int state) {
    LinearSet<Integer> visited = new LinearSet<>();
    LinearList<Integer> queue = LinearList.of(state);

    while (queue.size() > 0) {
      int s = queue.popFirst();
      if (!visited.contains(s)) {
        visited.add(s);
        get(s).destinations().forEach(queue::addLast);
      }
    }

    return visited;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < size(); i++) {
      sb.append(i).append(' ').append(transitions.nth(i)).append('\n');
    }
    return sb.toString();
  }
}
