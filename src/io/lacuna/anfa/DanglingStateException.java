package io.lacuna.anfa;

/**
 * Thrown when a fragment's final state already has a transition, which means the ref was consumed by an earlier
 * composition or never described a live fragment.
 */
public class DanglingStateException extends ConstructionException {

  private final int state;
  private final Transition<?> transition;

  public DanglingStateException(int state, Transition<?> transition) {
    super("state " + state + " is not dangling, it already has transition " + transition);
    this.state = state;
    this.transition = transition;
  }

  /**
   * @return the state which was expected to be empty
   */
  public int state() {
    return state;
  }

  /**
   * @return the transition found on that state
   */
  public Transition<?> transition() {
    return transition;
  }
}
