package io.lacuna.anfa.compilers;

import io.lacuna.anfa.ConstructionException;

/**
 * Thrown when either side of a {@link DualCompiler} fails an operation. The cause is the failure of the side that
 * is reported, and after such a failure the two automata are out of step and their refs should not be composed.
 */
public class DualCompilationException extends ConstructionException {

  private final DualCompiler.Side side;

  public DualCompilationException(String operation, DualCompiler.Side side, RuntimeException cause) {
    super(operation + " failed on the " + side.name().toLowerCase() + " side: " + cause.getMessage(), cause);
    this.side = side;
  }

  /**
   * @return the side whose failure is reported
   */
  public DualCompiler.Side side() {
    return side;
  }
}
