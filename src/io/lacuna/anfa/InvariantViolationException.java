package io.lacuna.anfa;

/**
 * Signals an internal condition that correct call sequencing can never produce.
 */
public class InvariantViolationException extends ConstructionException {

  public InvariantViolationException(String message) {
    super(message);
  }
}
