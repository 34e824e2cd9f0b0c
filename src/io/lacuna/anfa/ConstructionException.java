package io.lacuna.anfa;

/**
 * Thrown when a fragment cannot be built from the operands it was given. These are never transient, the caller
 * must abandon the current build and not reuse any of the refs involved.
 */
public class ConstructionException extends IllegalStateException {

  public ConstructionException(String message) {
    super(message);
  }

  public ConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
