package io.lacuna.anfa;

/**
 * Thrown when an operator is applied to an {@link OperandStack} holding fewer live fragments than it consumes.
 */
public class InsufficientOperandsException extends ConstructionException {

  private final int required, available;

  public InsufficientOperandsException(String operation, int required, int available) {
    super(operation + " requires " + required + (required == 1 ? " operand" : " operands") + ", found " + available);
    this.required = required;
    this.available = available;
  }

  public int required() {
    return required;
  }

  public int available() {
    return available;
  }
}
