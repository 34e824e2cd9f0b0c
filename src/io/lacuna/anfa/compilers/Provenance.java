package io.lacuna.anfa.compilers;

/**
 * The logical operation which created a state: its position in the sequence of operations a compiler was given,
 * and what kind of operation it was.
 */
public final class Provenance {

  private final int index;
  private final Operation operation;

  Provenance(int index, Operation operation) {
    this.index = index;
    this.operation = operation;
  }

  public int index() {
    return index;
  }

  public Operation operation() {
    return operation;
  }

  @Override
  public int hashCode() {
    return 31 * index + operation.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Provenance) {
      Provenance p = (Provenance) obj;
      return index == p.index && operation == p.operation;
    }
    return false;
  }

  @Override
  public String toString() {
    return operation + "#" + index;
  }
}
