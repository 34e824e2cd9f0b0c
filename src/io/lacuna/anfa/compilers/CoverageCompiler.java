package io.lacuna.anfa.compilers;

import io.lacuna.anfa.ANFA;
import io.lacuna.anfa.AutomataRef;
import io.lacuna.anfa.Delta;
import io.lacuna.anfa.Transition;
import io.lacuna.anfa.Utils;
import io.lacuna.bifurcan.IEntry;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds an automaton which accepts the same language as {@link ForwardCompiler}, while recording which logical
 * operation created each state. Every concatenation gets a junction state of its own between its operands, so that
 * each operation in the sequence corresponds to at least one state.
 * <p>
 * A compiler records the coverage of a single automaton, and rejects any other.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class CoverageCompiler<S> implements Compiler<S> {

  private final LinearList<Operation> operations = new LinearList<>();
  private final LinearMap<Integer, Provenance> provenance = new LinearMap<>();
  private ANFA<S> anfa;

  @Override
  public AutomataRef nothing(ANFA<S> anfa) {
    return record(anfa, Operation.NOTHING, anfa::nothing);
  }

  @Override
  public AutomataRef epsilon(ANFA<S> anfa) {
    return record(anfa, Operation.EPSILON, anfa::epsilon);
  }

  @Override
  public AutomataRef literal(ANFA<S> anfa, S signal) {
    return record(anfa, Operation.LITERAL, () -> anfa.literal(signal));
  }

  @Override
  public AutomataRef concatenate(ANFA<S> anfa, AutomataRef a, AutomataRef b) {
    return record(anfa, Operation.CONCATENATE, () -> {
      Delta<S> delta = anfa.delta();
      delta.get(a.q0());
      delta.get(b.q0());
      delta.requireDangling(a.f());
      delta.requireDangling(b.f());
      if (a.f() == b.f()) {
        throw new IllegalArgumentException("a fragment cannot be composed with itself: " + a);
      }

      int junction = delta.append(Transition.epsilon(b.q0()));
      delta.patch(a.f(), Transition.epsilon(junction));
      return new AutomataRef(a.q0(), b.f());
    });
  }

  @Override
  public AutomataRef star(ANFA<S> anfa, AutomataRef a) {
    return record(anfa, Operation.STAR, () -> anfa.star(a));
  }

  @Override
  public AutomataRef union(ANFA<S> anfa, AutomataRef a, AutomataRef b) {
    return record(anfa, Operation.UNION, () -> anfa.union(a, b));
  }

  ///

  /**
   * @return the operation which created {@code state}, if this compiler created it
   */
  public Optional<Provenance> provenance(int state) {
    return provenance.get(state);
  }

  /**
   * @return the states created by the operation at {@code index}
   */
  public ISet<Integer> statesOf(int index) {
    return Utils.toSet(provenance.stream()
            .filter(e -> e.value().index() == index)
            .map(IEntry::key));
  }

  /**
   * @return every recorded operation, mapped onto the states it created
   */
  public IMap<Provenance, ISet<Integer>> coverage() {
    return Utils.groupBy(provenance.keys(), s -> provenance.get(s).get());
  }

  /**
   * @return the kind of the operation at {@code index}
   */
  public Operation operation(int index) {
    if (index < 0 || index >= operationCount()) {
      throw new IndexOutOfBoundsException("operation " + index + " of " + operationCount());
    }
    return operations.nth(index);
  }

  public int operationCount() {
    return (int) operations.size();
  }

  // failed operations are not recorded, they leave no states behind
  private AutomataRef record(ANFA<S> anfa, Operation operation, Supplier<AutomataRef> build) {
    bind(anfa);

    int start = anfa.size();
    AutomataRef ref = build.get();
    int index = operationCount();
    operations.addLast(operation);

    Provenance p = new Provenance(index, operation);
    Utils.range(start, anfa.size()).forEach(s -> provenance.put(s, p));

    return ref;
  }

  private void bind(ANFA<S> anfa) {
    if (this.anfa == null) {
      this.anfa = anfa;
    } else if (this.anfa != anfa) {
      throw new IllegalArgumentException("a coverage compiler can only record a single automaton");
    }
  }

  @Override
  public String toString() {
    return "coverage";
  }
}
