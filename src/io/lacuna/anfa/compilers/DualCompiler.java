package io.lacuna.anfa.compilers;

import io.lacuna.anfa.ANFA;
import io.lacuna.anfa.AutomataRef;

import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays a single sequence of operations against two compilers, each building its own automaton. Both compilers
 * are given every operation, so the automata always advance by the same number of logical operations even though
 * each may append a different number of states.
 * <p>
 * If either side fails, the operation fails with a {@link DualCompilationException}. The forward side is checked
 * first. Nothing is rolled back, whatever the other side built is left in its table unused.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class DualCompiler<S> {

  private static final Logger logger = Logger.getLogger("io.lacuna.anfa");
  private static final Level level = Level.FINER;

  public enum Side {
    FORWARD,
    COVERAGE
  }

  private final Compiler<S> forwardCompiler, coverageCompiler;
  private final ANFA<S> forward, coverage;

  public DualCompiler(Compiler<S> forwardCompiler, Compiler<S> coverageCompiler) {
    this(forwardCompiler, coverageCompiler, new ANFA<>(), new ANFA<>());
  }

  public DualCompiler(Compiler<S> forwardCompiler, Compiler<S> coverageCompiler, ANFA<S> forward, ANFA<S> coverage) {
    if (forward == coverage) {
      throw new IllegalArgumentException("both sides must build their own automaton");
    }
    this.forwardCompiler = forwardCompiler;
    this.coverageCompiler = coverageCompiler;
    this.forward = forward;
    this.coverage = coverage;
  }

  /**
   * @return a dual compiler pairing a {@link ForwardCompiler} with a {@link CoverageCompiler}
   */
  public static <S> DualCompiler<S> thompson() {
    return new DualCompiler<>(new ForwardCompiler<>(), new CoverageCompiler<>());
  }

  /**
   * @return a thompson dual compiler, with both automata finished on a fragment which accepts nothing
   */
  public static <S> DualCompiler<S> fromNothing() {
    DualCompiler<S> compiler = thompson();
    compiler.finish(compiler.nothing());
    return compiler;
  }

  /**
   * @return a thompson dual compiler, with both automata finished on a fragment which accepts only the empty input
   */
  public static <S> DualCompiler<S> fromEpsilon() {
    DualCompiler<S> compiler = thompson();
    compiler.finish(compiler.epsilon());
    return compiler;
  }

  /**
   * @return a thompson dual compiler, with both automata finished on a fragment which accepts only {@code signal}
   */
  public static <S> DualCompiler<S> fromLiteral(S signal) {
    DualCompiler<S> compiler = thompson();
    compiler.finish(compiler.literal(signal));
    return compiler;
  }

  /// operations

  public DualRef nothing() {
    return apply("nothing", Compiler::nothing, Compiler::nothing);
  }

  public DualRef epsilon() {
    return apply("epsilon", Compiler::epsilon, Compiler::epsilon);
  }

  public DualRef literal(S signal) {
    return apply("literal " + signal,
            (c, anfa) -> c.literal(anfa, signal),
            (c, anfa) -> c.literal(anfa, signal));
  }

  public DualRef concatenate(DualRef a, DualRef b) {
    return apply("concatenate",
            (c, anfa) -> c.concatenate(anfa, a.forward(), b.forward()),
            (c, anfa) -> c.concatenate(anfa, a.coverage(), b.coverage()));
  }

  public DualRef star(DualRef a) {
    return apply("star",
            (c, anfa) -> c.star(anfa, a.forward()),
            (c, anfa) -> c.star(anfa, a.coverage()));
  }

  public DualRef union(DualRef a, DualRef b) {
    return apply("union",
            (c, anfa) -> c.union(anfa, a.forward(), b.forward()),
            (c, anfa) -> c.union(anfa, a.coverage(), b.coverage()));
  }

  /**
   * Finishes both automata, on their respective halves of {@code ref}.
   */
  public void finish(DualRef ref) {
    apply("finish",
            (c, anfa) -> {
              c.finish(anfa, ref.forward());
              return ref.forward();
            },
            (c, anfa) -> {
              c.finish(anfa, ref.coverage());
              return ref.coverage();
            });
  }

  ///

  public ANFA<S> forward() {
    return forward;
  }

  public ANFA<S> coverage() {
    return coverage;
  }

  private DualRef apply(
          String operation,
          BiFunction<Compiler<S>, ANFA<S>, AutomataRef> forwardOp,
          BiFunction<Compiler<S>, ANFA<S>, AutomataRef> coverageOp) {

    AutomataRef forwardRef = null, coverageRef = null;
    RuntimeException forwardError = null, coverageError = null;

    try {
      forwardRef = forwardOp.apply(forwardCompiler, forward);
    } catch (RuntimeException e) {
      forwardError = e;
    }

    try {
      coverageRef = coverageOp.apply(coverageCompiler, coverage);
    } catch (RuntimeException e) {
      coverageError = e;
    }

    if (forwardError != null) {
      DualCompilationException e = new DualCompilationException(operation, Side.FORWARD, forwardError);
      if (coverageError != null) {
        e.addSuppressed(coverageError);
      }
      logger.log(Level.FINE, e.getMessage(), e);
      throw e;
    } else if (coverageError != null) {
      DualCompilationException e = new DualCompilationException(operation, Side.COVERAGE, coverageError);
      logger.log(Level.FINE, e.getMessage(), e);
      throw e;
    }

    DualRef ref = new DualRef(forwardRef, coverageRef);
    logger.log(level, "{0} -> {1}", new Object[]{operation, ref});
    return ref;
  }
}
