package io.lacuna.anfa;

import io.lacuna.anfa.compilers.Compiler;
import io.lacuna.anfa.compilers.ForwardCompiler;
import io.lacuna.bifurcan.LinearList;

/**
 * Builds an automaton from operations in postfix order, such as those produced by walking a regex syntax tree.
 * Acceptors push a new fragment, and each combinator pops its operands and pushes the result, so {@code a b . *}
 * is {@code literal('a'), literal('b'), concatenate(), star()}.
 *
 * @param <S> the signals that trigger transitions between states
 */
public class OperandStack<S> {

  private final Compiler<S> compiler;
  private final ANFA<S> anfa;
  private final LinearList<AutomataRef> operands = new LinearList<>();

  public OperandStack() {
    this(new ForwardCompiler<>(), new ANFA<>());
  }

  public OperandStack(Compiler<S> compiler, ANFA<S> anfa) {
    this.compiler = compiler;
    this.anfa = anfa;
  }

  /// acceptors

  public OperandStack<S> nothing() {
    operands.addLast(compiler.nothing(anfa));
    return this;
  }

  public OperandStack<S> epsilon() {
    operands.addLast(compiler.epsilon(anfa));
    return this;
  }

  public OperandStack<S> literal(S signal) {
    operands.addLast(compiler.literal(anfa, signal));
    return this;
  }

  /// combinators

  /**
   * Replaces the top two fragments with their concatenation, the lower one first.
   */
  public OperandStack<S> concatenate() {
    require("concatenate", 2);
    AutomataRef b = operands.nth(depth() - 1);
    AutomataRef a = operands.nth(depth() - 2);
    AutomataRef result = compiler.concatenate(anfa, a, b);
    pop("concatenate");
    pop("concatenate");
    operands.addLast(result);
    return this;
  }

  /**
   * Replaces the top fragment with its repetition.
   */
  public OperandStack<S> star() {
    require("star", 1);
    AutomataRef a = operands.nth(depth() - 1);
    AutomataRef result = compiler.star(anfa, a);
    pop("star");
    operands.addLast(result);
    return this;
  }

  /**
   * Replaces the top two fragments with their union.
   */
  public OperandStack<S> union() {
    require("union", 2);
    AutomataRef b = operands.nth(depth() - 1);
    AutomataRef a = operands.nth(depth() - 2);
    AutomataRef result = compiler.union(anfa, a, b);
    pop("union");
    pop("union");
    operands.addLast(result);
    return this;
  }

  ///

  /**
   * Pops the only remaining fragment and finishes the automaton on it.
   *
   * @return the finished automaton
   * @throws IllegalStateException if more than one fragment is left unconsumed
   */
  public ANFA<S> finish() {
    require("finish", 1);
    if (depth() > 1) {
      throw new IllegalStateException(depth() + " fragments were left unconsumed");
    }
    compiler.finish(anfa, pop("finish"));
    return anfa;
  }

  /**
   * @return the fragment on top of the stack
   */
  public AutomataRef peek() {
    require("peek", 1);
    return operands.nth(depth() - 1);
  }

  public int depth() {
    return (int) operands.size();
  }

  public ANFA<S> automaton() {
    return anfa;
  }

  private void require(String operation, int required) {
    if (depth() < required) {
      throw new InsufficientOperandsException(operation, required, depth());
    }
  }

  private AutomataRef pop(String operation) {
    if (operands.size() == 0) {
      throw new InvariantViolationException(operation + " found no operand after its operands were counted");
    }
    return operands.popLast();
  }
}
