package io.lacuna.anfa.compilers;

/**
 * The logical operations a compiler can be asked to perform.
 */
public enum Operation {
  NOTHING,
  EPSILON,
  LITERAL,
  CONCATENATE,
  STAR,
  UNION
}
