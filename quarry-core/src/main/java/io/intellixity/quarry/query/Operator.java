package io.intellixity.quarry.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  /** SQL LIKE semantics: '%' matches any run of characters, '_' matches exactly one. */
  LIKE
}
