package io.almanac;

/** The type of error raised while reading holiday configuration. */
public enum ErrorKind {
  /** Lexer error - invalid tokens in a rule expression. */
  LEX("lex"),
  /** Parser error - invalid rule syntax. */
  PARSE("parse"),
  /** Catalog error - malformed or inconsistent holiday table. */
  CATALOG("catalog");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
