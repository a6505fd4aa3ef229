package io.almanac.lexer;

/** The type of token in a holiday rule expression. */
public enum TokenKind {
  // Keywords
  /** The "of" keyword. */
  OF,
  /** The "on" keyword. */
  ON,
  /** The "or" keyword. */
  OR,
  /** The "before" keyword. */
  BEFORE,
  /** The "after" keyword. */
  AFTER,
  /** The "day" or "days" keyword. */
  DAY,
  /** The "easter" keyword. */
  EASTER,

  // Value-carrying tokens
  /** A day-of-week name (e.g., "thursday"). */
  DAY_NAME,
  /** A month name (e.g., "nov"). */
  MONTH_NAME,
  /** An ordinal position (e.g., "fourth", "last"). */
  ORDINAL,
  /** A numeric literal. */
  NUMBER,
  /** A plus sign. */
  PLUS,
  /** A minus sign. */
  MINUS
}
