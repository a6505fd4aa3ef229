package io.almanac.lexer;

import io.almanac.Span;
import io.almanac.model.MonthName;
import io.almanac.model.OrdinalPosition;
import io.almanac.model.Weekday;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param dayNameVal the weekday value (for DAY_NAME tokens)
 * @param monthNameVal the month value (for MONTH_NAME tokens)
 * @param ordinalVal the ordinal value (for ORDINAL tokens)
 * @param numberVal the number value (for NUMBER tokens)
 */
public record Token(
    TokenKind kind,
    Span span,
    Weekday dayNameVal,
    MonthName monthNameVal,
    OrdinalPosition ordinalVal,
    int numberVal) {
  /** Creates a keyword or symbol token. */
  public static Token keyword(TokenKind kind, Span span) {
    return new Token(kind, span, null, null, null, 0);
  }

  /** Creates a day name token. */
  public static Token dayName(Weekday day, Span span) {
    return new Token(TokenKind.DAY_NAME, span, day, null, null, 0);
  }

  /** Creates a month name token. */
  public static Token monthName(MonthName month, Span span) {
    return new Token(TokenKind.MONTH_NAME, span, null, month, null, 0);
  }

  /** Creates an ordinal token. */
  public static Token ordinal(OrdinalPosition ord, Span span) {
    return new Token(TokenKind.ORDINAL, span, null, null, ord, 0);
  }

  /** Creates a number token. */
  public static Token number(int value, Span span) {
    return new Token(TokenKind.NUMBER, span, null, null, null, value);
  }

  /** Returns a copy of this token located at {@code span}. */
  Token at(Span span) {
    return new Token(kind, span, dayNameVal, monthNameVal, ordinalVal, numberVal);
  }
}
