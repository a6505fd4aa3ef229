package io.almanac.parser;

import io.almanac.AlmanacException;
import io.almanac.Span;
import io.almanac.lexer.Lexer;
import io.almanac.lexer.Token;
import io.almanac.lexer.TokenKind;
import io.almanac.model.HolidayRule;
import io.almanac.model.MonthName;
import io.almanac.model.OrdinalPosition;
import io.almanac.model.Weekday;
import java.util.List;

/**
 * Recursive descent parser for holiday rule expressions.
 *
 * <pre>
 * rule        := shift | weekday-rel | base
 * shift       := NUMBER ("day" | "days") ("after" | "before") rule
 * weekday-rel := DAY_NAME "on" "or" "before" MONTH_NAME NUMBER
 *              | DAY_NAME "after" rule
 * base        := MONTH_NAME NUMBER
 *              | ORDINAL DAY_NAME "of" MONTH_NAME
 *              | "easter" [("+" | "-") NUMBER]
 * </pre>
 */
public final class RuleParser {
  private static final String[] ORDINAL_WORDS = {"first", "second", "third", "fourth", "fifth"};

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private RuleParser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses a rule expression.
   *
   * @param input the input string to parse
   * @return the parsed rule
   * @throws AlmanacException if the input is invalid
   */
  public static HolidayRule parse(String input) throws AlmanacException {
    if (input == null || input.trim().isEmpty()) {
      throw AlmanacException.parse("empty input", Span.at(0), input, null);
    }

    List<Token> tokens = Lexer.tokenize(input);
    if (tokens.isEmpty()) {
      throw AlmanacException.parse("empty input", Span.at(0), input, null);
    }

    RuleParser parser = new RuleParser(input, tokens);
    HolidayRule rule = parser.parseRule();
    if (parser.pos < tokens.size()) {
      Span extra = tokens.get(parser.pos).span();
      throw parser.parseError("unexpected token '" + extra.text(input) + "'", extra);
    }
    return rule;
  }

  /**
   * Validates a rule expression without throwing.
   *
   * @param input the rule expression
   * @return true if the expression is valid
   */
  public static boolean validate(String input) {
    try {
      parse(input);
      return true;
    } catch (AlmanacException e) {
      return false;
    }
  }

  private HolidayRule parseRule() throws AlmanacException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of input", endSpan());
    }

    return switch (tok.kind()) {
      case NUMBER -> parseShift();
      case DAY_NAME -> parseWeekdayRelative();
      case MONTH_NAME -> parseFixedDate();
      case ORDINAL -> parseNthWeekday();
      case EASTER -> parseEaster();
      default ->
          throw parseError("expected a month, ordinal, weekday, number or 'easter'", tok.span());
    };
  }

  private HolidayRule parseShift() throws AlmanacException {
    Token numTok = expect(TokenKind.NUMBER);

    // "4th thursday of nov" is a common slip for "fourth thursday of nov"
    if (check(TokenKind.DAY_NAME)
        && numTok.numberVal() >= 1
        && numTok.numberVal() <= ORDINAL_WORDS.length) {
      throw AlmanacException.parse(
          "expected 'day' or 'days' after number",
          tokens.get(pos).span(),
          input,
          ORDINAL_WORDS[numTok.numberVal() - 1] + " " + tokens.get(pos).dayNameVal());
    }

    expect(TokenKind.DAY);
    if (numTok.numberVal() == 0) {
      throw parseError("zero offset", numTok.span());
    }

    Token dir = peek();
    if (dir == null) {
      throw parseError("expected 'after' or 'before' but reached end of input", endSpan());
    }
    int sign;
    if (dir.kind() == TokenKind.AFTER) {
      sign = 1;
    } else if (dir.kind() == TokenKind.BEFORE) {
      sign = -1;
    } else {
      throw parseError("expected 'after' or 'before'", dir.span());
    }
    pos++;

    HolidayRule base = parseRule();
    return HolidayRule.shifted(base, sign * numTok.numberVal());
  }

  private HolidayRule parseWeekdayRelative() throws AlmanacException {
    Weekday weekday = expect(TokenKind.DAY_NAME).dayNameVal();

    if (check(TokenKind.AFTER)) {
      pos++;
      return HolidayRule.weekdayAfter(weekday, parseRule());
    }

    expect(TokenKind.ON);
    expect(TokenKind.OR);
    expect(TokenKind.BEFORE);
    Token monthTok = expect(TokenKind.MONTH_NAME);
    Token dayTok = expect(TokenKind.NUMBER);
    validateDay(monthTok.monthNameVal(), dayTok);
    return HolidayRule.weekdayOnOrBefore(weekday, monthTok.monthNameVal(), dayTok.numberVal());
  }

  private HolidayRule parseFixedDate() throws AlmanacException {
    Token monthTok = expect(TokenKind.MONTH_NAME);
    Token dayTok = expect(TokenKind.NUMBER);
    validateDay(monthTok.monthNameVal(), dayTok);
    return HolidayRule.fixedDate(monthTok.monthNameVal(), dayTok.numberVal());
  }

  private HolidayRule parseNthWeekday() throws AlmanacException {
    OrdinalPosition ordinal = expect(TokenKind.ORDINAL).ordinalVal();
    Token dayTok = expect(TokenKind.DAY_NAME);
    expect(TokenKind.OF);
    Token monthTok = expect(TokenKind.MONTH_NAME);
    return HolidayRule.nthWeekday(ordinal, dayTok.dayNameVal(), monthTok.monthNameVal());
  }

  private HolidayRule parseEaster() throws AlmanacException {
    expect(TokenKind.EASTER);

    int sign;
    if (check(TokenKind.PLUS)) {
      sign = 1;
    } else if (check(TokenKind.MINUS)) {
      sign = -1;
    } else {
      return HolidayRule.easter(0);
    }
    pos++;

    Token numTok = expect(TokenKind.NUMBER);
    return HolidayRule.easter(sign * numTok.numberVal());
  }

  private void validateDay(MonthName month, Token dayTok) throws AlmanacException {
    int day = dayTok.numberVal();
    if (day < 1 || day > month.maxLength()) {
      throw parseError("invalid day " + day + " for " + month, dayTok.span());
    }
  }

  // Helper methods

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Token expect(TokenKind kind) throws AlmanacException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected " + kind + " but reached end of input", endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError("expected " + kind + " but got " + tok.kind(), tok.span());
    }
    pos++;
    return tok;
  }

  private Span endSpan() {
    if (tokens.isEmpty()) {
      return Span.at(0);
    }
    return Span.at(tokens.get(tokens.size() - 1).span().end());
  }

  private AlmanacException parseError(String message, Span span) {
    return AlmanacException.parse(message, span, input, null);
  }
}
