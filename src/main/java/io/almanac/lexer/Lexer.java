package io.almanac.lexer;

import io.almanac.AlmanacException;
import io.almanac.Span;
import io.almanac.model.MonthName;
import io.almanac.model.OrdinalPosition;
import io.almanac.model.Weekday;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Tokenizes holiday rule expressions. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the input string to tokenize
   * @return a list of tokens
   * @throws AlmanacException if the input contains invalid tokens
   */
  public static List<Token> tokenize(String input) throws AlmanacException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws AlmanacException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      if (ch == '+') {
        pos++;
        tokens.add(Token.keyword(TokenKind.PLUS, new Span(start, pos)));
        continue;
      }

      if (ch == '-') {
        pos++;
        tokens.add(Token.keyword(TokenKind.MINUS, new Span(start, pos)));
        continue;
      }

      if (isDigit(ch)) {
        tokens.add(lexNumber());
        continue;
      }

      if (isAlpha(ch)) {
        tokens.add(lexWord());
        continue;
      }

      throw AlmanacException.lex(
          "unexpected character '" + ch + "'", new Span(start, start + 1), input);
    }

    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private Token lexNumber() throws AlmanacException {
    int start = pos;
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    String digits = input.substring(start, pos);

    // Day numbers and offsets never need more than three digits.
    if (digits.length() > 3) {
      throw AlmanacException.lex("number too large", new Span(start, pos), input);
    }

    // Accept "25th"-style suffixes on day numbers.
    if (pos + 1 < input.length()) {
      String suffix = input.substring(pos, pos + 2).toLowerCase();
      if (suffix.equals("st")
          || suffix.equals("nd")
          || suffix.equals("rd")
          || suffix.equals("th")) {
        pos += 2;
      }
    }

    return Token.number(Integer.parseInt(digits), new Span(start, pos));
  }

  private Token lexWord() throws AlmanacException {
    int start = pos;
    while (pos < input.length() && isAlpha(input.charAt(pos))) {
      pos++;
    }
    String word = input.substring(start, pos).toLowerCase();
    Span span = new Span(start, pos);

    Token tok = KEYWORD_MAP.get(word);
    if (tok != null) {
      return tok.at(span);
    }

    Optional<Weekday> day = Weekday.parse(word);
    if (day.isPresent()) {
      return Token.dayName(day.get(), span);
    }
    Optional<MonthName> month = MonthName.parse(word);
    if (month.isPresent()) {
      return Token.monthName(month.get(), span);
    }
    Optional<OrdinalPosition> ordinal = OrdinalPosition.parse(word);
    if (ordinal.isPresent()) {
      return Token.ordinal(ordinal.get(), span);
    }

    throw AlmanacException.lex("unknown keyword '" + word + "'", span, input);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return Character.isLetter(c);
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  // Keyword map - values have dummy spans, actual spans are set when returning
  private static final Map<String, Token> KEYWORD_MAP = new HashMap<>();
  private static final Span DUMMY_SPAN = Span.at(0);

  static {
    KEYWORD_MAP.put("of", Token.keyword(TokenKind.OF, DUMMY_SPAN));
    KEYWORD_MAP.put("on", Token.keyword(TokenKind.ON, DUMMY_SPAN));
    KEYWORD_MAP.put("or", Token.keyword(TokenKind.OR, DUMMY_SPAN));
    KEYWORD_MAP.put("before", Token.keyword(TokenKind.BEFORE, DUMMY_SPAN));
    KEYWORD_MAP.put("after", Token.keyword(TokenKind.AFTER, DUMMY_SPAN));
    KEYWORD_MAP.put("day", Token.keyword(TokenKind.DAY, DUMMY_SPAN));
    KEYWORD_MAP.put("days", Token.keyword(TokenKind.DAY, DUMMY_SPAN));
    KEYWORD_MAP.put("easter", Token.keyword(TokenKind.EASTER, DUMMY_SPAN));
  }
}
