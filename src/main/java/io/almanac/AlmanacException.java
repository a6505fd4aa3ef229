package io.almanac;

import java.util.Optional;

/**
 * Exception thrown when holiday configuration cannot be read: a rule expression that does not
 * lex or parse, or a catalog entry that is malformed.
 *
 * <p>Date arithmetic never raises this exception. Dates that cannot be constructed are reported
 * as empty results by {@link io.almanac.host.HostCalendar}.
 */
public final class AlmanacException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  /** An optional suggestion for fixing the error. */
  private final String suggestion;

  private AlmanacException(
      ErrorKind kind, String message, Span span, String input, String suggestion, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.suggestion = suggestion;
  }

  /**
   * Creates a new lexer error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @return a new AlmanacException for a lexer error
   */
  public static AlmanacException lex(String message, Span span, String input) {
    return new AlmanacException(ErrorKind.LEX, message, span, input, null, null);
  }

  /**
   * Creates a new parser error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @param suggestion an optional suggestion for fixing the error
   * @return a new AlmanacException for a parser error
   */
  public static AlmanacException parse(
      String message, Span span, String input, String suggestion) {
    return new AlmanacException(ErrorKind.PARSE, message, span, input, suggestion, null);
  }

  /**
   * Creates a new catalog error.
   *
   * @param message the error message
   * @return a new AlmanacException for a catalog error
   */
  public static AlmanacException catalog(String message) {
    return new AlmanacException(ErrorKind.CATALOG, message, null, null, null, null);
  }

  /**
   * Creates a new catalog error caused by another exception.
   *
   * @param message the error message
   * @param cause the underlying failure
   * @return a new AlmanacException for a catalog error
   */
  public static AlmanacException catalog(String message, Throwable cause) {
    return new AlmanacException(ErrorKind.CATALOG, message, null, null, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Formats a rich error message with underline and optional suggestion.
   *
   * <p>For lex and parse errors with span and input, produces output like:
   *
   * <pre>
   * error: expected MONTH_NAME but got DAY_NAME
   *   fourth thursday of thursday
   *                      ^^^^^^^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if ((kind == ErrorKind.LEX || kind == ErrorKind.PARSE) && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");

      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.caretWidth()));

      if (suggestion != null && !suggestion.isEmpty()) {
        sb.append(" try: \"").append(suggestion).append("\"");
      }

      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
