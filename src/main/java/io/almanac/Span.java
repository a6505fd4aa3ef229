package io.almanac;

/**
 * Character offsets of a token or error position inside a holiday rule expression.
 *
 * <p>A zero-width span ({@code start == end}) marks a position between characters, such as the
 * end of a truncated rule.
 *
 * @param start offset of the first covered character
 * @param end offset just past the last covered character
 */
public record Span(int start, int end) {

  /** Rejects negative or inverted offsets. */
  public Span {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("bad span [" + start + ", " + end + ")");
    }
  }

  /**
   * Returns the zero-width span at an offset.
   *
   * @param offset the position in the rule
   * @return a span covering no characters
   */
  public static Span at(int offset) {
    return new Span(offset, offset);
  }

  /**
   * Returns how many carets underline this span; a zero-width span still gets one.
   *
   * @return the caret count
   */
  public int caretWidth() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the part of the rule this span covers, clamped to the rule's length.
   *
   * @param rule the rule expression the span was taken from
   * @return the covered text, empty for a zero-width span
   */
  public String text(String rule) {
    int to = Math.min(end, rule.length());
    return start >= to ? "" : rule.substring(start, to);
  }
}
