package io.almanac.model;

import java.util.Map;
import java.util.Optional;

/** Which occurrence of a weekday within a month a floating holiday falls on. */
public enum OrdinalPosition {
  FIRST(1, "first"),
  SECOND(2, "second"),
  THIRD(3, "third"),
  FOURTH(4, "fourth"),
  FIFTH(5, "fifth"),
  LAST(-1, "last");

  private final int number;
  private final String displayName;

  OrdinalPosition(int number, String displayName) {
    this.number = number;
    this.displayName = displayName;
  }

  /**
   * Returns the number of whole weeks between the first matching weekday of a month and this
   * occurrence. Not defined for {@link #LAST}, which is resolved from the end of the month.
   *
   * @return days to add to the first occurrence, {@code (n - 1) * 7}
   * @throws IllegalStateException if called on {@link #LAST}
   */
  public int weekOffsetDays() {
    if (this == LAST) {
      throw new IllegalStateException("LAST has no forward week offset");
    }
    return (number - 1) * 7;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, OrdinalPosition> PARSE_MAP =
      Map.of(
          "first", FIRST,
          "second", SECOND,
          "third", THIRD,
          "fourth", FOURTH,
          "fifth", FIFTH,
          "last", LAST);

  /**
   * Parses an ordinal position name (case insensitive).
   *
   * @param s the string to parse
   * @return the ordinal position if valid
   */
  public static Optional<OrdinalPosition> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase()));
  }
}
