package io.almanac.model;

import java.util.Optional;

/** Coarse grouping of holidays, used for filtering. */
public enum HolidayCategory {
  RELIGIOUS("religious"),
  CULTURAL("cultural"),
  NATIONAL("national"),
  SEASONAL("seasonal"),
  EDUCATIONAL("educational"),
  OTHER("other");

  private final String value;

  HolidayCategory(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase name used in catalog files.
   *
   * @return the category as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }

  /**
   * Parses a category name (case insensitive).
   *
   * @param s the string to parse
   * @return the category if valid
   */
  public static Optional<HolidayCategory> parse(String s) {
    for (HolidayCategory c : values()) {
      if (c.value.equalsIgnoreCase(s)) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }
}
