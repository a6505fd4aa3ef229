package io.almanac.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A holiday definition materialized for one concrete year.
 *
 * @param definition the definition this occurrence was produced from
 * @param occurrenceDate the date the holiday falls on
 */
public record HolidayOccurrence(HolidayDefinition definition, LocalDate occurrenceDate) {
  /** Validates that both fields are present. */
  public HolidayOccurrence {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(occurrenceDate, "occurrenceDate");
  }

  /**
   * Returns the holiday name.
   *
   * @return the name
   */
  public String name() {
    return definition.name();
  }

  /**
   * Returns whether the underlying definition recurs yearly.
   *
   * @return true if recurring
   */
  public boolean recurring() {
    return definition.recurring();
  }

  /**
   * Returns the holiday category.
   *
   * @return the category
   */
  public HolidayCategory category() {
    return definition.category();
  }

  /**
   * Returns whether matching ignores the year: true for recurring holidays on a fixed month and
   * day.
   *
   * @return true if only month and day are compared
   */
  public boolean matchesByMonthDay() {
    return definition.recurring() && definition.rule().isFixed();
  }

  @Override
  public String toString() {
    return name() + " (" + occurrenceDate + ")";
  }
}
