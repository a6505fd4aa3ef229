package io.almanac.nav;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * An inclusive range of calendar days.
 *
 * @param start the first day
 * @param end the last day, not before {@code start}
 */
public record DateRange(LocalDate start, LocalDate end) {
  /** Validates the range bounds. */
  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
  }

  /**
   * Returns whether a day lies in the range, bounds included.
   *
   * @param date the day
   * @return true if {@code start <= date <= end}
   */
  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  /**
   * Returns the number of days in the range.
   *
   * @return the inclusive day count
   */
  public long days() {
    return ChronoUnit.DAYS.between(start, end) + 1;
  }
}
