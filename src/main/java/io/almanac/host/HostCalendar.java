package io.almanac.host;

import io.almanac.model.Weekday;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * The calendar capabilities the navigation engine and holiday resolver are built on.
 *
 * <p>Operations that can fail return {@link Optional#empty()} instead of throwing. Callers treat
 * an empty result as "no change" or "no occurrence". All operations follow the Gregorian calendar
 * and, where instants are involved, the calendar's {@link #zone()}.
 */
public interface HostCalendar {

  /**
   * Builds a date from its components.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @return the date, or empty if the combination does not exist
   */
  Optional<LocalDate> date(int year, int month, int day);

  /**
   * Splits a date into its components.
   *
   * @param date the date
   * @return year, month, day and weekday
   */
  DateParts components(LocalDate date);

  /**
   * Adds a signed number of units to a date using calendar arithmetic. Month and year arithmetic
   * keep the day of month when the target month is long enough, otherwise clamp to its last day.
   *
   * @param date the starting date
   * @param unit the unit to add
   * @param amount the number of units, negative to go back
   * @return the shifted date, or empty if it is out of range
   */
  Optional<LocalDate> add(LocalDate date, CalendarUnit unit, int amount);

  /**
   * Returns whether two dates are the same calendar day.
   *
   * @param a the first date
   * @param b the second date
   * @return true if the dates are equal
   */
  default boolean isSameDay(LocalDate a, LocalDate b) {
    return a.equals(b);
  }

  /**
   * Returns whether two instants fall on the same calendar day in this calendar's zone.
   *
   * @param a the first instant
   * @param b the second instant
   * @return true if both map to the same local date
   */
  default boolean isSameDay(Instant a, Instant b) {
    return toLocalDate(a).equals(toLocalDate(b));
  }

  /**
   * Converts an instant to the local date it falls on in this calendar's zone.
   *
   * @param instant the instant
   * @return the local date
   */
  LocalDate toLocalDate(Instant instant);

  /**
   * Returns today's date in this calendar's zone.
   *
   * @return today
   */
  LocalDate today();

  /**
   * Returns the zone used for instant conversions.
   *
   * @return the zone
   */
  ZoneId zone();

  /**
   * Returns the weekday that starts a week row.
   *
   * @return the first day of the week
   */
  Weekday firstDayOfWeek();
}
