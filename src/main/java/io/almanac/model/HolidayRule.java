package io.almanac.model;

import io.almanac.display.Display;
import java.util.Objects;

/**
 * How a recurring holiday lands in a given year.
 *
 * <p>Only the fields relevant to {@link #kind()} are populated; the others are {@code null} or
 * zero. Use the static factories rather than the canonical constructor.
 *
 * @param kind the type of rule
 * @param month the month (for FIXED_DATE, NTH_WEEKDAY and WEEKDAY_ON_OR_BEFORE)
 * @param day the day of month (for FIXED_DATE and WEEKDAY_ON_OR_BEFORE)
 * @param ordinal the ordinal position (for NTH_WEEKDAY)
 * @param weekday the weekday (for NTH_WEEKDAY, WEEKDAY_ON_OR_BEFORE and WEEKDAY_AFTER)
 * @param offsetDays the signed day offset (for EASTER_OFFSET and SHIFTED)
 * @param base the rule this one is relative to (for SHIFTED and WEEKDAY_AFTER)
 */
public record HolidayRule(
    Kind kind,
    MonthName month,
    int day,
    OrdinalPosition ordinal,
    Weekday weekday,
    int offsetDays,
    HolidayRule base) {

  /** The type of holiday rule. */
  public enum Kind {
    /** The same month and day every year (e.g., dec 25). */
    FIXED_DATE,
    /** An ordinal weekday in a month (e.g., fourth thursday of nov). */
    NTH_WEEKDAY,
    /** Western Easter Sunday plus a signed number of days (e.g., easter - 2). */
    EASTER_OFFSET,
    /** Another rule's date plus a signed number of days (e.g., 1 day after ...). */
    SHIFTED,
    /** The latest given weekday on or before a month and day (e.g., sunday on or before dec 3). */
    WEEKDAY_ON_OR_BEFORE,
    /** The first given weekday strictly after another rule's date. */
    WEEKDAY_AFTER
  }

  /** Validates the fields required by each kind. */
  public HolidayRule {
    Objects.requireNonNull(kind, "kind");
    switch (kind) {
      case FIXED_DATE, WEEKDAY_ON_OR_BEFORE -> {
        Objects.requireNonNull(month, "month");
        if (day < 1 || day > month.maxLength()) {
          throw new IllegalArgumentException("invalid day " + day + " for " + month);
        }
        if (kind == Kind.WEEKDAY_ON_OR_BEFORE) {
          Objects.requireNonNull(weekday, "weekday");
        }
      }
      case NTH_WEEKDAY -> {
        Objects.requireNonNull(month, "month");
        Objects.requireNonNull(ordinal, "ordinal");
        Objects.requireNonNull(weekday, "weekday");
      }
      case EASTER_OFFSET -> {}
      case SHIFTED -> Objects.requireNonNull(base, "base");
      case WEEKDAY_AFTER -> {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(weekday, "weekday");
      }
    }
  }

  /**
   * Creates a rule for a specific month and day.
   *
   * @param month the month
   * @param day the day
   * @return a new fixed-date rule
   */
  public static HolidayRule fixedDate(MonthName month, int day) {
    return new HolidayRule(Kind.FIXED_DATE, month, day, null, null, 0, null);
  }

  /**
   * Creates a rule for an ordinal weekday in a month.
   *
   * @param ordinal the ordinal position
   * @param weekday the weekday
   * @param month the month
   * @return a new ordinal weekday rule
   */
  public static HolidayRule nthWeekday(OrdinalPosition ordinal, Weekday weekday, MonthName month) {
    return new HolidayRule(Kind.NTH_WEEKDAY, month, 0, ordinal, weekday, 0, null);
  }

  /**
   * Creates a rule relative to Western Easter Sunday.
   *
   * @param offsetDays days to add to Easter Sunday, negative for earlier
   * @return a new Easter-relative rule
   */
  public static HolidayRule easter(int offsetDays) {
    return new HolidayRule(Kind.EASTER_OFFSET, null, 0, null, null, offsetDays, null);
  }

  /**
   * Creates a rule that shifts another rule by a number of days.
   *
   * @param base the rule to shift
   * @param offsetDays days to add, negative for earlier
   * @return a new shifted rule
   */
  public static HolidayRule shifted(HolidayRule base, int offsetDays) {
    return new HolidayRule(Kind.SHIFTED, null, 0, null, null, offsetDays, base);
  }

  /**
   * Creates a rule for the latest weekday on or before a month and day.
   *
   * @param weekday the weekday
   * @param month the month
   * @param day the day
   * @return a new weekday-on-or-before rule
   */
  public static HolidayRule weekdayOnOrBefore(Weekday weekday, MonthName month, int day) {
    return new HolidayRule(Kind.WEEKDAY_ON_OR_BEFORE, month, day, null, weekday, 0, null);
  }

  /**
   * Creates a rule for the first weekday strictly after another rule's date.
   *
   * @param weekday the weekday
   * @param base the rule to start from
   * @return a new weekday-after rule
   */
  public static HolidayRule weekdayAfter(Weekday weekday, HolidayRule base) {
    return new HolidayRule(Kind.WEEKDAY_AFTER, null, 0, null, weekday, 0, base);
  }

  /**
   * Returns whether this rule lands on the same month and day every year.
   *
   * @return true for FIXED_DATE rules
   */
  public boolean isFixed() {
    return kind == Kind.FIXED_DATE;
  }

  /**
   * Returns the canonical rule expression.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(this);
  }
}
