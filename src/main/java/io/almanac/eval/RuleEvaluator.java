package io.almanac.eval;

import io.almanac.host.CalendarUnit;
import io.almanac.host.HostCalendar;
import io.almanac.model.HolidayDefinition;
import io.almanac.model.HolidayOccurrence;
import io.almanac.model.HolidayRule;
import io.almanac.model.HolidaySnapshot;
import io.almanac.model.MonthName;
import io.almanac.model.OrdinalPosition;
import io.almanac.model.Weekday;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves holiday rules to concrete dates.
 *
 * <h2>Failure handling</h2>
 *
 * <p>Every step goes through {@link HostCalendar}, whose operations return empty on failure. An
 * empty result means "the holiday does not occur that year" (feb 29 outside leap years, a fifth
 * weekday the month does not have). It never prevents other definitions or other years from
 * resolving.
 *
 * <h2>Nth weekday of month</h2>
 *
 * <p>For the first day of the month {@code F} and target weekday {@code W}:
 *
 * <ol>
 *   <li>{@code offset = (W - weekday(F) + 7) mod 7} is the distance to the first {@code W}.
 *   <li>The nth occurrence is {@code F + offset + (n - 1) * 7} days.
 * </ol>
 *
 * <p>{@code last} walks back from the month's final day using the same modular distance.
 *
 * <h2>Easter</h2>
 *
 * <p>Western Easter Sunday uses the anonymous Gregorian computus (Meeus/Jones/Butcher).
 */
public final class RuleEvaluator {
  private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

  private RuleEvaluator() {}

  /**
   * Returns the date a definition falls on in the given year.
   *
   * <p>Non-recurring definitions return their stored date whatever the year.
   *
   * @param definition the holiday definition
   * @param year the year to resolve
   * @param calendar the host calendar
   * @return the date, or empty if the holiday does not occur that year
   */
  public static Optional<LocalDate> dateInYear(
      HolidayDefinition definition, int year, HostCalendar calendar) {
    if (!definition.recurring()) {
      return Optional.of(definition.referenceDate());
    }
    return resolve(definition.rule(), year, calendar);
  }

  /**
   * Resolves a rule for one year.
   *
   * @param rule the rule
   * @param year the year
   * @param calendar the host calendar
   * @return the date, or empty if the rule has no date that year
   */
  public static Optional<LocalDate> resolve(HolidayRule rule, int year, HostCalendar calendar) {
    return switch (rule.kind()) {
      case FIXED_DATE -> calendar.date(year, rule.month().number(), rule.day());
      case NTH_WEEKDAY ->
          nthWeekdayOfMonth(year, rule.month(), rule.weekday(), rule.ordinal(), calendar);
      case EASTER_OFFSET ->
          easterSunday(year, calendar)
              .flatMap(easter -> calendar.add(easter, CalendarUnit.DAY, rule.offsetDays()));
      case SHIFTED ->
          resolve(rule.base(), year, calendar)
              .flatMap(d -> calendar.add(d, CalendarUnit.DAY, rule.offsetDays()));
      case WEEKDAY_ON_OR_BEFORE ->
          calendar
              .date(year, rule.month().number(), rule.day())
              .flatMap(d -> weekdayOnOrBefore(d, rule.weekday(), calendar));
      case WEEKDAY_AFTER ->
          resolve(rule.base(), year, calendar)
              .flatMap(d -> weekdayAfter(d, rule.weekday(), calendar));
    };
  }

  /**
   * Finds the nth given weekday of a month.
   *
   * @param year the year
   * @param month the month
   * @param weekday the weekday
   * @param ordinal which occurrence, or {@link OrdinalPosition#LAST}
   * @param calendar the host calendar
   * @return the date, or empty if the month has no such occurrence
   */
  public static Optional<LocalDate> nthWeekdayOfMonth(
      int year, MonthName month, Weekday weekday, OrdinalPosition ordinal, HostCalendar calendar) {
    Optional<LocalDate> firstOfMonth = calendar.date(year, month.number(), 1);
    if (firstOfMonth.isEmpty()) {
      return Optional.empty();
    }
    LocalDate first = firstOfMonth.get();

    if (ordinal == OrdinalPosition.LAST) {
      return lastWeekdayOfMonth(first, weekday, calendar);
    }

    int offset = calendar.components(first).weekday().daysUntil(weekday);
    Optional<LocalDate> nth =
        calendar
            .add(first, CalendarUnit.DAY, offset)
            .flatMap(d -> calendar.add(d, CalendarUnit.DAY, ordinal.weekOffsetDays()));

    // A fifth occurrence can spill into the next month.
    return nth.filter(d -> calendar.components(d).month() == month.number());
  }

  /**
   * Computes Western Easter Sunday for a Gregorian year.
   *
   * @param year the year
   * @param calendar the host calendar
   * @return Easter Sunday, or empty if the date cannot be built
   */
  public static Optional<LocalDate> easterSunday(int year, HostCalendar calendar) {
    int a = year % 19;
    int b = year / 100;
    int c = year % 100;
    int d = b / 4;
    int e = b % 4;
    int f = (b + 8) / 25;
    int g = (b - f + 1) / 3;
    int h = (19 * a + b - d - g + 15) % 30;
    int i = c / 4;
    int k = c % 4;
    int l = (32 + 2 * e + 2 * i - h - k) % 7;
    int m = (a + 11 * h + 22 * l) / 451;
    int month = (h + l - 7 * m + 114) / 31;
    int day = ((h + l - 7 * m + 114) % 31) + 1;
    return calendar.date(year, month, day);
  }

  /**
   * Materializes every definition for {@code referenceYear - 1} through {@code referenceYear + 1}.
   *
   * <p>Years a definition does not resolve in are skipped. A definition that resolves to the same
   * date in several years (every one-off holiday) appears once. The result is sorted by date;
   * ties keep definition order.
   *
   * @param definitions the holiday definitions
   * @param referenceYear the middle year
   * @param calendar the host calendar
   * @return a new snapshot
   */
  public static HolidaySnapshot rebuildSnapshot(
      List<HolidayDefinition> definitions, int referenceYear, HostCalendar calendar) {
    Set<HolidayOccurrence> collected = new LinkedHashSet<>();
    for (HolidayDefinition definition : definitions) {
      for (int year = referenceYear - 1; year <= referenceYear + 1; year++) {
        Optional<LocalDate> date = dateInYear(definition, year, calendar);
        if (date.isPresent()) {
          collected.add(new HolidayOccurrence(definition, date.get()));
        } else {
          log.debug("'{}' does not occur in {}", definition.name(), year);
        }
      }
    }
    List<HolidayOccurrence> occurrences = new ArrayList<>(collected);
    occurrences.sort(Comparator.comparing(HolidayOccurrence::occurrenceDate));
    return new HolidaySnapshot(referenceYear, occurrences);
  }

  private static Optional<LocalDate> lastWeekdayOfMonth(
      LocalDate firstOfMonth, Weekday weekday, HostCalendar calendar) {
    return calendar
        .add(firstOfMonth, CalendarUnit.MONTH, 1)
        .flatMap(next -> calendar.add(next, CalendarUnit.DAY, -1))
        .flatMap(last -> weekdayOnOrBefore(last, weekday, calendar));
  }

  private static Optional<LocalDate> weekdayOnOrBefore(
      LocalDate date, Weekday weekday, HostCalendar calendar) {
    int back = weekday.daysUntil(calendar.components(date).weekday());
    return calendar.add(date, CalendarUnit.DAY, -back);
  }

  private static Optional<LocalDate> weekdayAfter(
      LocalDate date, Weekday weekday, HostCalendar calendar) {
    int forward = calendar.components(date).weekday().daysUntil(weekday);
    return calendar.add(date, CalendarUnit.DAY, forward == 0 ? 7 : forward);
  }
}
