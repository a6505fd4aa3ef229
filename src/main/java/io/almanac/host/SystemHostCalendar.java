package io.almanac.host;

import io.almanac.model.Weekday;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.WeekFields;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HostCalendar} backed by java.time's ISO calendar.
 *
 * <p>java.time failures ({@link DateTimeException}, {@link ArithmeticException}) are caught here,
 * logged at DEBUG and reported as empty results.
 */
public final class SystemHostCalendar implements HostCalendar {
  private static final Logger log = LoggerFactory.getLogger(SystemHostCalendar.class);

  private final Clock clock;
  private final Weekday firstDayOfWeek;

  /**
   * Creates a calendar reading "today" from the clock and the first day of week from the locale.
   *
   * @param clock the clock, whose zone is used for instant conversions
   * @param locale the locale that decides the first day of week
   */
  public SystemHostCalendar(Clock clock, Locale locale) {
    this(clock, Weekday.fromDayOfWeek(WeekFields.of(locale).getFirstDayOfWeek()));
  }

  /**
   * Creates a calendar with an explicit first day of week.
   *
   * @param clock the clock, whose zone is used for instant conversions
   * @param firstDayOfWeek the weekday that starts a week row
   */
  public SystemHostCalendar(Clock clock, Weekday firstDayOfWeek) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.firstDayOfWeek = Objects.requireNonNull(firstDayOfWeek, "firstDayOfWeek");
  }

  /**
   * Returns a calendar using the JVM's default zone and locale.
   *
   * @return a new calendar
   */
  public static SystemHostCalendar systemDefault() {
    return new SystemHostCalendar(Clock.systemDefaultZone(), Locale.getDefault());
  }

  @Override
  public Optional<LocalDate> date(int year, int month, int day) {
    try {
      return Optional.of(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      log.debug("No date for {}-{}-{}: {}", year, month, day, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public DateParts components(LocalDate date) {
    return new DateParts(
        date.getYear(),
        date.getMonthValue(),
        date.getDayOfMonth(),
        Weekday.fromDayOfWeek(date.getDayOfWeek()));
  }

  @Override
  public Optional<LocalDate> add(LocalDate date, CalendarUnit unit, int amount) {
    try {
      return Optional.of(date.plus(amount, unit.toChronoUnit()));
    } catch (DateTimeException | ArithmeticException e) {
      log.debug("Cannot add {} {} to {}: {}", amount, unit, date, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public LocalDate toLocalDate(Instant instant) {
    return LocalDate.ofInstant(instant, clock.getZone());
  }

  @Override
  public LocalDate today() {
    return LocalDate.now(clock);
  }

  @Override
  public ZoneId zone() {
    return clock.getZone();
  }

  @Override
  public Weekday firstDayOfWeek() {
    return firstDayOfWeek;
  }
}
