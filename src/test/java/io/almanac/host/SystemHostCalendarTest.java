package io.almanac.host;

import static org.junit.jupiter.api.Assertions.*;

import io.almanac.model.Weekday;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for the java.time backed host calendar. */
public class SystemHostCalendarTest {

  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
  private static final SystemHostCalendar CAL =
      new SystemHostCalendar(Clock.fixed(Instant.parse("2025-12-08T03:00:00Z"), NEW_YORK), Weekday.MONDAY);

  @Test
  void testTodayUsesClockZone() {
    // 03:00 UTC is still the previous evening in New York
    assertEquals(LocalDate.of(2025, 12, 7), CAL.today());
  }

  @Test
  void testDateRejectsImpossibleDays() {
    assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), CAL.date(2024, 2, 29));
    assertTrue(CAL.date(2025, 2, 29).isEmpty());
    assertTrue(CAL.date(2025, 13, 1).isEmpty());
  }

  @Test
  void testComponents() {
    DateParts parts = CAL.components(LocalDate.of(2025, 11, 27));
    assertEquals(new DateParts(2025, 11, 27, Weekday.THURSDAY), parts);
  }

  @Test
  void testAddClampsMonthEnd() {
    assertEquals(
        Optional.of(LocalDate.of(2024, 2, 29)),
        CAL.add(LocalDate.of(2024, 1, 31), CalendarUnit.MONTH, 1));
    assertEquals(
        Optional.of(LocalDate.of(2025, 2, 28)),
        CAL.add(LocalDate.of(2024, 2, 29), CalendarUnit.YEAR, 1));
    assertEquals(
        Optional.of(LocalDate.of(2026, 1, 5)),
        CAL.add(LocalDate.of(2025, 12, 29), CalendarUnit.WEEK, 1));
  }

  @Test
  void testAddOutOfRangeIsEmpty() {
    assertTrue(CAL.add(LocalDate.MAX, CalendarUnit.DAY, 1).isEmpty());
    assertTrue(CAL.add(LocalDate.MIN, CalendarUnit.YEAR, -1).isEmpty());
  }

  @Test
  void testSameDayForInstantsUsesZone() {
    Instant lateEvening = Instant.parse("2025-12-08T04:00:00Z");
    Instant nextMorning = Instant.parse("2025-12-08T14:00:00Z");
    assertFalse(CAL.isSameDay(lateEvening, nextMorning));
    assertTrue(CAL.isSameDay(Instant.parse("2025-12-08T06:00:00Z"), nextMorning));
    assertEquals(LocalDate.of(2025, 12, 7), CAL.toLocalDate(lateEvening));
  }

  @Test
  void testFirstDayOfWeekFromLocale() {
    Clock clock = Clock.fixed(Instant.EPOCH, NEW_YORK);
    assertEquals(Weekday.SUNDAY, new SystemHostCalendar(clock, Locale.US).firstDayOfWeek());
    assertEquals(Weekday.MONDAY, new SystemHostCalendar(clock, Locale.GERMANY).firstDayOfWeek());
  }
}
