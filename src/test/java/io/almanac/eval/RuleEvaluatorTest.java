package io.almanac.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.almanac.AlmanacException;
import io.almanac.host.HostCalendar;
import io.almanac.host.SystemHostCalendar;
import io.almanac.model.HolidayCategory;
import io.almanac.model.HolidayDefinition;
import io.almanac.model.HolidayOccurrence;
import io.almanac.model.HolidayRule;
import io.almanac.model.HolidaySnapshot;
import io.almanac.model.MonthName;
import io.almanac.model.OrdinalPosition;
import io.almanac.model.Weekday;
import io.almanac.parser.RuleParser;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for rule resolution and snapshot construction. */
public class RuleEvaluatorTest {

  private static final HostCalendar CAL =
      new SystemHostCalendar(
          Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC), Weekday.MONDAY);

  private static LocalDate resolve(String rule, int year) throws AlmanacException {
    return RuleEvaluator.resolve(RuleParser.parse(rule), year, CAL).orElseThrow();
  }

  @Test
  void testThanksgivingIsFourthNovemberThursday() {
    for (int year = 2020; year <= 2035; year++) {
      LocalDate actual =
          RuleEvaluator.nthWeekdayOfMonth(
                  year, MonthName.NOVEMBER, Weekday.THURSDAY, OrdinalPosition.FOURTH, CAL)
              .orElseThrow();
      assertEquals(Month.NOVEMBER, actual.getMonth());
      assertEquals(DayOfWeek.THURSDAY, actual.getDayOfWeek());
      assertTrue(actual.getDayOfMonth() >= 22 && actual.getDayOfMonth() <= 28, actual.toString());
    }
  }

  @ParameterizedTest
  @CsvSource({
    "2024, 2024-03-31",
    "2025, 2025-04-20",
    "2026, 2026-04-05",
    "2027, 2027-03-28"
  })
  void testEasterSunday(int year, LocalDate expected) {
    assertEquals(Optional.of(expected), RuleEvaluator.easterSunday(year, CAL));
  }

  @Test
  void testEasterOffsets() throws AlmanacException {
    assertEquals(LocalDate.of(2025, 4, 18), resolve("easter - 2", 2025));
    assertEquals(LocalDate.of(2025, 4, 21), resolve("easter + 1", 2025));
    assertEquals(LocalDate.of(2025, 3, 4), resolve("easter - 47", 2025));
  }

  @Test
  void testLastWeekdayOfMonth() throws AlmanacException {
    assertEquals(LocalDate.of(2024, 5, 27), resolve("last monday of may", 2024));
    assertEquals(LocalDate.of(2025, 5, 26), resolve("last monday of may", 2025));
    assertEquals(LocalDate.of(2026, 5, 25), resolve("last monday of may", 2026));
    // the month's final day is itself the target weekday
    assertEquals(LocalDate.of(2025, 8, 31), resolve("last sunday of aug", 2025));
  }

  @Test
  void testFirstAndThirdWeekday() throws AlmanacException {
    assertEquals(LocalDate.of(2024, 9, 2), resolve("first monday of sep", 2024));
    assertEquals(LocalDate.of(2025, 9, 1), resolve("first monday of sep", 2025));
    assertEquals(LocalDate.of(2026, 9, 7), resolve("first monday of sep", 2026));
    assertEquals(LocalDate.of(2024, 1, 15), resolve("third monday of jan", 2024));
    assertEquals(LocalDate.of(2025, 1, 20), resolve("third monday of jan", 2025));
    assertEquals(LocalDate.of(2026, 1, 19), resolve("third monday of jan", 2026));
  }

  @Test
  void testFifthWeekdayMissingFromMonth() throws AlmanacException {
    // February 2025 has four Mondays
    assertTrue(
        RuleEvaluator.resolve(RuleParser.parse("fifth monday of feb"), 2025, CAL).isEmpty());
    // December 2025 has five Mondays: 1, 8, 15, 22, 29
    assertEquals(LocalDate.of(2025, 12, 29), resolve("fifth monday of dec", 2025));
  }

  @Test
  void testShiftedRules() throws AlmanacException {
    assertEquals(LocalDate.of(2025, 11, 28), resolve("1 day after fourth thursday of nov", 2025));
    assertEquals(LocalDate.of(2025, 12, 1), resolve("4 days after fourth thursday of nov", 2025));
    assertEquals(LocalDate.of(2025, 5, 24), resolve("2 days before last monday of may", 2025));
  }

  @Test
  void testWeekdayAfterSkipsSameDay() throws AlmanacException {
    assertEquals(LocalDate.of(2024, 9, 8), resolve("sunday after first monday of sep", 2024));
    assertEquals(LocalDate.of(2025, 9, 7), resolve("sunday after first monday of sep", 2025));
    assertEquals(LocalDate.of(2026, 9, 13), resolve("sunday after first monday of sep", 2026));
    assertEquals(LocalDate.of(2024, 11, 5), resolve("tuesday after first monday of nov", 2024));
    // the base is already a Monday, so the next Monday is a week later
    assertEquals(LocalDate.of(2025, 9, 8), resolve("monday after first monday of sep", 2025));
  }

  @Test
  void testWeekdayOnOrBefore() throws AlmanacException {
    assertEquals(LocalDate.of(2024, 12, 1), resolve("sunday on or before dec 3", 2024));
    assertEquals(LocalDate.of(2025, 11, 30), resolve("sunday on or before dec 3", 2025));
    assertEquals(LocalDate.of(2026, 11, 29), resolve("sunday on or before dec 3", 2026));
    // dec 3 2028 is a Sunday
    assertEquals(LocalDate.of(2028, 12, 3), resolve("sunday on or before dec 3", 2028));
  }

  @Test
  void testLeapDayOnlyInLeapYears() throws AlmanacException {
    HolidayRule leapDay = RuleParser.parse("feb 29");
    assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), RuleEvaluator.resolve(leapDay, 2024, CAL));
    assertTrue(RuleEvaluator.resolve(leapDay, 2025, CAL).isEmpty());
    assertTrue(RuleEvaluator.resolve(leapDay, 2100, CAL).isEmpty());
  }

  @Test
  void testOneOffIgnoresYear() {
    HolidayDefinition eclipse =
        HolidayDefinition.oneOff("Eclipse", LocalDate.of(2024, 4, 8), HolidayCategory.SEASONAL);
    assertEquals(Optional.of(LocalDate.of(2024, 4, 8)), RuleEvaluator.dateInYear(eclipse, 2030, CAL));
  }

  @Test
  void testRebuildSnapshotCoversThreeYearsSorted() throws AlmanacException {
    List<HolidayDefinition> defs =
        List.of(
            HolidayDefinition.recurring(
                "Christmas Day", RuleParser.parse("dec 25"), HolidayCategory.RELIGIOUS),
            HolidayDefinition.recurring(
                "New Year's Day", RuleParser.parse("jan 1"), HolidayCategory.NATIONAL),
            HolidayDefinition.recurring(
                "Leap Day", RuleParser.parse("feb 29"), HolidayCategory.OTHER),
            HolidayDefinition.oneOff("Eclipse", LocalDate.of(2024, 4, 8), HolidayCategory.SEASONAL));

    HolidaySnapshot snapshot = RuleEvaluator.rebuildSnapshot(defs, 2025, CAL);

    assertEquals(2025, snapshot.referenceYear());
    assertEquals(2024, snapshot.firstYear());
    assertEquals(2026, snapshot.lastYear());
    // 3 Christmas + 3 New Year + 1 Leap Day (2024 only) + 1 eclipse
    assertEquals(8, snapshot.size());

    List<HolidayOccurrence> occurrences = snapshot.occurrences();
    for (int i = 1; i < occurrences.size(); i++) {
      assertFalse(
          occurrences.get(i).occurrenceDate().isBefore(occurrences.get(i - 1).occurrenceDate()));
    }
    assertEquals(LocalDate.of(2024, 1, 1), occurrences.get(0).occurrenceDate());
    assertEquals(
        1, occurrences.stream().filter(o -> o.name().equals("Leap Day")).count());
    assertEquals(1, occurrences.stream().filter(o -> o.name().equals("Eclipse")).count());
  }

  @Test
  void testOneOffInsideWindowAppearsOnce() {
    HolidayDefinition diwali =
        HolidayDefinition.oneOff("Diwali", LocalDate.of(2025, 10, 20), HolidayCategory.CULTURAL);

    HolidaySnapshot snapshot = RuleEvaluator.rebuildSnapshot(List.of(diwali), 2025, CAL);

    assertEquals(1, snapshot.size());
    assertEquals(LocalDate.of(2025, 10, 20), snapshot.occurrences().get(0).occurrenceDate());
  }

  @Test
  void testRebuildSnapshotWithNoDefinitions() {
    HolidaySnapshot snapshot = RuleEvaluator.rebuildSnapshot(List.of(), 2025, CAL);
    assertEquals(0, snapshot.size());
  }
}
