package io.almanac.eval;

import io.almanac.host.DateParts;
import io.almanac.host.HostCalendar;
import io.almanac.model.HolidayOccurrence;
import io.almanac.model.HolidaySnapshot;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Matches holiday occurrences against query dates. */
public final class HolidayMatcher {
  private HolidayMatcher() {}

  /**
   * Checks whether an occurrence falls on the query date.
   *
   * <p>Recurring fixed-date holidays compare month and day only, so an occurrence from any year
   * matches. Every other occurrence must fall on the same calendar day.
   *
   * @param occurrence the occurrence
   * @param queryDate the date to test
   * @param calendar the host calendar
   * @return true if the occurrence matches
   */
  public static boolean occursOn(
      HolidayOccurrence occurrence, LocalDate queryDate, HostCalendar calendar) {
    if (occurrence.matchesByMonthDay()) {
      DateParts holiday = calendar.components(occurrence.occurrenceDate());
      DateParts query = calendar.components(queryDate);
      return holiday.month() == query.month() && holiday.day() == query.day();
    }
    return calendar.isSameDay(occurrence.occurrenceDate(), queryDate);
  }

  /**
   * Returns the holidays on a date, at most one per name.
   *
   * <p>The snapshot holds up to three yearly expansions of each recurring holiday; when more than
   * one matches, the earliest-dated one is kept.
   *
   * @param snapshot the snapshot to search
   * @param queryDate the date to test
   * @param calendar the host calendar
   * @return matching occurrences in snapshot order
   */
  public static List<HolidayOccurrence> holidaysOn(
      HolidaySnapshot snapshot, LocalDate queryDate, HostCalendar calendar) {
    List<HolidayOccurrence> result = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (HolidayOccurrence occurrence : snapshot.occurrences()) {
      if (occursOn(occurrence, queryDate, calendar) && seen.add(occurrence.name())) {
        result.add(occurrence);
      }
    }
    return result;
  }
}
