package io.almanac.nav;

import java.util.Map;
import java.util.Optional;

/**
 * How many days a calendar view shows at once.
 *
 * <p>The day-count views and the two-week view have a half-window radius used by the selection
 * stability rule: a selection within {@code radius} days of the anchor is considered visible. The
 * month and year views are calendar pages; a selection is visible when it falls on the anchor's
 * page.
 */
public enum ViewMode {
  ONE_DAY(1, "one day"),
  TWO_DAYS(2, "two days"),
  THREE_DAYS(3, "three days"),
  FOUR_DAYS(4, "four days"),
  FIVE_DAYS(5, "five days"),
  SIX_DAYS(6, "six days"),
  SEVEN_DAYS(7, "seven days"),
  EIGHT_DAYS(8, "eight days"),
  NINE_DAYS(9, "nine days"),
  TWO_WEEKS(14, "two weeks"),
  MONTH(31, "month"),
  YEAR(365, "year");

  private final int dayCount;
  private final String displayName;

  ViewMode(int dayCount, String displayName) {
    this.dayCount = dayCount;
    this.displayName = displayName;
  }

  /**
   * Returns the nominal number of days shown (31 for MONTH, 365 for YEAR).
   *
   * @return the day count
   */
  public int dayCount() {
    return dayCount;
  }

  /**
   * Returns the half-window radius in days: {@code dayCount / 2} for the 1-9 day views and 7 for
   * two weeks. Month (15) and year (182) report the nominal value, but their stability window is
   * the calendar page, see {@link #isCalendarPage()}.
   *
   * @return the radius
   */
  public int radius() {
    return dayCount / 2;
  }

  /**
   * Returns whether this view shows a whole calendar month or year.
   *
   * @return true for MONTH and YEAR
   */
  public boolean isCalendarPage() {
    return this == MONTH || this == YEAR;
  }

  /**
   * Returns whether this is one of the 1-9 day views.
   *
   * @return true for day-range views
   */
  public boolean isDayRange() {
    return dayCount <= 9;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<Integer, ViewMode> BY_DAY_COUNT =
      Map.ofEntries(
          Map.entry(1, ONE_DAY),
          Map.entry(2, TWO_DAYS),
          Map.entry(3, THREE_DAYS),
          Map.entry(4, FOUR_DAYS),
          Map.entry(5, FIVE_DAYS),
          Map.entry(6, SIX_DAYS),
          Map.entry(7, SEVEN_DAYS),
          Map.entry(8, EIGHT_DAYS),
          Map.entry(9, NINE_DAYS));

  /**
   * Returns the day-range view showing {@code n} days.
   *
   * @param n the number of days (1-9)
   * @return the view mode if valid
   */
  public static Optional<ViewMode> ofDays(int n) {
    return Optional.ofNullable(BY_DAY_COUNT.get(n));
  }
}
