package io.almanac.nav;

import io.almanac.host.CalendarUnit;

/** The step size of anchor navigation. */
public enum NavigationUnit {
  DAY(CalendarUnit.DAY),
  WEEK(CalendarUnit.WEEK),
  MONTH(CalendarUnit.MONTH),
  YEAR(CalendarUnit.YEAR);

  private final CalendarUnit calendarUnit;

  NavigationUnit(CalendarUnit calendarUnit) {
    this.calendarUnit = calendarUnit;
  }

  /**
   * Returns the host calendar unit this step is computed in.
   *
   * @return the calendar unit
   */
  public CalendarUnit calendarUnit() {
    return calendarUnit;
  }
}
