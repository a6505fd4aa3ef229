package io.almanac.host;

import java.time.temporal.ChronoUnit;

/** A calendar field that signed offsets can be added to. */
public enum CalendarUnit {
  DAY(ChronoUnit.DAYS),
  WEEK(ChronoUnit.WEEKS),
  MONTH(ChronoUnit.MONTHS),
  YEAR(ChronoUnit.YEARS);

  private final ChronoUnit chronoUnit;

  CalendarUnit(ChronoUnit chronoUnit) {
    this.chronoUnit = chronoUnit;
  }

  /**
   * Returns the matching java.time unit.
   *
   * @return the ChronoUnit
   */
  public ChronoUnit toChronoUnit() {
    return chronoUnit;
  }
}
