package io.almanac.model;

import java.util.List;

/**
 * Immutable materialization of holiday occurrences for the three years around a reference year,
 * sorted by date.
 *
 * @param referenceYear the middle year of the window
 * @param occurrences occurrences sorted by date
 */
public record HolidaySnapshot(int referenceYear, List<HolidayOccurrence> occurrences) {
  /** Creates a new HolidaySnapshot with defensive copy of the occurrences list. */
  public HolidaySnapshot {
    occurrences = List.copyOf(occurrences);
  }

  /**
   * Returns a snapshot with no occurrences.
   *
   * @param referenceYear the reference year
   * @return an empty snapshot
   */
  public static HolidaySnapshot empty(int referenceYear) {
    return new HolidaySnapshot(referenceYear, List.of());
  }

  /**
   * Returns the first year covered by this snapshot.
   *
   * @return {@code referenceYear - 1}
   */
  public int firstYear() {
    return referenceYear - 1;
  }

  /**
   * Returns the last year covered by this snapshot.
   *
   * @return {@code referenceYear + 1}
   */
  public int lastYear() {
    return referenceYear + 1;
  }

  /**
   * Returns the number of occurrences.
   *
   * @return the size
   */
  public int size() {
    return occurrences.size();
  }
}
