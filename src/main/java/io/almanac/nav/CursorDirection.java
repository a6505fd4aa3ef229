package io.almanac.nav;

/** Arrow-key movement of the selected day. */
public enum CursorDirection {
  LEFT(-1),
  RIGHT(1),
  UP(-7),
  DOWN(7);

  private final int days;

  CursorDirection(int days) {
    this.days = days;
  }

  /**
   * Returns the signed number of days this movement shifts the selection by.
   *
   * @return the day offset
   */
  public int days() {
    return days;
  }
}
