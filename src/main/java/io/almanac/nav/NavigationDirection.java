package io.almanac.nav;

/** Direction of anchor navigation. */
public enum NavigationDirection {
  FORWARD(1),
  BACKWARD(-1);

  private final int sign;

  NavigationDirection(int sign) {
    this.sign = sign;
  }

  /**
   * Returns +1 for forward and -1 for backward.
   *
   * @return the sign
   */
  public int sign() {
    return sign;
  }
}
