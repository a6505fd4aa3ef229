package io.almanac.display;

import io.almanac.model.HolidayRule;

/** Renders holiday rules as canonical rule expressions. */
public final class Display {
  private Display() {}

  /**
   * Renders a rule as a canonical string that {@link io.almanac.parser.RuleParser} accepts.
   *
   * @param rule the rule to render
   * @return the canonical string representation
   */
  public static String render(HolidayRule rule) {
    return switch (rule.kind()) {
      case FIXED_DATE -> rule.month() + " " + rule.day();
      case NTH_WEEKDAY -> rule.ordinal() + " " + rule.weekday() + " of " + rule.month();
      case EASTER_OFFSET -> renderEaster(rule.offsetDays());
      case SHIFTED -> renderShift(rule.offsetDays()) + " " + render(rule.base());
      case WEEKDAY_ON_OR_BEFORE ->
          rule.weekday() + " on or before " + rule.month() + " " + rule.day();
      case WEEKDAY_AFTER -> rule.weekday() + " after " + render(rule.base());
    };
  }

  private static String renderEaster(int offset) {
    if (offset == 0) {
      return "easter";
    }
    return offset > 0 ? "easter + " + offset : "easter - " + (-offset);
  }

  private static String renderShift(int offset) {
    int magnitude = Math.abs(offset);
    String unit = magnitude == 1 ? "day" : "days";
    String direction = offset > 0 ? "after" : "before";
    return String.format("%d %s %s", magnitude, unit, direction);
  }
}
