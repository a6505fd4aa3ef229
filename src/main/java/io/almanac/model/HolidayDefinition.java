package io.almanac.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable template for a holiday.
 *
 * <p>A recurring definition carries a {@link HolidayRule}; only the month and day of its
 * {@code referenceDate} are meaningful, the year is scaffolding (2000, a leap year, when the
 * date is derived from a fixed rule). Floating rules have no single month and day, so their
 * {@code referenceDate} may be {@code null}. A non-recurring definition has no rule and its
 * {@code referenceDate} is the exact occurrence.
 *
 * @param name unique identifier, also the display name
 * @param referenceDate the anchoring date, {@code null} for floating recurring rules
 * @param recurring whether the holiday repeats every year
 * @param category the category used for filtering
 * @param rule the recurrence rule, {@code null} for non-recurring definitions
 * @param emoji display metadata, never interpreted
 * @param description display metadata, never interpreted
 */
public record HolidayDefinition(
    String name,
    LocalDate referenceDate,
    boolean recurring,
    HolidayCategory category,
    HolidayRule rule,
    String emoji,
    String description) {

  /** Scaffolding year for recurring reference dates; a leap year so that feb 29 fits. */
  public static final int SCAFFOLD_YEAR = 2000;

  /** Validates the definition and fills in derived fields. */
  public HolidayDefinition {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("holiday name must not be blank");
    }
    Objects.requireNonNull(category, "category");
    if (recurring) {
      Objects.requireNonNull(rule, "recurring holiday '" + name + "' needs a rule");
      if (referenceDate == null && rule.isFixed()) {
        referenceDate = LocalDate.of(SCAFFOLD_YEAR, rule.month().number(), rule.day());
      }
    } else {
      Objects.requireNonNull(referenceDate, "one-off holiday '" + name + "' needs a date");
      if (rule != null) {
        throw new IllegalArgumentException("one-off holiday '" + name + "' must not have a rule");
      }
    }
    emoji = emoji == null ? "" : emoji;
    description = description == null ? "" : description;
  }

  /**
   * Returns the anchoring date.
   *
   * <p>For a one-off holiday this is the occurrence itself. For a recurring fixed-date rule it
   * is that month and day in {@link #SCAFFOLD_YEAR}. For a recurring floating rule (nth weekday,
   * Easter, shifts, weekday on or before/after) it is {@code null}; resolve such holidays
   * through {@link io.almanac.eval.RuleEvaluator#dateInYear} instead.
   *
   * @return the reference date, or {@code null} for floating recurring rules
   */
  @Override
  public LocalDate referenceDate() {
    return referenceDate;
  }

  /**
   * Returns whether this definition has a reference date, which is false only for recurring
   * floating rules.
   *
   * @return true if {@link #referenceDate()} is non-null
   */
  public boolean hasReferenceDate() {
    return referenceDate != null;
  }

  /**
   * Creates a recurring definition without display metadata.
   *
   * @param name the holiday name
   * @param rule the recurrence rule
   * @param category the category
   * @return a new recurring definition
   */
  public static HolidayDefinition recurring(String name, HolidayRule rule, HolidayCategory category) {
    return new HolidayDefinition(name, null, true, category, rule, "", "");
  }

  /**
   * Creates a non-recurring definition for a single date.
   *
   * @param name the holiday name
   * @param date the exact date
   * @param category the category
   * @return a new one-off definition
   */
  public static HolidayDefinition oneOff(String name, LocalDate date, HolidayCategory category) {
    return new HolidayDefinition(name, date, false, category, null, "", "");
  }
}
