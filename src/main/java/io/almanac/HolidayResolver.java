package io.almanac;

import io.almanac.catalog.HolidayCatalog;
import io.almanac.eval.HolidayMatcher;
import io.almanac.eval.RuleEvaluator;
import io.almanac.host.HostCalendar;
import io.almanac.model.HolidayCategory;
import io.almanac.model.HolidayDefinition;
import io.almanac.model.HolidayOccurrence;
import io.almanac.model.HolidaySnapshot;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "which holidays fall on this date" from a three-year snapshot of holiday occurrences.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * HolidayResolver resolver = HolidayResolver.withDefaultCatalog(SystemHostCalendar.systemDefault());
 * for (HolidayOccurrence h : resolver.holidaysOn(LocalDate.of(2025, 11, 27))) {
 *     System.out.println(h.name());
 * }
 * }</pre>
 *
 * <p>The snapshot is immutable and published through an atomic reference. A rebuild replaces it
 * wholesale, so concurrent readers see either the old snapshot or the new one in full.
 */
public final class HolidayResolver {
  private static final Logger log = LoggerFactory.getLogger(HolidayResolver.class);

  private final HostCalendar calendar;
  private final AtomicReference<List<HolidayDefinition>> definitions;
  private final AtomicReference<HolidaySnapshot> snapshot;
  private final AtomicReference<Set<HolidayCategory>> enabledCategories;

  /**
   * Creates a resolver and builds the snapshot around the calendar's current year.
   *
   * @param definitions the holiday definitions
   * @param calendar the host calendar
   */
  public HolidayResolver(List<HolidayDefinition> definitions, HostCalendar calendar) {
    this.calendar = Objects.requireNonNull(calendar, "calendar");
    this.definitions = new AtomicReference<>(List.copyOf(definitions));
    this.enabledCategories =
        new AtomicReference<>(Collections.unmodifiableSet(EnumSet.allOf(HolidayCategory.class)));
    this.snapshot = new AtomicReference<>();
    rebuild(calendar.today().getYear());
  }

  /**
   * Creates a resolver over the bundled holiday catalog.
   *
   * @param calendar the host calendar
   * @return a new resolver
   * @throws AlmanacException if the bundled catalog cannot be loaded
   */
  public static HolidayResolver withDefaultCatalog(HostCalendar calendar)
      throws AlmanacException {
    return new HolidayResolver(HolidayCatalog.loadDefault(), calendar);
  }

  /**
   * Rebuilds the snapshot for {@code referenceYear - 1} through {@code referenceYear + 1} and
   * publishes it.
   *
   * @param referenceYear the middle year
   * @return the new snapshot
   */
  public HolidaySnapshot rebuild(int referenceYear) {
    HolidaySnapshot next =
        RuleEvaluator.rebuildSnapshot(definitions.get(), referenceYear, calendar);
    snapshot.set(next);
    log.debug("Rebuilt holiday snapshot for {} with {} occurrences", referenceYear, next.size());
    return next;
  }

  /**
   * Rebuilds the snapshot if today's year differs from the snapshot's reference year.
   *
   * @return true if a rebuild happened
   */
  public boolean refreshIfNeeded() {
    int currentYear = calendar.today().getYear();
    if (snapshot.get().referenceYear() == currentYear) {
      return false;
    }
    rebuild(currentYear);
    return true;
  }

  /**
   * Replaces the definitions and rebuilds the snapshot around the same reference year.
   *
   * @param replacement the new definitions
   */
  public void replaceDefinitions(List<HolidayDefinition> replacement) {
    definitions.set(List.copyOf(replacement));
    rebuild(snapshot.get().referenceYear());
  }

  /**
   * Returns the current snapshot.
   *
   * @return the snapshot
   */
  public HolidaySnapshot snapshot() {
    return snapshot.get();
  }

  /**
   * Returns the current definitions.
   *
   * @return the definitions
   */
  public List<HolidayDefinition> definitions() {
    return definitions.get();
  }

  /**
   * Restricts every query to the given categories. The setting is held in memory only.
   *
   * @param categories the categories to keep
   */
  public void setEnabledCategories(Set<HolidayCategory> categories) {
    Set<HolidayCategory> copy =
        categories.isEmpty()
            ? EnumSet.noneOf(HolidayCategory.class)
            : EnumSet.copyOf(categories);
    enabledCategories.set(Collections.unmodifiableSet(copy));
  }

  /**
   * Returns the categories queries are restricted to.
   *
   * @return the enabled categories
   */
  public Set<HolidayCategory> enabledCategories() {
    return enabledCategories.get();
  }

  /**
   * Returns the holidays on a date, at most one per name, earliest-dated first.
   *
   * @param date the date
   * @return matching occurrences
   */
  public List<HolidayOccurrence> holidaysOn(LocalDate date) {
    Set<HolidayCategory> enabled = enabledCategories.get();
    List<HolidayOccurrence> result = new ArrayList<>();
    for (HolidayOccurrence occurrence : HolidayMatcher.holidaysOn(snapshot.get(), date, calendar)) {
      if (enabled.contains(occurrence.category())) {
        result.add(occurrence);
      }
    }
    return result;
  }

  /**
   * Returns the holidays on the day an instant falls on in the calendar's zone.
   *
   * @param instant the instant
   * @return matching occurrences
   */
  public List<HolidayOccurrence> holidaysOn(Instant instant) {
    return holidaysOn(calendar.toLocalDate(instant));
  }

  /**
   * Returns the occurrences dated in a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return occurrences in date order
   */
  public List<HolidayOccurrence> holidaysInMonth(int year, int month) {
    List<HolidayOccurrence> result = new ArrayList<>();
    for (HolidayOccurrence occurrence : enabledOccurrences()) {
      LocalDate d = occurrence.occurrenceDate();
      if (d.getYear() == year && d.getMonthValue() == month) {
        result.add(occurrence);
      }
    }
    return result;
  }

  /**
   * Returns the occurrences dated in a year.
   *
   * @param year the year
   * @return occurrences in date order
   */
  public List<HolidayOccurrence> holidaysForYear(int year) {
    List<HolidayOccurrence> result = new ArrayList<>();
    for (HolidayOccurrence occurrence : enabledOccurrences()) {
      if (occurrence.occurrenceDate().getYear() == year) {
        result.add(occurrence);
      }
    }
    return result;
  }

  /**
   * Returns the next occurrences dated today or later.
   *
   * @param limit the maximum number of results
   * @return occurrences in date order
   */
  public List<HolidayOccurrence> upcoming(int limit) {
    LocalDate today = calendar.today();
    List<HolidayOccurrence> result = new ArrayList<>();
    for (HolidayOccurrence occurrence : enabledOccurrences()) {
      if (result.size() >= limit) {
        break;
      }
      if (!occurrence.occurrenceDate().isBefore(today)) {
        result.add(occurrence);
      }
    }
    return result;
  }

  /**
   * Groups the snapshot's occurrences by category.
   *
   * @return occurrences per enabled category, in date order
   */
  public Map<HolidayCategory, List<HolidayOccurrence>> byCategory() {
    Map<HolidayCategory, List<HolidayOccurrence>> grouped = new EnumMap<>(HolidayCategory.class);
    for (HolidayOccurrence occurrence : enabledOccurrences()) {
      grouped.computeIfAbsent(occurrence.category(), c -> new ArrayList<>()).add(occurrence);
    }
    return grouped;
  }

  private List<HolidayOccurrence> enabledOccurrences() {
    Set<HolidayCategory> enabled = enabledCategories.get();
    List<HolidayOccurrence> result = new ArrayList<>();
    for (HolidayOccurrence occurrence : snapshot.get().occurrences()) {
      if (enabled.contains(occurrence.category())) {
        result.add(occurrence);
      }
    }
    return result;
  }
}
