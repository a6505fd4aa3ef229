package io.almanac.nav;

import io.almanac.host.CalendarUnit;
import io.almanac.host.HostCalendar;
import io.almanac.model.Weekday;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Navigation state machine for one calendar view.
 *
 * <p>Owns the anchor, the optional selection and the view mode. Every operation computes the
 * complete next state first and only then replaces the current one, so a date step that the host
 * calendar cannot perform leaves the whole state untouched. No operation throws for date
 * failures.
 *
 * <h2>Stability rule</h2>
 *
 * <p>After the selection moves, the anchor is left alone when the new selection is still inside
 * the stability window, and is moved onto the selection otherwise. For the day-count views the
 * window is {@code [anchor - R, anchor + R]} with the mode's {@link ViewMode#radius() radius} R.
 * The month and year views use the page they display, the anchor's calendar month or year.
 *
 * <p>Not thread-safe; each view session owns its own navigator.
 */
public final class CalendarNavigator {
  private final HostCalendar calendar;
  private NavigationState state;

  /**
   * Creates a navigator anchored on today with nothing selected.
   *
   * @param calendar the host calendar
   * @param viewMode the initial view mode
   */
  public CalendarNavigator(HostCalendar calendar, ViewMode viewMode) {
    this(calendar, NavigationState.of(calendar.today(), viewMode));
  }

  /**
   * Creates a navigator starting from an explicit state.
   *
   * @param calendar the host calendar
   * @param initial the initial state
   */
  public CalendarNavigator(HostCalendar calendar, NavigationState initial) {
    this.calendar = Objects.requireNonNull(calendar, "calendar");
    this.state = Objects.requireNonNull(initial, "initial");
  }

  /**
   * Returns the current state.
   *
   * @return the state
   */
  public NavigationState state() {
    return state;
  }

  /**
   * Moves the anchor by one unit. Month steps keep the day of month where the target month is
   * long enough.
   *
   * @param unit the step size
   * @param direction forward or backward
   */
  public void navigate(NavigationUnit unit, NavigationDirection direction) {
    calendar
        .add(state.currentAnchor(), unit.calendarUnit(), direction.sign())
        .ifPresent(anchor -> state = state.withAnchor(anchor));
  }

  /** Moves forward one page: a year in the year view, a month otherwise. */
  public void nextPage() {
    navigate(pageUnit(), NavigationDirection.FORWARD);
  }

  /** Moves back one page: a year in the year view, a month otherwise. */
  public void previousPage() {
    navigate(pageUnit(), NavigationDirection.BACKWARD);
  }

  /** Anchors and selects today. */
  public void goToToday() {
    LocalDate today = calendar.today();
    state = state.withAnchor(today).withSelection(today);
  }

  /**
   * Selects a day, then re-anchors on it if it is outside the visible window.
   *
   * @param date the day to select
   */
  public void selectDate(LocalDate date) {
    stabilized(state.withSelection(date)).ifPresent(next -> state = next);
  }

  /**
   * Shifts the selection by a number of days, then applies the stability rule. Does nothing when
   * nothing is selected.
   *
   * @param days the signed number of days, typically -7 or 7
   */
  public void moveSelectedBy(int days) {
    if (state.selectedDate().isEmpty()) {
      return;
    }
    calendar
        .add(state.selectedDate().get(), CalendarUnit.DAY, days)
        .flatMap(selection -> stabilized(state.withSelection(selection)))
        .ifPresent(next -> state = next);
  }

  /**
   * Moves the selection like an arrow key. When nothing is selected, selects today instead.
   *
   * @param direction the arrow direction
   */
  public void moveSelection(CursorDirection direction) {
    if (state.selectedDate().isEmpty()) {
      selectDate(calendar.today());
      return;
    }
    moveSelectedBy(direction.days());
  }

  /**
   * Switches the view mode, remembering the current one unless switching to the year view.
   *
   * @param mode the new view mode
   */
  public void setViewMode(ViewMode mode) {
    Optional<ViewMode> previous =
        mode == ViewMode.YEAR ? state.previousViewMode() : Optional.of(state.viewMode());
    state = state.withViewMode(mode, previous);
  }

  /** Enters the year view, or returns from it to the remembered mode (month if none). */
  public void toggleYearView() {
    if (state.viewMode() == ViewMode.YEAR) {
      state = state.withViewMode(state.previousViewMode().orElse(ViewMode.MONTH), Optional.empty());
    } else {
      state = state.withViewMode(ViewMode.YEAR, Optional.of(state.viewMode()));
    }
  }

  /**
   * Returns whether a day is inside the current stability window.
   *
   * @param date the day
   * @return true if visible, false if outside or if the window cannot be computed
   */
  public boolean isWithinWindow(LocalDate date) {
    return window(state).map(w -> w.contains(date)).orElse(false);
  }

  /**
   * Returns the days the current state displays.
   *
   * @return the visible range, or empty if it cannot be computed
   */
  public Optional<DateRange> visibleRange() {
    return visibleRange(state.viewMode(), state.currentAnchor());
  }

  /**
   * Returns the days a view mode displays for an anchor.
   *
   * <ul>
   *   <li>1-9 day views: the anchor and the following {@code n - 1} days.
   *   <li>Two weeks: fourteen days from the start of the week containing the anchor.
   *   <li>Month: the anchor's month.
   *   <li>Year: the anchor's year.
   * </ul>
   *
   * @param mode the view mode
   * @param anchor the anchor
   * @return the visible range, or empty if the host calendar cannot compute it
   */
  public Optional<DateRange> visibleRange(ViewMode mode, LocalDate anchor) {
    return switch (mode) {
      case TWO_WEEKS -> twoWeekRange(anchor);
      case MONTH -> monthRange(anchor);
      case YEAR -> yearRange(anchor);
      default ->
          calendar
              .add(anchor, CalendarUnit.DAY, mode.dayCount() - 1)
              .map(end -> new DateRange(anchor, end));
    };
  }

  private NavigationUnit pageUnit() {
    return state.viewMode() == ViewMode.YEAR ? NavigationUnit.YEAR : NavigationUnit.MONTH;
  }

  /** Applies the stability rule to a state whose selection has just changed. */
  private Optional<NavigationState> stabilized(NavigationState candidate) {
    LocalDate selection = candidate.selectedDate().orElseThrow();
    return window(candidate)
        .map(w -> w.contains(selection) ? candidate : candidate.withAnchor(selection));
  }

  private Optional<DateRange> window(NavigationState s) {
    if (s.viewMode().isCalendarPage()) {
      return visibleRange(s.viewMode(), s.currentAnchor());
    }
    int radius = s.viewMode().radius();
    LocalDate anchor = s.currentAnchor();
    Optional<LocalDate> lower = calendar.add(anchor, CalendarUnit.DAY, -radius);
    Optional<LocalDate> upper = calendar.add(anchor, CalendarUnit.DAY, radius);
    if (lower.isEmpty() || upper.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new DateRange(lower.get(), upper.get()));
  }

  private Optional<DateRange> twoWeekRange(LocalDate anchor) {
    Weekday weekday = calendar.components(anchor).weekday();
    int back = calendar.firstDayOfWeek().daysUntil(weekday);
    return calendar
        .add(anchor, CalendarUnit.DAY, -back)
        .flatMap(
            start ->
                calendar
                    .add(start, CalendarUnit.DAY, 13)
                    .map(end -> new DateRange(start, end)));
  }

  private Optional<DateRange> monthRange(LocalDate anchor) {
    int year = calendar.components(anchor).year();
    int month = calendar.components(anchor).month();
    return calendar
        .date(year, month, 1)
        .flatMap(
            first ->
                calendar
                    .add(first, CalendarUnit.MONTH, 1)
                    .flatMap(next -> calendar.add(next, CalendarUnit.DAY, -1))
                    .map(last -> new DateRange(first, last)));
  }

  private Optional<DateRange> yearRange(LocalDate anchor) {
    int year = calendar.components(anchor).year();
    Optional<LocalDate> first = calendar.date(year, 1, 1);
    Optional<LocalDate> last = calendar.date(year, 12, 31);
    if (first.isEmpty() || last.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new DateRange(first.get(), last.get()));
  }
}
