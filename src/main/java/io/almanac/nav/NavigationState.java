package io.almanac.nav;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of a navigator's state.
 *
 * @param currentAnchor the reference point of the visible window
 * @param selectedDate the highlighted day, independent of the anchor
 * @param viewMode the active view mode
 * @param previousViewMode the mode to return to when leaving the year view
 */
public record NavigationState(
    LocalDate currentAnchor,
    Optional<LocalDate> selectedDate,
    ViewMode viewMode,
    Optional<ViewMode> previousViewMode) {
  /** Validates that no field is null. */
  public NavigationState {
    Objects.requireNonNull(currentAnchor, "currentAnchor");
    Objects.requireNonNull(selectedDate, "selectedDate");
    Objects.requireNonNull(viewMode, "viewMode");
    Objects.requireNonNull(previousViewMode, "previousViewMode");
  }

  /**
   * Creates a state with no selection and no remembered view mode.
   *
   * @param anchor the anchor
   * @param viewMode the view mode
   * @return a new state
   */
  public static NavigationState of(LocalDate anchor, ViewMode viewMode) {
    return new NavigationState(anchor, Optional.empty(), viewMode, Optional.empty());
  }

  NavigationState withAnchor(LocalDate anchor) {
    return new NavigationState(anchor, selectedDate, viewMode, previousViewMode);
  }

  NavigationState withSelection(LocalDate selection) {
    return new NavigationState(currentAnchor, Optional.of(selection), viewMode, previousViewMode);
  }

  NavigationState withViewMode(ViewMode mode, Optional<ViewMode> previous) {
    return new NavigationState(currentAnchor, selectedDate, mode, previous);
  }
}
