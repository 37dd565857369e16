package com.ospicorp.migrationflow.period;

import java.time.LocalDate;
import java.util.Objects;

public record DateWindow(LocalDate start, LocalDate end, BoundaryMode boundaryMode) {

  public DateWindow {
    Objects.requireNonNull(boundaryMode, "boundaryMode");
    if (start != null && end != null && end.isBefore(start)) {
      throw new IllegalArgumentException("window end must not be before start");
    }
  }

  public static DateWindow exclusive(LocalDate start, LocalDate end) {
    return new DateWindow(start, end, BoundaryMode.EXCLUSIVE_END);
  }

  public static DateWindow inclusive(LocalDate start, LocalDate end) {
    return new DateWindow(start, end, BoundaryMode.INCLUSIVE_END);
  }

  public boolean contains(LocalDate date) {
    return DateRangeFilter.isInRange(date, start, end, boundaryMode);
  }

  /** Last calendar day covered by the window, or {@code null} when open-ended. */
  public LocalDate lastIncludedDay() {
    if (end == null) return null;
    return boundaryMode == BoundaryMode.EXCLUSIVE_END ? end.minusDays(1) : end;
  }
}
