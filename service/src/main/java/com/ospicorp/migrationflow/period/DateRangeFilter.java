package com.ospicorp.migrationflow.period;

import java.time.LocalDate;

public final class DateRangeFilter {
  private DateRangeFilter() {
  }

  public static boolean isInRange(LocalDate periodDate, LocalDate start, LocalDate end) {
    return isInRange(periodDate, start, end, BoundaryMode.EXCLUSIVE_END);
  }

  public static boolean isInRange(LocalDate periodDate, LocalDate start, LocalDate end,
      BoundaryMode mode) {
    if (periodDate == null) return false;
    if (start != null && periodDate.isBefore(start)) return false;
    if (end == null) return true;
    return switch (mode) {
      case EXCLUSIVE_END -> periodDate.isBefore(end);
      case INCLUSIVE_END -> !periodDate.isAfter(end);
    };
  }
}
