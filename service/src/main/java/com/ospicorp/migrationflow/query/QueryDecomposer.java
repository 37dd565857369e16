package com.ospicorp.migrationflow.query;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a date range into sub-queries the upstream API accepts. A range within one calendar year
 * is kept as is; a range crossing years becomes one full calendar year per year touched, which
 * widens the first and last sub-query to whole years.
 */
public final class QueryDecomposer {
  private QueryDecomposer() {
  }

  public static List<YearRange> decompose(LocalDate start, LocalDate end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
    if (start.getYear() == end.getYear()) {
      return List.of(new YearRange(start, end));
    }
    List<YearRange> out = new ArrayList<>(end.getYear() - start.getYear() + 1);
    for (int year = start.getYear(); year <= end.getYear(); year++) {
      out.add(YearRange.fullYear(year));
    }
    return out;
  }
}
