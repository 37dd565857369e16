package com.ospicorp.migrationflow.query;

import java.time.LocalDate;

public record YearRange(LocalDate start, LocalDate end) {

  public static YearRange fullYear(int year) {
    return new YearRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
  }

  public int year() {
    return start.getYear();
  }
}
