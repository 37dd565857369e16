package com.ospicorp.migrationflow.query;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryDecomposerTest {

  @Test
  void rangeWithinOneYearIsKeptAsIs() {
    LocalDate start = LocalDate.of(2020, 3, 1);
    LocalDate end = LocalDate.of(2020, 9, 30);
    assertEquals(List.of(new YearRange(start, end)), QueryDecomposer.decompose(start, end));
  }

  @Test
  void rangeAcrossYearsBecomesFullCalendarYears() {
    List<YearRange> ranges = QueryDecomposer.decompose(LocalDate.of(2019, 6, 1),
        LocalDate.of(2021, 2, 28));

    assertEquals(3, ranges.size());
    assertEquals(YearRange.fullYear(2019), ranges.get(0));
    assertEquals(YearRange.fullYear(2020), ranges.get(1));
    assertEquals(new YearRange(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 12, 31)),
        ranges.get(2));
  }

  @Test
  void singleDayIsOneRange() {
    LocalDate day = LocalDate.of(2020, 5, 5);
    assertEquals(1, QueryDecomposer.decompose(day, day).size());
  }

  @Test
  void reversedRangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> QueryDecomposer.decompose(LocalDate.of(2021, 1, 1), LocalDate.of(2020, 1, 1)));
  }
}
