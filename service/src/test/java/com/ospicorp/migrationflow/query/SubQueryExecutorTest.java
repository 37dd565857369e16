package com.ospicorp.migrationflow.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SubQueryExecutorTest {
  private final ExecutorService pool = Executors.newFixedThreadPool(3);
  private final SubQueryExecutor executor = new SubQueryExecutor(pool);

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  @Test
  void resultsKeepTheOrderOfTheRanges() {
    List<YearRange> ranges = List.of(YearRange.fullYear(2019), YearRange.fullYear(2020),
        YearRange.fullYear(2021));

    List<Integer> years = executor.runAll(ranges, YearRange::year);

    assertThat(years).containsExactly(2019, 2020, 2021);
  }

  @Test
  void anyFailureFailsTheWholeCallAfterAllSettle() {
    Set<Integer> attempted = ConcurrentHashMap.newKeySet();
    List<YearRange> ranges = List.of(YearRange.fullYear(2019), YearRange.fullYear(2020),
        YearRange.fullYear(2021));

    assertThatThrownBy(() -> executor.runAll(ranges, range -> {
      attempted.add(range.year());
      if (range.year() == 2020) {
        throw new IllegalStateException("upstream down");
      }
      return range.year();
    }))
        .isInstanceOf(SubQueryFailureException.class)
        .hasMessage("Failed to load data for 1 of 3 year(s)")
        .hasCauseInstanceOf(IllegalStateException.class)
        .satisfies(ex -> {
          SubQueryFailureException failure = (SubQueryFailureException) ex;
          assertThat(failure.failedCount()).isEqualTo(1);
          assertThat(failure.totalCount()).isEqualTo(3);
        });
    assertThat(attempted).containsExactlyInAnyOrder(2019, 2020, 2021);
  }

  @Test
  void noRangesMeansNoWork() {
    assertThat(executor.runAll(List.of(), YearRange::year)).isEmpty();
  }
}
