package com.ospicorp.migrationflow.period;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DateRangeFilterTest {
  private static final LocalDate START = LocalDate.of(2019, 1, 1);
  private static final LocalDate END = LocalDate.of(2021, 1, 1);

  @Test
  void exclusiveEndDropsTheEndMonth() {
    assertThat(DateRangeFilter.isInRange(LocalDate.of(2020, 12, 1), START, END)).isTrue();
    assertThat(DateRangeFilter.isInRange(END, START, END)).isFalse();
    assertThat(DateRangeFilter.isInRange(START, START, END)).isTrue();
  }

  @Test
  void inclusiveEndKeepsTheEndMonth() {
    assertThat(DateRangeFilter.isInRange(END, START, END, BoundaryMode.INCLUSIVE_END)).isTrue();
    assertThat(DateRangeFilter.isInRange(END.plusDays(1), START, END, BoundaryMode.INCLUSIVE_END))
        .isFalse();
  }

  @Test
  void missingBoundsAreOpen() {
    assertThat(DateRangeFilter.isInRange(LocalDate.of(1990, 1, 1), null, END)).isTrue();
    assertThat(DateRangeFilter.isInRange(LocalDate.of(2090, 1, 1), START, null)).isTrue();
    assertThat(DateRangeFilter.isInRange(null, START, END)).isFalse();
  }

  @Test
  void windowKnowsItsLastIncludedDay() {
    assertThat(DateWindow.exclusive(START, END).lastIncludedDay()).isEqualTo(LocalDate.of(2020, 12, 31));
    assertThat(DateWindow.inclusive(START, END).lastIncludedDay()).isEqualTo(END);
    assertThatThrownBy(() -> DateWindow.exclusive(END, START))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void boundaryModeParsesCodes() {
    assertThat(BoundaryMode.fromCode("inclusive_end")).isEqualTo(BoundaryMode.INCLUSIVE_END);
    assertThat(BoundaryMode.fromCode(" EXCLUSIVE_END ")).isEqualTo(BoundaryMode.EXCLUSIVE_END);
    assertThatThrownBy(() -> BoundaryMode.fromCode("both"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Supported values");
  }
}
