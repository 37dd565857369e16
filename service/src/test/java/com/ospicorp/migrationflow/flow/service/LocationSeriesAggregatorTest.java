package com.ospicorp.migrationflow.flow.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.migrationflow.flow.model.ChartData;
import com.ospicorp.migrationflow.flow.model.ChartEntry;
import com.ospicorp.migrationflow.flow.model.DataStatus;
import com.ospicorp.migrationflow.flow.model.LocationEntry;
import com.ospicorp.migrationflow.flow.model.LocationInfo;
import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.flow.model.LocationSeries;
import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.MigrationStats;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import com.ospicorp.migrationflow.period.DateWindow;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LocationSeriesAggregatorTest {
  private static final LocationRef BANGKOK = new LocationRef("bkk", "Bangkok", LocationType.PROVINCE);
  private static final LocationRef PHUKET = new LocationRef("hkt", "Phuket", LocationType.PROVINCE);
  private static final DateWindow YEAR_2020 =
      DateWindow.exclusive(LocalDate.of(2020, 1, 1), LocalDate.of(2021, 1, 1));

  private final LocationSeriesAggregator aggregator =
      new LocationSeriesAggregator(MatchPolicy.CASE_INSENSITIVE);

  @Test
  void entriesAreSortedAndSummarised() {
    Map<String, MigrationStats> series = new LinkedHashMap<>();
    series.put("2020-02", MigrationStats.of(50, 10));
    series.put("2020-01", MigrationStats.of(100, 30));
    MigrationResponse response = new MigrationResponse(null,
        List.of(TimePeriod.of("2020-02", null), TimePeriod.of("2020-01", null)),
        List.of(new LocationSeries(LocationInfo.of("10", "BANGKOK"), series)),
        List.of());

    ChartData data = aggregator.aggregate(response, List.of(BANGKOK), YEAR_2020);

    assertThat(data.status()).isEqualTo(DataStatus.OK);
    assertThat(data.entries()).extracting(ChartEntry::periodId).containsExactly("2020-01", "2020-02");
    assertThat(data.entries().get(0).period()).isEqualTo("Jan 2020");
    assertThat(data.summary().totalMoveIn()).isEqualTo(150);
    assertThat(data.summary().totalMoveOut()).isEqualTo(40);
    assertThat(data.summary().netMigration()).isEqualTo(110);
  }

  @Test
  void locationsWithoutSeriesAreZeroFilledAndReported() {
    MigrationResponse response = new MigrationResponse(null,
        List.of(TimePeriod.of("2020-01", null)),
        List.of(new LocationSeries(LocationInfo.of("10", "Bangkok"),
            Map.of("2020-01", MigrationStats.of(5, 2)))),
        List.of());

    ChartData data = aggregator.aggregate(response, List.of(BANGKOK, PHUKET), YEAR_2020);

    List<LocationEntry> locations = data.entries().get(0).locations();
    assertThat(locations).extracting(LocationEntry::locationName).containsExactly("Bangkok", "Phuket");
    assertThat(locations.get(1)).isEqualTo(LocationEntry.zero(PHUKET));
    assertThat(data.unmatchedLocations()).containsExactly(PHUKET);
  }

  @Test
  void periodsOutsideTheWindowOrUnparsableAreDropped() {
    MigrationResponse response = new MigrationResponse(null,
        List.of(TimePeriod.of("2019-12", null), TimePeriod.of("2020-06", null),
            TimePeriod.of("2021-01", null), TimePeriod.of("bogus", null)),
        List.of(new LocationSeries(LocationInfo.of("10", "Bangkok"), Map.of())),
        List.of());

    ChartData data = aggregator.aggregate(response, List.of(BANGKOK), YEAR_2020);

    assertThat(data.entries()).extracting(ChartEntry::periodId).containsExactly("2020-06");
  }

  @Test
  void periodsAreTakenFromSeriesWhenNoneAreListed() {
    MigrationResponse response = new MigrationResponse(null, List.of(),
        List.of(new LocationSeries(LocationInfo.of("10", "Bangkok"),
            Map.of("mar20", MigrationStats.of(1, 1), "jan20", MigrationStats.of(2, 0)))),
        List.of());

    ChartData data = aggregator.aggregate(response, List.of(BANGKOK), YEAR_2020);

    assertThat(data.entries()).extracting(ChartEntry::periodId).containsExactly("jan20", "mar20");
  }

  @Test
  void nothingInTheWindowIsNoData() {
    MigrationResponse response = new MigrationResponse(null, List.of(TimePeriod.of("2018-01", null)),
        List.of(new LocationSeries(LocationInfo.of("10", "Bangkok"), Map.of())), List.of());

    ChartData data = aggregator.aggregate(response, List.of(BANGKOK), YEAR_2020);

    assertThat(data.status()).isEqualTo(DataStatus.NO_DATA);
    assertThat(data.entries()).isEmpty();
  }

  @Test
  void malformedResponsesYieldEmptyChart() {
    MigrationResponse noData = new MigrationResponse(null, List.of(), null, List.of());
    MigrationResponse nullLocation = new MigrationResponse(null, List.of(),
        Arrays.asList(new LocationSeries(null, Map.of())), List.of());

    for (MigrationResponse response : Arrays.asList(null, noData, nullLocation)) {
      ChartData data = aggregator.aggregate(response, List.of(BANGKOK), YEAR_2020);
      assertThat(data.status()).isEqualTo(DataStatus.MALFORMED_RESPONSE);
      assertThat(data.entries()).isEmpty();
      assertThat(data.summary().totalMoveIn()).isZero();
      assertThat(data.locations()).containsExactly(BANGKOK);
    }
  }

  @Test
  void explicitNetOverridesTheEntryButNotTheSummary() {
    MigrationResponse response = new MigrationResponse(null, List.of(TimePeriod.of("2020-03", null)),
        List.of(new LocationSeries(LocationInfo.of("10", "Bangkok"),
            Map.of("2020-03", new MigrationStats(10, 4, -2L)))),
        List.of());

    ChartData data = aggregator.aggregate(response, List.of(BANGKOK), YEAR_2020);

    assertThat(data.entries().get(0).locations().get(0).netMigration()).isEqualTo(-2);
    assertThat(data.summary().netMigration()).isEqualTo(6);
  }
}
