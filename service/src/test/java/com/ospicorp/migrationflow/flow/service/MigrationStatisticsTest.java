package com.ospicorp.migrationflow.flow.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.FlowNode;
import com.ospicorp.migrationflow.flow.model.LocationInfo;
import com.ospicorp.migrationflow.flow.model.LocationSeries;
import com.ospicorp.migrationflow.flow.model.LocationTotal;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.MigrationStats;
import com.ospicorp.migrationflow.flow.model.MigrationSummary;
import com.ospicorp.migrationflow.flow.model.PeriodOption;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MigrationStatisticsTest {
  private static final LocationInfo BANGKOK = LocationInfo.of("10", "Bangkok");
  private static final LocationInfo CHIANG_MAI = LocationInfo.of("50", "Chiang Mai");
  private static final LocationInfo PHUKET = LocationInfo.of("83", "Phuket");

  private final MigrationResponse response = new MigrationResponse(null,
      List.of(new TimePeriod("2020-01", LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 31)),
          new TimePeriod("2020-Q2", LocalDate.of(2020, 4, 1), LocalDate.of(2020, 6, 30)),
          TimePeriod.of("feb20", null)),
      List.of(
          new LocationSeries(BANGKOK, Map.of("2020-01", MigrationStats.of(100, 20),
              "2020-02", MigrationStats.of(50, 30))),
          new LocationSeries(CHIANG_MAI, Map.of("2020-01", new MigrationStats(10, 40, -25L))),
          new LocationSeries(PHUKET, Map.of("2020-01", MigrationStats.of(70, 5)))),
      List.of());

  @Test
  void summaryCoversEverySeries() {
    MigrationSummary summary = MigrationStatistics.summarize(response);

    assertThat(summary.totalMoveIn()).isEqualTo(230);
    assertThat(summary.totalMoveOut()).isEqualTo(95);
    assertThat(summary.totalNetMigration()).isEqualTo(80 + 20 - 25 + 65);
    assertThat(summary.locationCount()).isEqualTo(3);
  }

  @Test
  void topDestinationsAndOriginsRankByTotals() {
    assertThat(MigrationStatistics.topDestinations(response, 2))
        .extracting(LocationTotal::locationId).containsExactly("10", "83");
    assertThat(MigrationStatistics.topOrigins(response, 1))
        .extracting(LocationTotal::total).containsExactly(50L);
  }

  @Test
  void topFlowsRankByCount() {
    List<FlowEdge> flows = List.of(
        FlowEdge.of(BANGKOK, CHIANG_MAI, "2020-01", 5),
        FlowEdge.of(CHIANG_MAI, BANGKOK, "2020-01", 12),
        FlowEdge.of(PHUKET, BANGKOK, "2020-01", 8));

    assertThat(MigrationStatistics.topFlows(flows, 2))
        .extracting(FlowEdge::flowCount).containsExactly(12L, 8L);
    assertThat(MigrationStatistics.topFlows(null, 5)).isEmpty();
  }

  @Test
  void periodOptionsUseRangeOrIdLabels() {
    assertThat(MigrationStatistics.availablePeriods(response))
        .extracting(PeriodOption::label)
        .containsExactly("Jan 2020", "Apr 2020 - Jun 2020", "Feb 2020");
  }

  @Test
  void flowNodesSumBothDirections() {
    List<FlowEdge> flows = List.of(
        FlowEdge.of(BANGKOK, CHIANG_MAI, "2020-01", 5),
        FlowEdge.of(CHIANG_MAI, BANGKOK, "2020-01", -3),
        FlowEdge.of(PHUKET, BANGKOK, "2020-02", 8));

    List<FlowNode> nodes = FlowNodeAggregator.nodesForPeriod(flows, "2020-01");

    assertThat(nodes).containsExactly(
        new FlowNode(BANGKOK, 3, 5),
        new FlowNode(CHIANG_MAI, 5, 3));
  }
}
