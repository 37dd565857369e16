package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.LocationSeries;
import com.ospicorp.migrationflow.flow.model.LocationTotal;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.MigrationStats;
import com.ospicorp.migrationflow.flow.model.MigrationSummary;
import com.ospicorp.migrationflow.flow.model.PeriodOption;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import com.ospicorp.migrationflow.period.PeriodParser;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.ToLongFunction;

public final class MigrationStatistics {
  private MigrationStatistics() {
  }

  public static MigrationSummary summarize(MigrationResponse response) {
    List<LocationSeries> series = seriesOf(response);
    long moveIn = 0;
    long moveOut = 0;
    long net = 0;
    for (LocationSeries location : series) {
      for (MigrationStats stats : statsOf(location)) {
        moveIn += stats.moveIn();
        moveOut += stats.moveOut();
        net += stats.effectiveNet();
      }
    }
    return new MigrationSummary(moveIn, moveOut, net, series.size());
  }

  public static List<LocationTotal> topDestinations(MigrationResponse response, int limit) {
    return top(response, MigrationStats::moveIn, limit);
  }

  public static List<LocationTotal> topOrigins(MigrationResponse response, int limit) {
    return top(response, MigrationStats::moveOut, limit);
  }

  public static List<FlowEdge> topFlows(List<FlowEdge> flows, int limit) {
    if (flows == null) return List.of();
    return flows.stream()
        .sorted(Comparator.comparingLong(FlowEdge::flowCount).reversed())
        .limit(Math.max(0, limit))
        .toList();
  }

  public static List<PeriodOption> availablePeriods(MigrationResponse response) {
    if (response == null || response.timePeriods() == null) return List.of();
    List<PeriodOption> out = new ArrayList<>(response.timePeriods().size());
    for (TimePeriod period : response.timePeriods()) {
      String label = PeriodParser.formatRange(period.startDate(), period.endDate());
      out.add(new PeriodOption(period.id(), label != null ? label : PeriodParser.formatPeriod(period.id())));
    }
    return out;
  }

  private static List<LocationTotal> top(MigrationResponse response,
      ToLongFunction<MigrationStats> metric, int limit) {
    List<LocationTotal> totals = new ArrayList<>();
    for (LocationSeries location : seriesOf(response)) {
      long total = 0;
      for (MigrationStats stats : statsOf(location)) {
        total += metric.applyAsLong(stats);
      }
      totals.add(new LocationTotal(location.location().id(), location.location().name(), total));
    }
    totals.sort(Comparator.comparingLong(LocationTotal::total).reversed());
    return List.copyOf(totals.subList(0, Math.min(Math.max(0, limit), totals.size())));
  }

  private static List<LocationSeries> seriesOf(MigrationResponse response) {
    if (!LocationSeriesAggregator.isWellFormed(response)) return List.of();
    return response.locations();
  }

  private static List<MigrationStats> statsOf(LocationSeries series) {
    if (series.timeSeries() == null) return List.of();
    return series.timeSeries().values().stream().filter(Objects::nonNull).toList();
  }
}
