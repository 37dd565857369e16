package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.ChartData;
import com.ospicorp.migrationflow.flow.model.ChartEntry;
import com.ospicorp.migrationflow.flow.model.ChartSummary;
import com.ospicorp.migrationflow.flow.model.DataStatus;
import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.LocationEntry;
import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.flow.model.LocationSeries;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.MigrationStats;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import com.ospicorp.migrationflow.period.DateWindow;
import com.ospicorp.migrationflow.period.PeriodParser;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds chart entries from a migration response: one entry per period inside the window, each
 * holding a record for every requested location in request order. Locations without upstream
 * data get zero records.
 */
public class LocationSeriesAggregator {
  private static final Logger log = LoggerFactory.getLogger(LocationSeriesAggregator.class);

  private final LocationMatcher matcher;

  public LocationSeriesAggregator(LocationMatcher matcher) {
    this.matcher = Objects.requireNonNull(matcher, "matcher");
  }

  public ChartData aggregate(MigrationResponse response, List<LocationRef> locations,
      DateWindow window) {
    if (!isWellFormed(response)) {
      log.warn("Discarding malformed migration response for {} location(s)", locations.size());
      return ChartData.malformed(locations);
    }

    List<LocationSeries> matched = new ArrayList<>(locations.size());
    List<LocationRef> unmatched = new ArrayList<>();
    for (LocationRef location : locations) {
      LocationSeries series = findSeries(response.locations(), location);
      if (series == null) {
        unmatched.add(location);
      }
      matched.add(series);
    }
    if (!unmatched.isEmpty()) {
      log.debug("No upstream series for {}", unmatched.stream().map(LocationRef::name).toList());
    }

    List<DatedEntry> dated = new ArrayList<>();
    for (TimePeriod period : candidatePeriods(response)) {
      LocalDate date = period.resolvedDate();
      if (!window.contains(date)) continue;

      List<LocationEntry> entries = new ArrayList<>(locations.size());
      for (int i = 0; i < locations.size(); i++) {
        entries.add(toEntry(locations.get(i), statsFor(matched.get(i), period.id())));
      }
      dated.add(new DatedEntry(date,
          new ChartEntry(period.id(), PeriodParser.formatPeriod(period.id()), entries)));
    }
    dated.sort(Comparator.comparing(DatedEntry::date));

    long totalMoveIn = 0;
    long totalMoveOut = 0;
    List<ChartEntry> chartEntries = new ArrayList<>(dated.size());
    for (DatedEntry entry : dated) {
      chartEntries.add(entry.entry());
      for (LocationEntry location : entry.entry().locations()) {
        totalMoveIn += location.moveIn();
        totalMoveOut += location.moveOut();
      }
    }

    DataStatus status = chartEntries.isEmpty() ? DataStatus.NO_DATA : DataStatus.OK;
    return new ChartData(chartEntries, List.copyOf(locations),
        ChartSummary.of(totalMoveIn, totalMoveOut), status, unmatched);
  }

  static boolean isWellFormed(MigrationResponse response) {
    if (response == null || response.locations() == null) return false;
    for (LocationSeries series : response.locations()) {
      if (series == null || series.location() == null) return false;
    }
    return true;
  }

  private LocationSeries findSeries(List<LocationSeries> series, LocationRef location) {
    for (LocationSeries candidate : series) {
      if (matcher.matches(location, candidate.location())) {
        return candidate;
      }
    }
    return null;
  }

  private static MigrationStats statsFor(LocationSeries series, String periodId) {
    if (series == null || series.timeSeries() == null) return null;
    return series.timeSeries().get(periodId);
  }

  private static LocationEntry toEntry(LocationRef location, MigrationStats stats) {
    if (stats == null) return LocationEntry.zero(location);
    return new LocationEntry(location.id(), location.name(), stats.moveIn(), stats.moveOut(),
        stats.effectiveNet());
  }

  // Listed periods win; otherwise every period id seen in the series or flows
  private static List<TimePeriod> candidatePeriods(MigrationResponse response) {
    Map<String, TimePeriod> periods = new LinkedHashMap<>();
    if (response.timePeriods() != null && !response.timePeriods().isEmpty()) {
      for (TimePeriod period : response.timePeriods()) {
        if (period != null && period.id() != null) {
          periods.putIfAbsent(period.id(), period);
        }
      }
      return new ArrayList<>(periods.values());
    }
    for (LocationSeries series : response.locations()) {
      if (series.timeSeries() == null) continue;
      for (String id : series.timeSeries().keySet()) {
        periods.putIfAbsent(id, TimePeriod.of(id, null));
      }
    }
    if (response.flows() != null) {
      for (FlowEdge flow : response.flows()) {
        if (flow.periodId() != null) {
          periods.putIfAbsent(flow.periodId(), TimePeriod.of(flow.periodId(), null));
        }
      }
    }
    return new ArrayList<>(periods.values());
  }

  private record DatedEntry(LocalDate date, ChartEntry entry) {}
}
