package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.LocationSeries;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.MigrationStats;
import com.ospicorp.migrationflow.flow.model.ResponseMetadata;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the responses of per-year sub-queries. Periods are keyed by id and flows by
 * (origin, destination, period), so the result does not depend on the order of the inputs.
 * Colliding flows are summed. The location set is the first response's; if any response is
 * malformed the merged location list is {@code null}.
 */
public final class ResponseMerger {
  static final Comparator<TimePeriod> CHRONOLOGICAL = Comparator
      .comparing(TimePeriod::resolvedDate, Comparator.nullsLast(Comparator.naturalOrder()))
      .thenComparing(TimePeriod::id, Comparator.nullsLast(Comparator.naturalOrder()));

  private static final Comparator<String> NULL_SAFE = Comparator.nullsFirst(Comparator.naturalOrder());
  private static final Comparator<FlowEdge.Key> BY_KEY = Comparator
      .comparing(FlowEdge.Key::originId, NULL_SAFE)
      .thenComparing(FlowEdge.Key::destinationId, NULL_SAFE)
      .thenComparing(FlowEdge.Key::periodId, NULL_SAFE);

  private ResponseMerger() {
  }

  public static MigrationResponse merge(List<MigrationResponse> responses) {
    if (responses == null || responses.isEmpty()) {
      throw new IllegalArgumentException("No responses to combine");
    }
    if (responses.size() == 1) return responses.get(0);

    Map<String, TimePeriod> periods = new LinkedHashMap<>();
    Map<FlowEdge.Key, FlowEdge> flows = new HashMap<>();
    for (MigrationResponse response : responses) {
      if (response.timePeriods() != null) {
        for (TimePeriod period : response.timePeriods()) {
          periods.put(period.id(), period);
        }
      }
      if (response.flows() != null) {
        for (FlowEdge flow : response.flows()) {
          flows.merge(flow.key(), flow,
              (existing, added) -> existing.withFlowCount(existing.flowCount() + added.flowCount()));
        }
      }
    }

    List<TimePeriod> sortedPeriods = new ArrayList<>(periods.values());
    sortedPeriods.sort(CHRONOLOGICAL);

    List<FlowEdge> sortedFlows = new ArrayList<>(flows.values());
    sortedFlows.sort(Comparator.comparing(FlowEdge::key, BY_KEY));

    return new MigrationResponse(mergeMetadata(responses), sortedPeriods, mergeLocations(responses),
        sortedFlows);
  }

  // Location set and order of the first response; each location's series gathers every response's
  // periods for the same location id. One malformed response makes the whole list null.
  private static List<LocationSeries> mergeLocations(List<MigrationResponse> responses) {
    if (!responses.stream().allMatch(LocationSeriesAggregator::isWellFormed)) {
      return null;
    }
    List<LocationSeries> first = responses.get(0).locations();
    Map<String, Map<String, MigrationStats>> byLocation = new HashMap<>();
    for (MigrationResponse response : responses) {
      for (LocationSeries series : response.locations()) {
        if (series.timeSeries() == null) continue;
        byLocation.computeIfAbsent(series.location().id(), id -> new LinkedHashMap<>())
            .putAll(series.timeSeries());
      }
    }
    List<LocationSeries> out = new ArrayList<>(first.size());
    for (LocationSeries series : first) {
      Map<String, MigrationStats> merged = byLocation.get(series.location().id());
      out.add(merged == null ? series : new LocationSeries(series.location(), merged));
    }
    return out;
  }

  private static ResponseMetadata mergeMetadata(List<MigrationResponse> responses) {
    ResponseMetadata base = null;
    LocalDate start = null;
    LocalDate end = null;
    long totalRecords = 0;
    for (MigrationResponse response : responses) {
      ResponseMetadata metadata = response.metadata();
      if (metadata == null) continue;
      if (base == null) base = metadata;
      if (metadata.startDate() != null && (start == null || metadata.startDate().isBefore(start))) {
        start = metadata.startDate();
      }
      if (metadata.endDate() != null && (end == null || metadata.endDate().isAfter(end))) {
        end = metadata.endDate();
      }
      totalRecords += metadata.totalRecords();
    }
    if (base == null) return null;
    return new ResponseMetadata(base.scale(), start, end, totalRecords, base.aggregation());
  }
}
