package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.ChartData;
import com.ospicorp.migrationflow.flow.model.FlowData;
import com.ospicorp.migrationflow.flow.model.FlowEdge;
import com.ospicorp.migrationflow.flow.model.FlowNode;
import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.flow.model.MigrationResponse;
import com.ospicorp.migrationflow.flow.model.PeriodOption;
import com.ospicorp.migrationflow.flow.model.Scale;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import com.ospicorp.migrationflow.location.service.LocationCatalogService;
import com.ospicorp.migrationflow.period.BoundaryMode;
import com.ospicorp.migrationflow.period.DateWindow;
import com.ospicorp.migrationflow.period.PeriodParser;
import com.ospicorp.migrationflow.query.QueryDecomposer;
import com.ospicorp.migrationflow.query.SubQueryExecutor;
import com.ospicorp.migrationflow.query.YearRange;
import com.ospicorp.migrationflow.upstream.MigrationApiClient;
import com.ospicorp.migrationflow.upstream.MigrationQuery;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Loads chart and flow-diagram data for a set of locations: resolves the locations against the
 * catalog, splits the window into per-year upstream queries, runs them concurrently and folds
 * the results into one response.
 */
@Service
public class MigrationFlowService {
  private static final Logger log = LoggerFactory.getLogger(MigrationFlowService.class);

  private final MigrationApiClient client;
  private final LocationCatalogService catalog;
  private final SubQueryExecutor executor;
  private final LocationSeriesAggregator aggregator;
  private final LatestRequestGuard guard;
  private final BoundaryMode defaultBoundary;
  private final int topFlowLimit;

  public MigrationFlowService(MigrationApiClient client,
      LocationCatalogService catalog,
      SubQueryExecutor executor,
      LocationSeriesAggregator aggregator,
      LatestRequestGuard guard,
      BoundaryMode defaultBoundary,
      @Value("${migration.flows.top-limit:10}") int topFlowLimit) {
    this.client = client;
    this.catalog = catalog;
    this.executor = executor;
    this.aggregator = aggregator;
    this.guard = guard;
    this.defaultBoundary = defaultBoundary;
    this.topFlowLimit = topFlowLimit;
  }

  public ChartData loadChartData(ChartQuery query) {
    return loadChartData(query, null);
  }

  /**
   * @param sessionKey view session the load belongs to; when set, a newer load for the same
   *     session makes this one fail with {@link SupersededRequestException}
   */
  public ChartData loadChartData(ChartQuery query, String sessionKey) {
    LatestRequestGuard.Ticket ticket = guard.begin(sessionKey);
    try {
      DateWindow window = resolveWindow(query);
      MigrationResponse merged = fetch(query.locations(), window, false);
      ChartData data = aggregator.aggregate(merged, query.locations(), window);
      log.debug("Chart data for {} location(s): {} entries, status {}", query.locations().size(),
          data.entries().size(), data.status());
      return guard.commit(ticket, data);
    } finally {
      guard.release(ticket);
    }
  }

  public FlowData loadFlows(ChartQuery query) {
    return loadFlows(query, null);
  }

  public FlowData loadFlows(ChartQuery query, String sessionKey) {
    LatestRequestGuard.Ticket ticket = guard.begin(sessionKey);
    try {
      return guard.commit(ticket, buildFlows(query));
    } finally {
      guard.release(ticket);
    }
  }

  private FlowData buildFlows(ChartQuery query) {
    DateWindow window = resolveWindow(query);
    MigrationResponse merged = fetch(query.locations(), window, true);
    if (merged == null) {
      log.warn("Discarding malformed migration response while loading flows");
      return new FlowData(List.of(), List.of(), List.of(), Map.of());
    }

    Set<String> periodIds = new HashSet<>();
    List<TimePeriod> periods = new ArrayList<>();
    List<TimePeriod> listed = merged.timePeriods() == null ? List.of() : merged.timePeriods();
    for (TimePeriod period : listed) {
      if (window.contains(period.resolvedDate())) {
        periods.add(period);
        periodIds.add(period.id());
      }
    }
    List<FlowEdge> listedFlows = merged.flows() == null ? List.of() : merged.flows();
    List<FlowEdge> flows = listedFlows.stream()
        .filter(f -> periodIds.isEmpty()
            ? window.contains(PeriodParser.parsePeriod(f.periodId()))
            : periodIds.contains(f.periodId()))
        .toList();

    List<PeriodOption> options = MigrationStatistics.availablePeriods(
        new MigrationResponse(merged.metadata(), periods, merged.locations(), flows));
    Map<String, List<FlowNode>> nodes = new LinkedHashMap<>();
    for (String periodId : flowPeriodIds(periods, flows)) {
      nodes.put(periodId, FlowNodeAggregator.nodesForPeriod(flows, periodId));
    }
    return new FlowData(options, flows, MigrationStatistics.topFlows(flows, topFlowLimit), nodes);
  }

  DateWindow resolveWindow(ChartQuery query) {
    if (query.locations().isEmpty()) {
      throw new IllegalArgumentException("No locations selected");
    }
    if ((query.start() == null) != (query.end() == null)) {
      throw new IllegalArgumentException(
          "If providing dates, both start date and end date are required");
    }
    if (query.start() == null) {
      return catalog.defaultDateRange();
    }
    if (!query.start().isBefore(query.end())) {
      throw new IllegalArgumentException("Start date must be before end date");
    }
    BoundaryMode mode = query.boundary() != null ? query.boundary() : defaultBoundary;
    return new DateWindow(query.start(), query.end(), mode);
  }

  // null when any sub-query returned an unreadable body
  private MigrationResponse fetch(List<LocationRef> locations, DateWindow window,
      boolean includeFlows) {
    Scale scale = scaleFor(locations);
    List<String> ids = new ArrayList<>();
    for (LocationRef location : locations) {
      if (location.type() == null || location.type().scale() != scale) {
        log.debug("Location {} is coarser than scale {}; not queried", location.name(),
            scale.code());
        continue;
      }
      Optional<String> apiId = catalog.resolveApiId(location);
      if (apiId.isPresent()) {
        ids.add(apiId.get());
      } else {
        log.warn("Location {} could not be resolved; it will be reported without data",
            location.name());
      }
    }

    if (ids.isEmpty()) {
      // an unfiltered query would return every location at this scale
      log.warn("None of {} location(s) resolved; skipping upstream query", locations.size());
      return new MigrationResponse(null, List.of(), List.of(), List.of());
    }

    MigrationQuery base = new MigrationQuery(scale, ids, null, null, null, includeFlows);
    List<YearRange> ranges = QueryDecomposer.decompose(window.start(), window.lastIncludedDay());
    log.debug("Loading {} data for {} id(s) across {} sub-query(ies)", scale.code(), ids.size(),
        ranges.size());
    List<MigrationResponse> responses = executor.runAll(ranges,
        range -> client.getMigrationData(base.forRange(range.start(), range.end())));
    if (responses.stream().anyMatch(Objects::isNull)) {
      return null;
    }
    return ResponseMerger.merge(responses);
  }

  static Scale scaleFor(List<LocationRef> locations) {
    LocationType mostSpecific = null;
    for (LocationRef location : locations) {
      LocationType type = location.type();
      if (type != null && (mostSpecific == null || type.ordinal() > mostSpecific.ordinal())) {
        mostSpecific = type;
      }
    }
    return mostSpecific == null ? Scale.PROVINCE : mostSpecific.scale();
  }

  private static List<String> flowPeriodIds(List<TimePeriod> periods, List<FlowEdge> flows) {
    Map<String, LocalDate> ids = new LinkedHashMap<>();
    for (TimePeriod period : periods) {
      ids.putIfAbsent(period.id(), period.resolvedDate());
    }
    for (FlowEdge flow : flows) {
      if (flow.periodId() != null) {
        ids.putIfAbsent(flow.periodId(), PeriodParser.parsePeriod(flow.periodId()));
      }
    }
    return ids.entrySet().stream()
        .sorted(Map.Entry.comparingByValue(Comparator.nullsLast(Comparator.naturalOrder())))
        .map(Map.Entry::getKey)
        .toList();
  }
}
