package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Read-only payload handed to the chart renderers. */
public record ChartData(
    List<ChartEntry> entries,
    List<LocationRef> locations,
    ChartSummary summary,
    DataStatus status,
    @JsonProperty("unmatched_locations") List<LocationRef> unmatchedLocations
) {

  public static ChartData malformed(List<LocationRef> locations) {
    return new ChartData(List.of(), List.copyOf(locations), ChartSummary.EMPTY,
        DataStatus.MALFORMED_RESPONSE, List.of());
  }
}
