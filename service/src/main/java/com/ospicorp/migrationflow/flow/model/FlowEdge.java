package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowEdge(
    LocationInfo origin,
    LocationInfo destination,
    @JsonProperty("time_period_id") String periodId,
    @JsonProperty("flow_count") long flowCount,
    @JsonProperty("flow_rate") Double flowRate
) {

  public static FlowEdge of(LocationInfo origin, LocationInfo destination, String periodId,
      long flowCount) {
    return new FlowEdge(origin, destination, periodId, flowCount, null);
  }

  @JsonIgnore
  public Key key() {
    return new Key(origin == null ? null : origin.id(),
        destination == null ? null : destination.id(), periodId);
  }

  public FlowEdge withFlowCount(long count) {
    return new FlowEdge(origin, destination, periodId, count, flowRate);
  }

  /** Identity of a flow edge: origin, destination and period. */
  public record Key(String originId, String destinationId, String periodId) {}
}
