package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MigrationResponse(
    ResponseMetadata metadata,
    @JsonProperty("time_periods") List<TimePeriod> timePeriods,
    @JsonProperty("data") List<LocationSeries> locations,
    List<FlowEdge> flows
) {}
