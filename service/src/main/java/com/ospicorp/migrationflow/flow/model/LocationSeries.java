package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record LocationSeries(
    LocationInfo location,
    @JsonProperty("time_series") Map<String, MigrationStats> timeSeries
) {}
