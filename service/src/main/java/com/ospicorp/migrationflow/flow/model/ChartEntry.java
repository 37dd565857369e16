package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ChartEntry(
    @JsonProperty("period_id") String periodId,
    String period,
    List<LocationEntry> locations
) {}
