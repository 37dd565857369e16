package com.ospicorp.migrationflow.location.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.migrationflow.flow.model.TimePeriod;
import java.time.LocalDate;
import java.util.List;

public record CatalogTimePeriods(
    @JsonProperty("start_date") LocalDate startDate,
    @JsonProperty("end_date") LocalDate endDate,
    @JsonProperty("available_periods") List<TimePeriod> availablePeriods
) {}
