package com.ospicorp.migrationflow.flow.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.flow.model.LocationType;
import com.ospicorp.migrationflow.flow.service.ChartQuery;
import com.ospicorp.migrationflow.period.BoundaryMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

public record ChartRequest(
    @NotEmpty(message = "No locations selected") List<@Valid @NotNull Location> locations,
    @JsonProperty("start_date") @Schema(example = "2019-01-01") LocalDate startDate,
    @JsonProperty("end_date") @Schema(example = "2021-01-01") LocalDate endDate,
    @Schema(description = "exclusive_end or inclusive_end; defaults to the service setting")
    String boundary
) {

  public ChartQuery toQuery() {
    List<LocationRef> refs = locations.stream()
        .map(l -> new LocationRef(l.id(), l.name(), l.type()))
        .toList();
    BoundaryMode mode = boundary == null ? null : BoundaryMode.fromCode(boundary);
    return new ChartQuery(refs, startDate, endDate, mode);
  }

  public record Location(
      String id,
      @NotBlank String name,
      @NotNull @Schema(example = "province") LocationType type
  ) {}
}
