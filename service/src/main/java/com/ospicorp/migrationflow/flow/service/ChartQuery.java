package com.ospicorp.migrationflow.flow.service;

import com.ospicorp.migrationflow.flow.model.LocationRef;
import com.ospicorp.migrationflow.period.BoundaryMode;
import java.time.LocalDate;
import java.util.List;

/** A chart load: selected locations plus an optional window. */
public record ChartQuery(
    List<LocationRef> locations,
    LocalDate start,
    LocalDate end,
    BoundaryMode boundary
) {

  public ChartQuery {
    locations = locations == null ? List.of() : List.copyOf(locations);
  }
}
