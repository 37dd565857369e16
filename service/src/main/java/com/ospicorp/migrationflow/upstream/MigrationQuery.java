package com.ospicorp.migrationflow.upstream;

import com.ospicorp.migrationflow.flow.model.Aggregation;
import com.ospicorp.migrationflow.flow.model.Scale;
import java.time.LocalDate;
import java.util.List;

public record MigrationQuery(
    Scale scale,
    List<String> locationIds,
    LocalDate startDate,
    LocalDate endDate,
    Aggregation aggregation,
    boolean includeFlows
) {

  public MigrationQuery {
    if (scale == null) {
      throw new IllegalArgumentException("Scale is required");
    }
    if ((startDate == null) != (endDate == null)) {
      throw new IllegalArgumentException(
          "If providing dates, both start date and end date are required");
    }
    if (startDate != null && startDate.isAfter(endDate)) {
      throw new IllegalArgumentException("Start date must not be after end date");
    }
    locationIds = locationIds == null ? List.of() : List.copyOf(locationIds);
    aggregation = aggregation == null ? Aggregation.MONTHLY : aggregation;
  }

  public MigrationQuery forRange(LocalDate start, LocalDate end) {
    return new MigrationQuery(scale, locationIds, start, end, aggregation, includeFlows);
  }
}
