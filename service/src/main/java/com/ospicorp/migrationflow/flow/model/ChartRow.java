package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// Flat CSV projection of a chart entry, one row per (period, location)
@JsonPropertyOrder({"period", "location_id", "location_name", "move_in", "move_out",
    "net_migration"})
public record ChartRow(
    String period,
    @JsonProperty("location_id") String locationId,
    @JsonProperty("location_name") String locationName,
    @JsonProperty("move_in") long moveIn,
    @JsonProperty("move_out") long moveOut,
    @JsonProperty("net_migration") long netMigration
) {}
