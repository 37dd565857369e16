package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LocationEntry(
    @JsonProperty("location_id") String locationId,
    @JsonProperty("location_name") String locationName,
    @JsonProperty("move_in") long moveIn,
    @JsonProperty("move_out") long moveOut,
    @JsonProperty("net_migration") long netMigration
) {

  public static LocationEntry zero(LocationRef location) {
    return new LocationEntry(location.id(), location.name(), 0, 0, 0);
  }
}
