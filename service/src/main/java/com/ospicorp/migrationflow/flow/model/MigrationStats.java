package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MigrationStats(
    @JsonProperty("move_in") long moveIn,
    @JsonProperty("move_out") long moveOut,
    @JsonProperty("net_migration") Long netMigration
) {

  public static MigrationStats of(long moveIn, long moveOut) {
    return new MigrationStats(moveIn, moveOut, null);
  }

  /** Explicit net migration when the upstream supplied one, otherwise {@code moveIn - moveOut}. */
  public long effectiveNet() {
    return netMigration != null ? netMigration : moveIn - moveOut;
  }
}
