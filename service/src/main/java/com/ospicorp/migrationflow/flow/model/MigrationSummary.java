package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MigrationSummary(
    @JsonProperty("total_move_in") long totalMoveIn,
    @JsonProperty("total_move_out") long totalMoveOut,
    @JsonProperty("total_net_migration") long totalNetMigration,
    @JsonProperty("location_count") int locationCount
) {}
