package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChartSummary(
    @JsonProperty("total_move_in") long totalMoveIn,
    @JsonProperty("total_move_out") long totalMoveOut,
    @JsonProperty("net_migration") long netMigration
) {

  public static final ChartSummary EMPTY = new ChartSummary(0, 0, 0);

  public static ChartSummary of(long totalMoveIn, long totalMoveOut) {
    return new ChartSummary(totalMoveIn, totalMoveOut, totalMoveIn - totalMoveOut);
  }
}
