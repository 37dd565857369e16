package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FlowNode(
    LocationInfo location,
    @JsonProperty("move_in") long moveIn,
    @JsonProperty("move_out") long moveOut
) {}
