package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LocationTotal(
    @JsonProperty("location_id") String locationId,
    String location,
    long total
) {}
