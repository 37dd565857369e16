package com.ospicorp.migrationflow.location.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record District(String id, String name, @JsonProperty("province_id") String provinceId) {}
