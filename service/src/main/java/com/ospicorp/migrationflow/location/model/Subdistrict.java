package com.ospicorp.migrationflow.location.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Subdistrict(String id, String name, @JsonProperty("district_id") String districtId) {}
