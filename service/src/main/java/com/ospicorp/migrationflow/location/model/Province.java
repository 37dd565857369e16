package com.ospicorp.migrationflow.location.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Province(String id, String name, String code, String region) {}
