package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationInfo(
    String id,
    String name,
    String code,
    @JsonProperty("parent_id") String parentId
) {

  public static LocationInfo of(String id, String name) {
    return new LocationInfo(id, name, null, null);
  }
}
