package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LocationType {
  PROVINCE("province", Scale.PROVINCE),
  DISTRICT("district", Scale.DISTRICT),
  SUB_DISTRICT("subDistrict", Scale.SUBDISTRICT);

  private final String code;
  private final Scale scale;

  LocationType(String code, Scale scale) {
    this.code = code;
    this.scale = scale;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public Scale scale() {
    return scale;
  }

  @JsonCreator
  public static LocationType fromCode(String code) {
    if (code != null) {
      for (LocationType type : values()) {
        if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException(
        "Invalid location type " + code + ". Supported values: province,district,subDistrict.");
  }
}
