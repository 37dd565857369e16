package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Scale {
  PROVINCE,
  DISTRICT,
  SUBDISTRICT;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Scale fromCode(String code) {
    return Scale.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
