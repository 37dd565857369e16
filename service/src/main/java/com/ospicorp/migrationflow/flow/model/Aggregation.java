package com.ospicorp.migrationflow.flow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Aggregation {
  MONTHLY,
  QUARTERLY,
  YEARLY;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Aggregation fromCode(String code) {
    return Aggregation.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
