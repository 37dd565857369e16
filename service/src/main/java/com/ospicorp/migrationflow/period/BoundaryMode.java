package com.ospicorp.migrationflow.period;

import java.util.Locale;

/**
 * How the end bound of a date window is treated. The dashboards historically disagreed on this,
 * so every window states its mode explicitly.
 */
public enum BoundaryMode {
  /** {@code start <= date < end}; {@code end} is the first excluded month. */
  EXCLUSIVE_END,
  /** {@code start <= date <= end}. */
  INCLUSIVE_END;

  public static BoundaryMode fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("boundary must be provided");
    }
    try {
      return BoundaryMode.valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Invalid boundary mode " + code + ". Supported values: exclusive_end,inclusive_end.");
    }
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
