package com.ospicorp.migrationflow.flow.model;

/** Tells renderers why a chart may be empty. */
public enum DataStatus {
  OK,
  NO_DATA,
  MALFORMED_RESPONSE
}
