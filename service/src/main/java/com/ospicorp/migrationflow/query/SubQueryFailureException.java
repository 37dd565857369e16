package com.ospicorp.migrationflow.query;

public class SubQueryFailureException extends RuntimeException {
  private final int failedCount;
  private final int totalCount;

  public SubQueryFailureException(int failedCount, int totalCount, Throwable cause) {
    super("Failed to load data for " + failedCount + " of " + totalCount + " year(s)", cause);
    this.failedCount = failedCount;
    this.totalCount = totalCount;
  }

  public int failedCount() {
    return failedCount;
  }

  public int totalCount() {
    return totalCount;
  }
}
