package com.ospicorp.migrationflow.upstream;

public class UpstreamApiException extends RuntimeException {
  private final int status;

  public UpstreamApiException(String message, int status) {
    super(message);
    this.status = status;
  }

  public UpstreamApiException(String message, int status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  /** HTTP status returned by the migration API, or 0 when no response was received. */
  public int status() {
    return status;
  }

  public boolean isClientError() {
    return status >= 400 && status < 500;
  }

  public boolean isServerError() {
    return status >= 500 && status < 600;
  }
}
