package com.ospicorp.migrationflow.flow.service;

public class SupersededRequestException extends RuntimeException {
  private final String sessionKey;

  public SupersededRequestException(String sessionKey) {
    super("Request for view session " + sessionKey + " was superseded by a newer request");
    this.sessionKey = sessionKey;
  }

  public String sessionKey() {
    return sessionKey;
  }
}
