package com.harness.telemetry.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
  STATS("stats"),
  STATUS("status"),
  CONSOLE_OUTPUT("console_output");

  private final String wireName;

  EventType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
