package com.harness.telemetry.pipeline.batch;

public record DeliveryResult(
    Outcome outcome,
    int attempts,
    int eventCount,
    Integer lastStatusCode
) {

  public enum Outcome {
    DELIVERED,
    /** The endpoint answered 4xx; retrying cannot help. */
    REJECTED,
    /** Every attempt hit a 5xx or a transport failure. */
    EXHAUSTED,
    UNSERIALIZABLE
  }

  public boolean delivered() {
    return outcome == Outcome.DELIVERED;
  }
}
