package com.harness.telemetry.model;

public record PipelineStatus(
    boolean enabled,
    boolean running,
    int subscribedServers,
    int queueDepth,
    long droppedEvents,
    long batchesFlushed,
    long batchesDelivered,
    long batchesFailed,
    long eventsDelivered,
    long eventsLost
) {

  public static PipelineStatus inactive(boolean enabled) {
    return new PipelineStatus(enabled, false, 0, 0, 0, 0, 0, 0, 0, 0);
  }
}
