package com.harness.telemetry.source;

public interface ManagedServer {

  String id();

  /**
   * Structured lifecycle events, encoded as {@code {"topic": ..., "data": ...}}.
   */
  MessageBus events();

  /**
   * Raw console output, one line per message.
   */
  MessageBus console();

  CancellationSignal context();
}
