package com.harness.telemetry.source;

public interface MessageBus {

  /**
   * Register a listener. If the bus is already closed the listener's
   * {@link MessageListener#onClose()} is invoked right away.
   */
  void on(MessageListener listener);

  void off(MessageListener listener);
}
