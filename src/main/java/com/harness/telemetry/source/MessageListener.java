package com.harness.telemetry.source;

public interface MessageListener {

  void onMessage(byte[] data);

  /**
   * Called once when the bus is closed for good. No further messages follow.
   */
  void onClose();
}
