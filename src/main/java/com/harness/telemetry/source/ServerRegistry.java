package com.harness.telemetry.source;

import java.util.List;
import java.util.function.Consumer;

public interface ServerRegistry {

  List<ManagedServer> all();

  /**
   * Register a hook fired for every server added after this call returns.
   */
  void onServerAdd(Consumer<ManagedServer> hook);
}
