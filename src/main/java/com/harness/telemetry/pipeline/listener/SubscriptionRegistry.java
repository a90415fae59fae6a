package com.harness.telemetry.pipeline.listener;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the servers that currently have a live listener. At most one claim
 * per server id is held at any time.
 */
public class SubscriptionRegistry {

  private final Set<String> subscribed = ConcurrentHashMap.newKeySet();

  /**
   * @return true if the id was free and is now claimed, false if already subscribed.
   */
  public boolean tryClaim(String serverId) {
    return subscribed.add(serverId);
  }

  public void release(String serverId) {
    subscribed.remove(serverId);
  }

  public boolean isSubscribed(String serverId) {
    return subscribed.contains(serverId);
  }

  public int size() {
    return subscribed.size();
  }
}
