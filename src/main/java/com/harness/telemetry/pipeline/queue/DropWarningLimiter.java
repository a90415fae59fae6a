package com.harness.telemetry.pipeline.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Grants at most one warning per window. The last-warning time never leaves
 * this class.
 */
public class DropWarningLimiter {

  public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

  private final Clock clock;
  private final Duration window;
  private Instant lastWarning;

  public DropWarningLimiter(Clock clock, Duration window) {
    this.clock = clock;
    this.window = window;
  }

  public synchronized boolean tryAcquire() {
    Instant now = clock.instant();
    if (lastWarning != null && Duration.between(lastWarning, now).compareTo(window) < 0) {
      return false;
    }
    lastWarning = now;
    return true;
  }
}
