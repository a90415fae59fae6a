package com.harness.telemetry.source;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cancellation signal. Cancelling more than once is a no-op, and
 * callbacks registered after cancellation run immediately on the caller.
 */
public class CancellationSignal {

  private final List<Runnable> callbacks = new ArrayList<>();
  private boolean cancelled;

  public void cancel() {
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toRun = new ArrayList<>(callbacks);
      callbacks.clear();
    }
    toRun.forEach(Runnable::run);
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public void onCancel(Runnable callback) {
    synchronized (this) {
      if (!cancelled) {
        callbacks.add(callback);
        return;
      }
    }
    callback.run();
  }

  public synchronized void removeCallback(Runnable callback) {
    callbacks.remove(callback);
  }
}
