package com.harness.telemetry.pipeline.queue;

import com.harness.telemetry.model.TelemetryEvent;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded buffer shared by every server listener and drained by the batch
 * flusher. Producers never block: when the buffer is full the event is dropped.
 */
public class EventQueue {

  private static final Logger log = LoggerFactory.getLogger(EventQueue.class);

  private final BlockingQueue<TelemetryEvent> queue;
  private final DropWarningLimiter dropWarnings;
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong droppedSinceWarning = new AtomicLong();

  public EventQueue(int capacity) {
    this(capacity, Clock.systemUTC());
  }

  public EventQueue(int capacity, Clock clock) {
    this(capacity, new DropWarningLimiter(clock, DropWarningLimiter.DEFAULT_WINDOW));
  }

  public EventQueue(int capacity, DropWarningLimiter dropWarnings) {
    this.queue = new LinkedBlockingQueue<>(capacity);
    this.dropWarnings = dropWarnings;
  }

  /**
   * @return true if the event was queued, false if it was dropped because the queue is full.
   */
  public boolean enqueue(TelemetryEvent event) {
    if (queue.offer(event)) {
      return true;
    }
    dropped.incrementAndGet();
    droppedSinceWarning.incrementAndGet();
    if (dropWarnings.tryAcquire()) {
      log.warn("Telemetry queue full, dropping events. dropped={}, capacity={}",
          droppedSinceWarning.getAndSet(0), capacity());
    }
    return false;
  }

  public TelemetryEvent poll(Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Move every currently queued event into {@code target} without blocking.
   */
  public int drainTo(Collection<? super TelemetryEvent> target) {
    return queue.drainTo(target);
  }

  public int size() {
    return queue.size();
  }

  public int capacity() {
    return queue.size() + queue.remainingCapacity();
  }

  public long droppedCount() {
    return dropped.get();
  }
}
