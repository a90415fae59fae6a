package com.harness.telemetry.pipeline.batch;

import com.harness.telemetry.model.TelemetryEvent;
import com.harness.telemetry.pipeline.queue.EventQueue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole consumer of the {@link EventQueue}. Flushes the current batch when it
 * reaches {@code batchSize} or when the flush interval elapses, whichever
 * comes first. A size-triggered flush restarts the interval.
 */
public class BatchFlusher implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(BatchFlusher.class);

  private final EventQueue queue;
  private final Function<List<TelemetryEvent>, DeliveryResult> delivery;
  private final Duration flushInterval;
  private final int batchSize;

  private final AtomicLong batchesFlushed = new AtomicLong();
  private volatile boolean running = true;

  private List<TelemetryEvent> batch;

  public BatchFlusher(EventQueue queue,
                      Function<List<TelemetryEvent>, DeliveryResult> delivery,
                      Duration flushInterval,
                      int batchSize) {
    this.queue = queue;
    this.delivery = delivery;
    this.flushInterval = flushInterval;
    this.batchSize = batchSize;
    this.batch = new ArrayList<>(batchSize);
  }

  @Override
  public void run() {
    log.info("BatchFlusher started. batchSize={}, flushInterval={}", batchSize, flushInterval);
    long deadline = System.nanoTime() + flushInterval.toNanos();
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        long remaining = deadline - System.nanoTime();
        TelemetryEvent event = remaining > 0 ? queue.poll(Duration.ofNanos(remaining)) : null;
        if (event != null) {
          batch.add(event);
          if (batch.size() >= batchSize) {
            flush();
            deadline = System.nanoTime() + flushInterval.toNanos();
          }
        } else if (System.nanoTime() - deadline >= 0) {
          if (!batch.isEmpty()) {
            flush();
          }
          deadline = System.nanoTime() + flushInterval.toNanos();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (Exception e) {
        log.error("Error in BatchFlusher loop", e);
      }
    }
    drain();
    log.info("BatchFlusher stopped. batchesFlushed={}", batchesFlushed.get());
  }

  /**
   * Ask the loop to drain and exit. The caller interrupts the flusher thread
   * to wake it from the queue wait.
   */
  public void shutdown() {
    this.running = false;
  }

  private void drain() {
    int drained = queue.drainTo(batch);
    if (batch.isEmpty()) {
      return;
    }
    log.info("Flushing remaining telemetry on shutdown. events={}, drainedFromQueue={}",
        batch.size(), drained);
    // the final delivery keeps its backoff schedule even though we were interrupted
    boolean interrupted = Thread.interrupted();
    try {
      flush();
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void flush() {
    List<TelemetryEvent> outgoing = List.copyOf(batch);
    batch = new ArrayList<>(batchSize);
    batchesFlushed.incrementAndGet();
    delivery.apply(outgoing);
  }

  public long batchesFlushed() {
    return batchesFlushed.get();
  }
}
