package com.harness.telemetry.pipeline.listener;

import com.harness.telemetry.pipeline.queue.DropWarningLimiter;
import com.harness.telemetry.pipeline.queue.EventQueue;
import com.harness.telemetry.source.CancellationSignal;
import com.harness.telemetry.source.ManagedServer;
import com.harness.telemetry.source.MessageListener;
import java.time.Clock;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows one server: its event bus, its console sink, its own context and
 * the pipeline shutdown signal. Bus callbacks only hand messages to a small
 * inbox; decoding happens on the listener thread. The listener stops when
 * either bus closes or either signal fires, and only then releases the
 * server's subscription.
 */
public class ServerListener implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(ServerListener.class);

  static final int INBOX_CAPACITY = 64;

  private final ManagedServer server;
  private final String serverId;
  private final SubscriptionRegistry registry;
  private final ServerEventDecoder decoder;
  private final EventQueue queue;
  private final CancellationSignal shutdownSignal;
  private final DropWarningLimiter dropWarnings;

  private final BlockingQueue<InboxMessage> inbox = new LinkedBlockingQueue<>(INBOX_CAPACITY);
  private final MessageListener eventForwarder = new Forwarder(Channel.EVENTS);
  private final MessageListener consoleForwarder = new Forwarder(Channel.CONSOLE);
  private final Runnable stopOnServerCancel = () -> stop("server context cancelled");
  private final Runnable stopOnShutdown = () -> stop("pipeline shutdown");
  private final AtomicReference<String> stopReason = new AtomicReference<>();
  private final AtomicLong inboxDrops = new AtomicLong();
  private final AtomicLong dropsSinceWarning = new AtomicLong();

  private volatile Thread worker;

  public ServerListener(ManagedServer server,
                        SubscriptionRegistry registry,
                        ServerEventDecoder decoder,
                        EventQueue queue,
                        CancellationSignal shutdownSignal) {
    this(server, registry, decoder, queue, shutdownSignal,
        new DropWarningLimiter(Clock.systemUTC(), DropWarningLimiter.DEFAULT_WINDOW));
  }

  public ServerListener(ManagedServer server,
                        SubscriptionRegistry registry,
                        ServerEventDecoder decoder,
                        EventQueue queue,
                        CancellationSignal shutdownSignal,
                        DropWarningLimiter dropWarnings) {
    this.server = server;
    this.serverId = server.id();
    this.registry = registry;
    this.decoder = decoder;
    this.queue = queue;
    this.shutdownSignal = shutdownSignal;
    this.dropWarnings = dropWarnings;
  }

  @Override
  public void run() {
    worker = Thread.currentThread();
    try {
      server.events().on(eventForwarder);
      server.console().on(consoleForwarder);
      server.context().onCancel(stopOnServerCancel);
      shutdownSignal.onCancel(stopOnShutdown);
      log.debug("Subscribed to server. serverId={}", serverId);

      while (stopReason.get() == null) {
        InboxMessage message;
        try {
          message = inbox.take();
        } catch (InterruptedException e) {
          stopReason.compareAndSet(null, "interrupted");
          break;
        }
        handle(message);
      }
    } finally {
      server.events().off(eventForwarder);
      server.console().off(consoleForwarder);
      server.context().removeCallback(stopOnServerCancel);
      shutdownSignal.removeCallback(stopOnShutdown);
      registry.release(serverId);
      log.debug("Unsubscribed from server. serverId={}, reason={}, inboxDrops={}",
          serverId, stopReason.get(), inboxDrops.get());
    }
  }

  /**
   * Request the listener to exit. Only the first reason is kept.
   */
  void stop(String reason) {
    if (!stopReason.compareAndSet(null, reason)) {
      return;
    }
    Thread current = worker;
    if (current != null && current != Thread.currentThread()) {
      current.interrupt();
    }
  }

  private void handle(InboxMessage message) {
    try {
      if (message.channel() == Channel.EVENTS) {
        decoder.decodeEvent(serverId, message.data()).ifPresent(queue::enqueue);
      } else {
        queue.enqueue(decoder.decodeConsoleLine(serverId, message.data()));
      }
    } catch (RuntimeException e) {
      log.error("Failed to process server message. serverId={}, channel={}",
          serverId, message.channel(), e);
    }
  }

  public String serverId() {
    return serverId;
  }

  public long inboxDrops() {
    return inboxDrops.get();
  }

  private void recordInboxDrop(Channel channel) {
    inboxDrops.incrementAndGet();
    dropsSinceWarning.incrementAndGet();
    if (dropWarnings.tryAcquire()) {
      log.warn("Listener inbox full, dropping server messages. serverId={}, channel={}, dropped={}, capacity={}",
          serverId, channel, dropsSinceWarning.getAndSet(0), INBOX_CAPACITY);
    }
  }

  private enum Channel { EVENTS, CONSOLE }

  private record InboxMessage(Channel channel, byte[] data) {}

  private class Forwarder implements MessageListener {

    private final Channel channel;

    Forwarder(Channel channel) {
      this.channel = channel;
    }

    @Override
    public void onMessage(byte[] data) {
      if (!inbox.offer(new InboxMessage(channel, data))) {
        recordInboxDrop(channel);
      }
    }

    @Override
    public void onClose() {
      stop(channel == Channel.EVENTS ? "event bus closed" : "console sink closed");
    }
  }
}
