package com.harness.telemetry.source;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Sink implements MessageBus {

  private static final Logger log = LoggerFactory.getLogger(Sink.class);

  private final String name;
  private final List<MessageListener> listeners = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  public Sink(String name) {
    this.name = name;
  }

  @Override
  public void on(MessageListener listener) {
    if (closed) {
      listener.onClose();
      return;
    }
    listeners.add(listener);
    // close() may have run between the check and the add
    if (closed && listeners.remove(listener)) {
      listener.onClose();
    }
  }

  @Override
  public void off(MessageListener listener) {
    listeners.remove(listener);
  }

  public void publish(byte[] data) {
    if (closed) {
      return;
    }
    for (MessageListener listener : listeners) {
      try {
        listener.onMessage(data);
      } catch (RuntimeException e) {
        log.warn("Listener failed on sink {}", name, e);
      }
    }
  }

  public void publish(String text) {
    publish(text.getBytes(StandardCharsets.UTF_8));
  }

  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (MessageListener listener : listeners) {
      if (listeners.remove(listener)) {
        listener.onClose();
      }
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public int listenerCount() {
    return listeners.size();
  }
}
