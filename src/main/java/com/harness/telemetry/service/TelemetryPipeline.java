package com.harness.telemetry.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.telemetry.config.IngestProperties;
import com.harness.telemetry.model.PipelineStatus;
import com.harness.telemetry.pipeline.batch.BatchFlusher;
import com.harness.telemetry.pipeline.batch.IngestClient;
import com.harness.telemetry.pipeline.listener.ServerEventDecoder;
import com.harness.telemetry.pipeline.listener.ServerListener;
import com.harness.telemetry.pipeline.listener.SubscriptionRegistry;
import com.harness.telemetry.pipeline.queue.DropWarningLimiter;
import com.harness.telemetry.pipeline.queue.EventQueue;
import com.harness.telemetry.source.CancellationSignal;
import com.harness.telemetry.source.ManagedServer;
import com.harness.telemetry.source.ServerRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * Owns the telemetry pipeline: one listener thread per server, a shared
 * bounded queue and a single flusher thread delivering batches. A pipeline
 * runs at most once; after {@link #shutdown()} a new instance is required.
 */
@Service
public class TelemetryPipeline {

  private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final IngestProperties properties;
  private final ServerRegistry servers;
  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final Clock clock;

  private final SubscriptionRegistry registry = new SubscriptionRegistry();
  private final CancellationSignal shutdownSignal = new CancellationSignal();

  private boolean started;
  private volatile boolean running;
  private EventQueue queue;
  private ServerEventDecoder decoder;
  private IngestClient ingestClient;
  private BatchFlusher flusher;
  private Thread flusherThread;

  public TelemetryPipeline(IngestProperties properties,
                           ServerRegistry servers,
                           ObjectMapper objectMapper,
                           @Qualifier("ingestRestTemplate") RestTemplate restTemplate,
                           Clock clock) {
    this.properties = properties;
    this.servers = servers;
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.clock = clock;
  }

  @PostConstruct
  void init() {
    start();
  }

  /**
   * @return true if the pipeline is running after this call.
   */
  public synchronized boolean start() {
    if (started) {
      return running;
    }
    started = true;

    if (!properties.enabled()) {
      log.info("Telemetry ingest disabled");
      return false;
    }
    List<String> missing = properties.missingSettings();
    if (!missing.isEmpty()) {
      log.warn("Telemetry ingest enabled but {} not set, skipping initialization", missing);
      return false;
    }

    try {
      ingestClient = new IngestClient(restTemplate, objectMapper,
          properties.url(), properties.dataset(), properties.apiToken());
    } catch (IllegalArgumentException e) {
      log.warn("Telemetry ingest url is invalid, skipping initialization. url={}, error={}",
          properties.url(), e.getMessage());
      return false;
    }
    queue = new EventQueue(properties.effectiveQueueCapacity(), clock);
    decoder = new ServerEventDecoder(objectMapper, clock);
    flusher = new BatchFlusher(queue, ingestClient::deliver,
        properties.effectiveFlushInterval(), properties.effectiveBatchSize());
    running = true;

    // Hook first, then enumerate: a server added in between is seen twice and
    // tryClaim keeps the second one out.
    servers.onServerAdd(this::subscribe);
    for (ManagedServer server : servers.all()) {
      subscribe(server);
    }

    flusherThread = new Thread(flusher, "telemetry-flusher");
    flusherThread.setDaemon(true);
    flusherThread.start();

    log.info("Telemetry pipeline started. ingestUri={}, batchSize={}, flushInterval={}, subscribed={}",
        ingestClient.ingestUri(), properties.effectiveBatchSize(),
        properties.effectiveFlushInterval(), registry.size());
    return true;
  }

  /**
   * Subscribe to a server unless it already has a live listener.
   *
   * @return true if a new listener was started.
   */
  public boolean subscribe(ManagedServer server) {
    if (!running || shutdownSignal.isCancelled()) {
      return false;
    }
    if (!registry.tryClaim(server.id())) {
      log.debug("Server already subscribed. serverId={}", server.id());
      return false;
    }
    ServerListener listener = new ServerListener(server, registry, decoder, queue, shutdownSignal,
        new DropWarningLimiter(clock, DropWarningLimiter.DEFAULT_WINDOW));
    Thread thread = new Thread(listener, "telemetry-listener-" + server.id());
    thread.setDaemon(true);
    thread.start();
    return true;
  }

  @PreDestroy
  public void shutdown() {
    Thread thread;
    synchronized (this) {
      if (!running) {
        return;
      }
      running = false;
      thread = flusherThread;
    }
    log.info("Shutting down telemetry pipeline");
    shutdownSignal.cancel();
    flusher.shutdown();
    thread.interrupt();
    try {
      thread.join(SHUTDOWN_TIMEOUT.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the telemetry flusher to finish");
      return;
    }
    if (thread.isAlive()) {
      log.warn("Telemetry flusher did not finish within {}", SHUTDOWN_TIMEOUT);
    } else {
      log.info("Telemetry pipeline shutdown complete");
    }
  }

  public boolean isRunning() {
    return running;
  }

  public boolean isSubscribed(String serverId) {
    return registry.isSubscribed(serverId);
  }

  public synchronized PipelineStatus status() {
    if (queue == null) {
      return PipelineStatus.inactive(properties.enabled());
    }
    return new PipelineStatus(
        properties.enabled(),
        running,
        registry.size(),
        queue.size(),
        queue.droppedCount(),
        flusher.batchesFlushed(),
        ingestClient.batchesDelivered(),
        ingestClient.batchesFailed(),
        ingestClient.eventsDelivered(),
        ingestClient.eventsLost()
    );
  }
}
