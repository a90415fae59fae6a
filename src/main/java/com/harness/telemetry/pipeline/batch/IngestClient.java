package com.harness.telemetry.pipeline.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.telemetry.model.TelemetryEvent;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Posts batches to {@code {url}/v1/datasets/{dataset}/ingest}. Client errors
 * are permanent; server errors and transport failures are retried on a fixed
 * backoff schedule. A batch that cannot be delivered is dropped, never
 * re-queued.
 */
public class IngestClient {

  private static final Logger log = LoggerFactory.getLogger(IngestClient.class);

  public static final List<Duration> DEFAULT_BACKOFFS =
      List.of(Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(2));

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final URI ingestUri;
  private final String apiToken;
  private final List<Duration> backoffs;
  private final BackoffSleeper sleeper;

  private final AtomicLong batchesDelivered = new AtomicLong();
  private final AtomicLong batchesFailed = new AtomicLong();
  private final AtomicLong eventsDelivered = new AtomicLong();
  private final AtomicLong eventsLost = new AtomicLong();

  public IngestClient(RestTemplate restTemplate,
                      ObjectMapper objectMapper,
                      String baseUrl,
                      String dataset,
                      String apiToken) {
    this(restTemplate, objectMapper, baseUrl, dataset, apiToken,
        DEFAULT_BACKOFFS, BackoffSleeper.THREAD_SLEEP);
  }

  public IngestClient(RestTemplate restTemplate,
                      ObjectMapper objectMapper,
                      String baseUrl,
                      String dataset,
                      String apiToken,
                      List<Duration> backoffs,
                      BackoffSleeper sleeper) {
    if (backoffs.isEmpty()) {
      throw new IllegalArgumentException("At least one attempt is required");
    }
    this.restTemplate = restTemplate;
    this.objectMapper = objectMapper;
    this.ingestUri = ingestUri(baseUrl, dataset);
    this.apiToken = apiToken;
    this.backoffs = List.copyOf(backoffs);
    this.sleeper = sleeper;
  }

  static URI ingestUri(String baseUrl, String dataset) {
    String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return UriComponentsBuilder.fromHttpUrl(base)
        .pathSegment("v1", "datasets", dataset, "ingest")
        .build()
        .encode()
        .toUri();
  }

  public DeliveryResult deliver(List<TelemetryEvent> batch) {
    String body;
    try {
      body = objectMapper.writeValueAsString(batch);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize telemetry batch. events={}", batch.size(), e);
      return failed(DeliveryResult.Outcome.UNSERIALIZABLE, 0, batch.size(), null);
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(apiToken);
    HttpEntity<String> entity = new HttpEntity<>(body, headers);

    boolean interrupted = false;
    Integer lastStatus = null;
    int attempt = 0;
    try {
      for (Duration backoff : backoffs) {
        attempt++;
        if (!backoff.isZero()) {
          try {
            sleeper.sleep(backoff);
          } catch (InterruptedException e) {
            // finish the schedule without waiting, the flusher sees the flag afterwards
            interrupted = true;
          }
        }
        try {
          ResponseEntity<Void> response = restTemplate.postForEntity(ingestUri, entity, Void.class);
          if (!response.getStatusCode().is2xxSuccessful()) {
            lastStatus = response.getStatusCode().value();
            log.warn("Telemetry ingest unexpected response. status={}, attempt={}", lastStatus, attempt);
            continue;
          }
          batchesDelivered.incrementAndGet();
          eventsDelivered.addAndGet(batch.size());
          log.debug("Delivered telemetry batch. events={}, attempt={}", batch.size(), attempt);
          return new DeliveryResult(DeliveryResult.Outcome.DELIVERED, attempt, batch.size(), null);
        } catch (HttpClientErrorException e) {
          log.error("Telemetry ingest rejected, not retrying. status={}, events={}",
              e.getStatusCode().value(), batch.size());
          return failed(DeliveryResult.Outcome.REJECTED, attempt, batch.size(),
              e.getStatusCode().value());
        } catch (HttpServerErrorException e) {
          lastStatus = e.getStatusCode().value();
          log.warn("Telemetry ingest server error. status={}, attempt={}", lastStatus, attempt);
        } catch (RestClientResponseException e) {
          lastStatus = e.getStatusCode().value();
          log.warn("Telemetry ingest unexpected response. status={}, attempt={}", lastStatus, attempt);
        } catch (RestClientException e) {
          log.warn("Telemetry ingest network error. attempt={}, error={}", attempt, e.getMessage());
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    log.error("Failed to ingest telemetry batch after all retries. events={}, attempts={}",
        batch.size(), attempt);
    return failed(DeliveryResult.Outcome.EXHAUSTED, attempt, batch.size(), lastStatus);
  }

  private DeliveryResult failed(DeliveryResult.Outcome outcome, int attempts, int events,
                                Integer status) {
    batchesFailed.incrementAndGet();
    eventsLost.addAndGet(events);
    return new DeliveryResult(outcome, attempts, events, status);
  }

  public URI ingestUri() {
    return ingestUri;
  }

  public long batchesDelivered() {
    return batchesDelivered.get();
  }

  public long batchesFailed() {
    return batchesFailed.get();
  }

  public long eventsDelivered() {
    return eventsDelivered.get();
  }

  public long eventsLost() {
    return eventsLost.get();
  }
}
