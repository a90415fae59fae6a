package com.harness.telemetry.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "telemetry.ingest")
public record IngestProperties(
    boolean enabled,
    String url,
    String apiToken,
    String dataset,
    int flushIntervalSeconds,
    int batchSize,
    int queueCapacity,
    Duration connectTimeout,
    Duration readTimeout
) {

  public static final int DEFAULT_FLUSH_INTERVAL_SECONDS = 5;
  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

  public Duration effectiveFlushInterval() {
    int seconds = flushIntervalSeconds > 0 ? flushIntervalSeconds : DEFAULT_FLUSH_INTERVAL_SECONDS;
    return Duration.ofSeconds(seconds);
  }

  public int effectiveBatchSize() {
    return batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
  }

  public int effectiveQueueCapacity() {
    return queueCapacity > 0 ? queueCapacity : DEFAULT_QUEUE_CAPACITY;
  }

  public Duration effectiveConnectTimeout() {
    return connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
  }

  public Duration effectiveReadTimeout() {
    return readTimeout != null ? readTimeout : DEFAULT_READ_TIMEOUT;
  }

  /**
   * Names of the required settings that are blank. Empty when the pipeline can start.
   */
  public List<String> missingSettings() {
    List<String> missing = new ArrayList<>();
    if (isBlank(url)) {
      missing.add("url");
    }
    if (isBlank(apiToken)) {
      missing.add("api-token");
    }
    if (isBlank(dataset)) {
      missing.add("dataset");
    }
    return missing;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
