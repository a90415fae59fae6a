package com.harness.telemetry.pipeline.listener;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harness.telemetry.model.TelemetryEvent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw server bus messages into {@link TelemetryEvent}s. Only the
 * {@code stats} and {@code status} topics are decoded; console output echoed
 * on the event bus is ignored because the console sink already carries it.
 */
public class ServerEventDecoder {

  private static final Logger log = LoggerFactory.getLogger(ServerEventDecoder.class);

  static final String STATS_TOPIC = "stats";
  static final String STATUS_TOPIC = "status";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ServerEventDecoder(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public Optional<TelemetryEvent> decodeEvent(String serverId, byte[] data) {
    JsonNode envelope;
    try {
      envelope = objectMapper.readTree(data);
    } catch (IOException e) {
      log.warn("Failed to decode server event envelope. serverId={}, error={}",
          serverId, e.getMessage());
      return Optional.empty();
    }
    if (envelope == null || !envelope.isObject()) {
      log.warn("Server event is not a JSON object. serverId={}", serverId);
      return Optional.empty();
    }

    String topic = envelope.path("topic").asText("");
    switch (topic) {
      case STATS_TOPIC:
        return decodeStats(serverId, envelope.path("data"));
      case STATUS_TOPIC:
        return decodeStatus(serverId, envelope.path("data"));
      default:
        return Optional.empty();
    }
  }

  public TelemetryEvent decodeConsoleLine(String serverId, byte[] data) {
    return TelemetryEvent.consoleLine(clock.instant(), serverId,
        new String(data, StandardCharsets.UTF_8));
  }

  private Optional<TelemetryEvent> decodeStats(String serverId, JsonNode data) {
    if (!data.isObject()) {
      log.warn("Stats event without payload. serverId={}", serverId);
      return Optional.empty();
    }
    JsonNode network = data.path("network");
    try {
      return Optional.of(TelemetryEvent.stats(clock.instant(), serverId,
          new TelemetryEvent.ResourceUsage(
              counter(data, "memory_bytes"),
              counter(data, "memory_limit_bytes"),
              number(data, "cpu_absolute"),
              counter(network, "rx_bytes"),
              counter(network, "tx_bytes"),
              counter(data, "uptime"),
              counter(data, "disk_bytes"),
              nullableText(data.path("state").path("value")))));
    } catch (IllegalArgumentException e) {
      log.warn("Failed to decode stats event. serverId={}, error={}", serverId, e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<TelemetryEvent> decodeStatus(String serverId, JsonNode data) {
    if (!data.isTextual()) {
      log.warn("Failed to decode status event, data is not a string. serverId={}", serverId);
      return Optional.empty();
    }
    return Optional.of(TelemetryEvent.status(clock.instant(), serverId, data.asText()));
  }

  /**
   * Reads an unsigned counter. Values beyond {@code Long.MAX_VALUE} are clamped
   * to it; a missing or null field reads as zero.
   */
  static long counter(JsonNode parent, String field) {
    JsonNode node = parent.path(field);
    if (node.isMissingNode() || node.isNull()) {
      return 0;
    }
    if (!node.isIntegralNumber()) {
      throw new IllegalArgumentException(field + " is not an integer");
    }
    if (node.canConvertToLong()) {
      return node.longValue();
    }
    if (node.bigIntegerValue().signum() < 0) {
      throw new IllegalArgumentException(field + " is out of range");
    }
    return Long.MAX_VALUE;
  }

  private static double number(JsonNode parent, String field) {
    JsonNode node = parent.path(field);
    if (node.isMissingNode() || node.isNull()) {
      return 0;
    }
    if (!node.isNumber()) {
      throw new IllegalArgumentException(field + " is not a number");
    }
    return node.doubleValue();
  }

  private static String nullableText(JsonNode node) {
    if (node.isMissingNode() || node.isNull() || !node.isValueNode()) {
      return null;
    }
    return node.asText();
  }
}
