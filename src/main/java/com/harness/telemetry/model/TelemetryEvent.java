package com.harness.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.time.Instant;

/**
 * Normalized event shipped to the ingest endpoint. Only the fields relevant to
 * {@link #eventType()} are populated; the rest stay at their defaults and are
 * left out of the serialized form.
 */
@JsonPropertyOrder({"_time", "event_type", "server_id"})
public record TelemetryEvent(
    @JsonProperty("_time") @JsonSerialize(using = ToStringSerializer.class) Instant time,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("server_id") String serverId,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) String status,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) String line,
    @JsonProperty("memory_bytes") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long memoryBytes,
    @JsonProperty("memory_limit_bytes") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long memoryLimitBytes,
    @JsonProperty("cpu_absolute") @JsonInclude(JsonInclude.Include.NON_DEFAULT) double cpuAbsolute,
    @JsonProperty("network_rx_bytes") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long networkRxBytes,
    @JsonProperty("network_tx_bytes") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long networkTxBytes,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) long uptime,
    @JsonProperty("disk_bytes") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long diskBytes,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) String state
) {

  public TelemetryEvent {
    if (time == null || eventType == null) {
      throw new IllegalArgumentException("time and eventType are required");
    }
    if (serverId == null || serverId.isEmpty()) {
      throw new IllegalArgumentException("serverId must not be empty");
    }
  }

  public static TelemetryEvent status(Instant time, String serverId, String status) {
    return new TelemetryEvent(time, EventType.STATUS, serverId, status, null,
        0, 0, 0, 0, 0, 0, 0, null);
  }

  public static TelemetryEvent consoleLine(Instant time, String serverId, String line) {
    return new TelemetryEvent(time, EventType.CONSOLE_OUTPUT, serverId, null, line,
        0, 0, 0, 0, 0, 0, 0, null);
  }

  public static TelemetryEvent stats(Instant time, String serverId, ResourceUsage usage) {
    return new TelemetryEvent(time, EventType.STATS, serverId, null, null,
        usage.memoryBytes(),
        usage.memoryLimitBytes(),
        usage.cpuAbsolute(),
        usage.networkRxBytes(),
        usage.networkTxBytes(),
        usage.uptime(),
        usage.diskBytes(),
        usage.state());
  }

  public record ResourceUsage(
      long memoryBytes,
      long memoryLimitBytes,
      double cpuAbsolute,
      long networkRxBytes,
      long networkTxBytes,
      long uptime,
      long diskBytes,
      String state
  ) {}
}
