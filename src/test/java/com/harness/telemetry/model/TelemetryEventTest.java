package com.harness.telemetry.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryEventTest {

  private static final Instant NOW = Instant.parse("2026-10-19T12:00:00.123456789Z");

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void statsEventSerializesOnlyPopulatedFields() throws Exception {
    TelemetryEvent event = TelemetryEvent.stats(NOW, "srv-1",
        new TelemetryEvent.ResourceUsage(100, 200, 0.5, 10, 20, 5, 1000, null));

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(event));

    assertThat(fieldNames(json)).containsExactlyInAnyOrder(
        "_time", "event_type", "server_id",
        "memory_bytes", "memory_limit_bytes", "cpu_absolute",
        "network_rx_bytes", "network_tx_bytes", "uptime", "disk_bytes");
    assertThat(json.get("_time").asText()).isEqualTo("2026-10-19T12:00:00.123456789Z");
    assertThat(json.get("event_type").asText()).isEqualTo("stats");
    assertThat(json.get("server_id").asText()).isEqualTo("srv-1");
    assertThat(json.get("memory_bytes").asLong()).isEqualTo(100);
    assertThat(json.get("memory_limit_bytes").asLong()).isEqualTo(200);
    assertThat(json.get("cpu_absolute").asDouble()).isEqualTo(0.5);
    assertThat(json.get("network_rx_bytes").asLong()).isEqualTo(10);
    assertThat(json.get("network_tx_bytes").asLong()).isEqualTo(20);
    assertThat(json.get("uptime").asLong()).isEqualTo(5);
    assertThat(json.get("disk_bytes").asLong()).isEqualTo(1000);
  }

  @Test
  void statsEventIncludesStateWhenPresent() throws Exception {
    TelemetryEvent event = TelemetryEvent.stats(NOW, "srv-1",
        new TelemetryEvent.ResourceUsage(1, 0, 0, 0, 0, 0, 0, "running"));

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(event));

    assertThat(json.get("state").asText()).isEqualTo("running");
    assertThat(json.has("memory_limit_bytes")).isFalse();
    assertThat(json.has("cpu_absolute")).isFalse();
  }

  @Test
  void statusAndConsoleEventsCarryOnlyTheirField() throws Exception {
    JsonNode status = objectMapper.readTree(objectMapper.writeValueAsString(
        TelemetryEvent.status(NOW, "srv-1", "starting")));
    JsonNode console = objectMapper.readTree(objectMapper.writeValueAsString(
        TelemetryEvent.consoleLine(NOW, "srv-1", "[INFO] Done (3.2s)!")));

    assertThat(fieldNames(status)).containsExactlyInAnyOrder(
        "_time", "event_type", "server_id", "status");
    assertThat(status.get("event_type").asText()).isEqualTo("status");
    assertThat(fieldNames(console)).containsExactlyInAnyOrder(
        "_time", "event_type", "server_id", "line");
    assertThat(console.get("event_type").asText()).isEqualTo("console_output");
    assertThat(console.get("line").asText()).isEqualTo("[INFO] Done (3.2s)!");
  }

  @Test
  void emptyServerIdIsRejected() {
    assertThatThrownBy(() -> TelemetryEvent.status(NOW, "", "running"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }
}
