package com.harness.telemetry.config;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class IngestPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(PropertiesConfig.class);

  @Test
  void bindsConfiguredValues() {
    contextRunner
        .withPropertyValues(
            "telemetry.ingest.enabled=true",
            "telemetry.ingest.url=https://api.axiom.co",
            "telemetry.ingest.api-token=xaat-123",
            "telemetry.ingest.dataset=servers",
            "telemetry.ingest.flush-interval-seconds=10",
            "telemetry.ingest.batch-size=250",
            "telemetry.ingest.read-timeout=15s")
        .run(context -> {
          assertThat(context).hasNotFailed();
          IngestProperties properties = context.getBean(IngestProperties.class);

          assertThat(properties.enabled()).isTrue();
          assertThat(properties.url()).isEqualTo("https://api.axiom.co");
          assertThat(properties.apiToken()).isEqualTo("xaat-123");
          assertThat(properties.dataset()).isEqualTo("servers");
          assertThat(properties.effectiveFlushInterval()).isEqualTo(Duration.ofSeconds(10));
          assertThat(properties.effectiveBatchSize()).isEqualTo(250);
          assertThat(properties.effectiveReadTimeout()).isEqualTo(Duration.ofSeconds(15));
          assertThat(properties.missingSettings()).isEmpty();
        });
  }

  @Test
  void nonPositiveValuesFallBackToDefaults() {
    contextRunner
        .withPropertyValues(
            "telemetry.ingest.flush-interval-seconds=0",
            "telemetry.ingest.batch-size=-3")
        .run(context -> {
          IngestProperties properties = context.getBean(IngestProperties.class);

          assertThat(properties.enabled()).isFalse();
          assertThat(properties.effectiveFlushInterval()).isEqualTo(Duration.ofSeconds(5));
          assertThat(properties.effectiveBatchSize()).isEqualTo(100);
          assertThat(properties.effectiveQueueCapacity()).isEqualTo(10_000);
          assertThat(properties.effectiveConnectTimeout()).isEqualTo(Duration.ofSeconds(5));
          assertThat(properties.effectiveReadTimeout()).isEqualTo(Duration.ofSeconds(30));
        });
  }

  @Test
  void reportsBlankRequiredSettings() {
    IngestProperties properties = new IngestProperties(
        true, "https://api.axiom.co", "  ", null, 5, 100, 0, null, null);

    assertThat(properties.missingSettings()).containsExactly("api-token", "dataset");
  }

  @Configuration
  @EnableConfigurationProperties(IngestProperties.class)
  static class PropertiesConfig {
  }
}
