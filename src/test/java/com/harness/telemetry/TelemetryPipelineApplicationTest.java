package com.harness.telemetry;

import com.harness.telemetry.service.TelemetryPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "telemetry.ingest.enabled=true",
    "telemetry.ingest.url=https://ingest.example.com",
    "telemetry.ingest.api-token=xaat-token"
})
class TelemetryPipelineApplicationTest {

  @Autowired
  private TelemetryPipeline pipeline;

  @Test
  void missingDatasetLeavesPipelineStoppedWithoutFailingStartup() {
    assertThat(pipeline.isRunning()).isFalse();
    assertThat(pipeline.status().enabled()).isTrue();
    assertThat(pipeline.status().running()).isFalse();
  }
}
