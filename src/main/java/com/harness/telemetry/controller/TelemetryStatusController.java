package com.harness.telemetry.controller;

import com.harness.telemetry.model.PipelineStatus;
import com.harness.telemetry.service.TelemetryPipeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/telemetry")
public class TelemetryStatusController {

  private final TelemetryPipeline pipeline;

  public TelemetryStatusController(TelemetryPipeline pipeline) {
    this.pipeline = pipeline;
  }

  @GetMapping("/status")
  public ResponseEntity<PipelineStatus> status() {
    return ResponseEntity.ok(pipeline.status());
  }
}
