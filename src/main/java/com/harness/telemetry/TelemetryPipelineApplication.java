package com.harness.telemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TelemetryPipelineApplication {
  public static void main(String[] args) {
    SpringApplication.run(TelemetryPipelineApplication.class, args);
  }
}
