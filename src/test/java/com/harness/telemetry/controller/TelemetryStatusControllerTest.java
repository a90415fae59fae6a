package com.harness.telemetry.controller;

import com.harness.telemetry.model.PipelineStatus;
import com.harness.telemetry.service.TelemetryPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TelemetryStatusController.class)
class TelemetryStatusControllerTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private TelemetryPipeline pipeline;

  @Test
  void returnsPipelineSnapshot() throws Exception {
    given(pipeline.status()).willReturn(
        new PipelineStatus(true, true, 3, 42, 7, 10, 9, 1, 900, 100));

    mockMvc.perform(get("/api/v1/telemetry/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(true))
        .andExpect(jsonPath("$.running").value(true))
        .andExpect(jsonPath("$.subscribedServers").value(3))
        .andExpect(jsonPath("$.queueDepth").value(42))
        .andExpect(jsonPath("$.droppedEvents").value(7))
        .andExpect(jsonPath("$.batchesFailed").value(1))
        .andExpect(jsonPath("$.eventsLost").value(100));
  }

  @Test
  void reportsInactivePipeline() throws Exception {
    given(pipeline.status()).willReturn(PipelineStatus.inactive(false));

    mockMvc.perform(get("/api/v1/telemetry/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(false))
        .andExpect(jsonPath("$.running").value(false));
  }
}
