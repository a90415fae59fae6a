package com.harness.telemetry.pipeline.queue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DropWarningLimiterTest {

  @Test
  void grantsOneWarningPerWindow() {
    MutableClock clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
    DropWarningLimiter limiter = new DropWarningLimiter(clock, Duration.ofMinutes(1));

    assertThat(limiter.tryAcquire()).isTrue();
    for (int i = 0; i < 1_000; i++) {
      assertThat(limiter.tryAcquire()).isFalse();
    }

    clock.advance(Duration.ofSeconds(59));
    assertThat(limiter.tryAcquire()).isFalse();

    clock.advance(Duration.ofSeconds(1));
    assertThat(limiter.tryAcquire()).isTrue();
    assertThat(limiter.tryAcquire()).isFalse();
  }
}
