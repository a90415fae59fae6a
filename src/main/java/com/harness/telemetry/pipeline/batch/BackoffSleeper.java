package com.harness.telemetry.pipeline.batch;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {

  BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
