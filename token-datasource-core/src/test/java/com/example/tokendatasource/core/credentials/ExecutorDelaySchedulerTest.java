package com.example.tokendatasource.core.credentials;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.*;

public class ExecutorDelaySchedulerTest {

  @Test
  @DisplayName("Should run a task after its delay")
  void shouldRunTaskAfterDelay() throws InterruptedException {
    try (final var scheduler = new ExecutorDelayScheduler("test-scheduler")) {
      final var ran = new CountDownLatch(1);
      scheduler.schedule(ran::countDown, Duration.ofMillis(20));
      assertTrue(ran.await(2, TimeUnit.SECONDS));
    }
  }

  @Test
  @DisplayName("Should not run a cancelled task")
  void shouldNotRunCancelledTask() throws InterruptedException {
    try (final var scheduler = new ExecutorDelayScheduler("test-scheduler")) {
      final var ran = new AtomicBoolean(false);
      scheduler.schedule(() -> ran.set(true), Duration.ofMillis(50)).cancel();
      Thread.sleep(150);
      assertFalse(ran.get());
    }
  }

  @Test
  @DisplayName("Should close promptly with long-delayed tasks pending")
  void shouldClosePromptly() {
    final var scheduler = new ExecutorDelayScheduler("test-scheduler");
    scheduler.schedule(() -> {}, Duration.ofHours(4));

    final var started = System.nanoTime();
    scheduler.close();
    assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);

    assertDoesNotThrow(() -> scheduler.schedule(() -> {}, Duration.ZERO).cancel());
  }
}
