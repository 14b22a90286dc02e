package com.example.tokendatasource.core.credentials;

import java.time.Duration;

/**
 * Runs tasks once after a delay. Refresh loops and job ticks reschedule themselves through this
 * interface so their cadence can be driven by a virtual clock in tests.
 */
public interface DelayScheduler extends AutoCloseable {

  /**
   * Schedules {@code task} to run once after {@code delay}.
   *
   * @return handle that cancels the task if it has not started yet
   */
  Handle schedule(final Runnable task, final Duration delay);

  /** Stops accepting tasks and discards pending ones. */
  @Override
  void close();

  /** Cancellation handle for a scheduled task. */
  @FunctionalInterface
  interface Handle {
    void cancel();
  }
}
