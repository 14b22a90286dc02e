package com.example.tokendatasource.core.credentials;

import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/** {@link DelayScheduler} backed by a single daemon thread. */
public final class ExecutorDelayScheduler implements DelayScheduler {

  private static final Logger logger = System.getLogger(ExecutorDelayScheduler.class.getName());

  private final ScheduledThreadPoolExecutor executor;

  public ExecutorDelayScheduler(final String threadName) {
    this.executor =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              final var t = new Thread(r, threadName);
              t.setDaemon(true);
              return t;
            });
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
  }

  @Override
  public Handle schedule(final Runnable task, final Duration delay) {
    try {
      final var future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
      return () -> future.cancel(false);
    } catch (final RejectedExecutionException e) {
      logger.log(WARNING, "Scheduler is shut down, dropping task");
      return () -> {};
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
