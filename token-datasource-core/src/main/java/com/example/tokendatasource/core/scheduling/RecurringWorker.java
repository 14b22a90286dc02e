package com.example.tokendatasource.core.scheduling;

/**
 * One schedulable unit of work, invoked by {@link RecurringJobScheduler} while the job's
 * distributed lock is held.
 *
 * <p>Implementations must not rely on in-process exclusivity: another process may be running the
 * same job until this process wins the lock.
 */
@FunctionalInterface
public interface RecurringWorker {

  /**
   * Performs the work.
   *
   * @throws Exception on failure; the job stays scheduled for the next tick
   */
  void doWork() throws Exception;
}
