package com.example.tokendatasource.core.scheduling;

import static java.lang.System.Logger.Level.DEBUG;

import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;

/**
 * Cross-process lock per job id with a bounded wait.
 *
 * <p>{@link LockProvider#lock} never blocks: it either takes the lock or reports it held. This
 * class retries every {@link StorageOptions#lockPollInterval()} until the lock is taken or {@link
 * StorageOptions#lockTimeout()} has elapsed since the first attempt.
 */
public final class DistributedJobLock {

  private static final Logger logger = System.getLogger(DistributedJobLock.class.getName());

  private final LockProvider lockProvider;
  private final Duration lockTimeout;
  private final Duration lockHoldLimit;
  private final Duration pollInterval;
  private final Clock clock;
  private final Sleeper sleeper;

  public DistributedJobLock(final LockProvider lockProvider, final StorageOptions options) {
    this(lockProvider, options, Clock.systemUTC(), Sleeper.threadSleep());
  }

  DistributedJobLock(
      final LockProvider lockProvider,
      final StorageOptions options,
      final Clock clock,
      final Sleeper sleeper) {
    this.lockProvider = Objects.requireNonNull(lockProvider, "lockProvider");
    this.lockTimeout = options.lockTimeout();
    this.lockHoldLimit = options.lockHoldLimit();
    this.pollInterval = options.lockPollInterval();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Acquires the lock for {@code jobId}, waiting at most the lock timeout.
   *
   * @return held lock; release it with {@link SimpleLock#unlock()}
   * @throws LockAcquisitionTimeoutException if the lock is still held elsewhere when the timeout
   *     elapses, or the wait is interrupted
   */
  public SimpleLock acquire(final String jobId) {
    final var deadline = clock.instant().plus(lockTimeout);
    var attempts = 0;

    while (true) {
      attempts++;
      final var lock =
          lockProvider.lock(
              new LockConfiguration(clock.instant(), jobId, lockHoldLimit, Duration.ZERO));
      if (lock.isPresent()) {
        logger.log(DEBUG, "Acquired lock for job {0} after {1} attempt(s)", jobId, attempts);
        return lock.get();
      }

      final var remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero())
        throw new LockAcquisitionTimeoutException(jobId, lockTimeout);

      try {
        sleeper.sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LockAcquisitionTimeoutException(jobId, lockTimeout, e);
      }
    }
  }

  public Duration lockTimeout() {
    return lockTimeout;
  }

  /** Pause between lock attempts. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(final Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
      return duration -> Thread.sleep(duration.toMillis());
    }
  }
}
