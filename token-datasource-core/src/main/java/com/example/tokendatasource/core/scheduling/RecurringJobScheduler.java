package com.example.tokendatasource.core.scheduling;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.tokendatasource.core.credentials.DelayScheduler;
import com.example.tokendatasource.core.credentials.ExecutorDelayScheduler;
import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import net.javacrumbs.shedlock.core.SimpleLock;

/**
 * Runs registered {@link RecurringJobSpec}s on their cron schedules, each tick guarded by a {@link
 * DistributedJobLock} so that at most one process runs a given job id at a time.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var storage = JobStorage.configure(StorageOptions.defaults(), jobsDataSource);
 * var scheduler = RecurringJobScheduler.builder().lock(storage.distributedLock()).build();
 * scheduler.register(RecurringJobSpec.of("heartbeat", "* * * * *", worker::doWork));
 * scheduler.start();
 * }</pre>
 *
 * <h2>Ticks</h2>
 *
 * <p>When a tick fires, the next tick is scheduled first and the run is handed to a worker thread.
 * The run waits for the lock; on timeout the tick is skipped. A failing job is logged and stays
 * scheduled. No infrastructure or job failure ever unregisters a job or stops the scheduler.
 */
public final class RecurringJobScheduler implements AutoCloseable {

  private static final Logger logger = System.getLogger(RecurringJobScheduler.class.getName());

  private final DistributedJobLock lock;
  private final DelayScheduler timer;
  private final boolean ownsTimer;
  private final Executor workers;
  private final ExecutorService ownedWorkers;
  private final Clock clock;
  private final ZoneId zone;
  private final JobStateListener listener;

  private final Map<String, Registration> jobs = new ConcurrentHashMap<>();
  private volatile boolean started;
  private volatile boolean closed;

  private RecurringJobScheduler(final Builder builder) {
    this.lock = builder.lock;
    this.ownsTimer = builder.timer == null;
    this.timer = ownsTimer ? new ExecutorDelayScheduler("RecurringJobScheduler") : builder.timer;
    if (builder.workers == null) {
      this.ownedWorkers = newWorkerPool(builder.workerThreads);
      this.workers = ownedWorkers;
    } else {
      this.ownedWorkers = null;
      this.workers = builder.workers;
    }
    this.clock = builder.clock;
    this.zone = builder.zone;
    this.listener = builder.listener;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RecurringJobScheduler}. */
  public static class Builder {
    private DistributedJobLock lock;
    private DelayScheduler timer;
    private Executor workers;
    private int workerThreads = 2;
    private Clock clock = Clock.systemUTC();
    private ZoneId zone = ZoneOffset.UTC;
    private JobStateListener listener = JobStateListener.NONE;

    private Builder() {}

    /** Sets the distributed lock guarding every tick (required). */
    public Builder lock(final DistributedJobLock lock) {
      this.lock = lock;
      return this;
    }

    /** Timer firing ticks. Default: a dedicated daemon thread, closed with the scheduler. */
    public Builder timer(final DelayScheduler timer) {
      this.timer = timer;
      return this;
    }

    /** Executor running ticks. Default: a daemon pool of {@link #workerThreads(int)} threads. */
    public Builder workers(final Executor workers) {
      this.workers = workers;
      return this;
    }

    /** Size of the default worker pool. Default: 2 */
    public Builder workerThreads(final int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Zone the cron fields are evaluated in. Default: UTC */
    public Builder zone(final ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder listener(final JobStateListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Builds the scheduler. Nothing fires until {@link RecurringJobScheduler#start()}.
     *
     * @throws IllegalStateException if required fields are not set
     */
    public RecurringJobScheduler build() {
      if (lock == null) throw new IllegalStateException("lock is required");
      if (workers == null && workerThreads < 1)
        throw new IllegalArgumentException("workerThreads must be >= 1");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (zone == null) throw new IllegalStateException("zone cannot be null");
      if (listener == null) throw new IllegalStateException("listener cannot be null");
      return new RecurringJobScheduler(this);
    }
  }

  /**
   * Registers a job, or replaces the schedule and action of the job with the same id.
   *
   * <p>On a started scheduler the job's pending tick is rescheduled from the new expression.
   */
  public void register(final RecurringJobSpec spec) {
    if (closed) throw new IllegalStateException("RecurringJobScheduler is closed");

    final var registration =
        jobs.compute(
            spec.id(),
            (id, existing) -> {
              if (existing == null) return new Registration(spec);
              existing.spec = spec;
              return existing;
            });

    logger.log(INFO, "Registered recurring job {0} with schedule {1}", spec.id(), spec.schedule());
    if (started) scheduleNext(registration);
  }

  /** Starts firing ticks for all registered jobs. Calling it again has no effect. */
  public void start() {
    if (closed) throw new IllegalStateException("RecurringJobScheduler is closed");
    if (started) return;
    started = true;
    jobs.values().forEach(this::scheduleNext);
    logger.log(INFO, "Started recurring job scheduler with {0} job(s)", jobs.size());
  }

  /**
   * Runs one tick of a job on the calling thread, outside its cron schedule.
   *
   * @return {@link JobState#COMPLETED}, {@link JobState#FAILED} or {@link JobState#SKIPPED}
   * @throws NoSuchElementException if no job is registered under {@code jobId}
   */
  public JobState trigger(final String jobId) {
    final var registration = jobs.get(jobId);
    if (registration == null) throw new NoSuchElementException("No job registered as " + jobId);
    return runTick(registration);
  }

  /** Registered job ids, sorted. */
  public Set<String> registeredJobIds() {
    return new TreeSet<>(jobs.keySet());
  }

  public Optional<JobState> state(final String jobId) {
    return Optional.ofNullable(jobs.get(jobId)).map(registration -> registration.state.get());
  }

  public Optional<RecurringJobSpec> job(final String jobId) {
    return Optional.ofNullable(jobs.get(jobId)).map(registration -> registration.spec);
  }

  /** Cancels pending ticks. Ticks already running finish on their worker threads. */
  @Override
  public void close() {
    closed = true;
    jobs.values().forEach(Registration::cancelPending);
    if (ownsTimer) timer.close();
    if (ownedWorkers != null) {
      ownedWorkers.shutdown();
      try {
        if (!ownedWorkers.awaitTermination(5, TimeUnit.SECONDS)) ownedWorkers.shutdownNow();
      } catch (final InterruptedException e) {
        ownedWorkers.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    logger.log(INFO, "Stopped recurring job scheduler");
  }

  private void scheduleNext(final Registration registration) {
    synchronized (registration) {
      if (closed) return;
      registration.cancelPending();

      final var now = clock.instant();
      final var spec = registration.spec;
      final var next = spec.schedule().next(now, zone);
      if (next.isEmpty()) {
        logger.log(WARNING, "Job {0} has no future fire time for {1}", spec.id(), spec.schedule());
        return;
      }

      final var generation = ++registration.generation;
      registration.pending =
          timer.schedule(() -> fire(registration, generation), Duration.between(now, next.get()));
      if (registration.state.compareAndSet(JobState.REGISTERED, JobState.SCHEDULED))
        listener.onTransition(spec.id(), JobState.REGISTERED, JobState.SCHEDULED);
      logger.log(DEBUG, "Job {0} next fires at {1}", spec.id(), next.get());
    }
  }

  private void fire(final Registration registration, final long generation) {
    synchronized (registration) {
      if (closed || registration.generation != generation) return;
    }
    scheduleNext(registration);
    try {
      workers.execute(() -> runTick(registration));
    } catch (final RejectedExecutionException e) {
      logger.log(WARNING, "Worker pool rejected tick for job {0}", registration.spec.id());
    }
  }

  private JobState runTick(final Registration registration) {
    final var spec = registration.spec;
    final var jobId = spec.id();

    if (!registration.running.compareAndSet(false, true)) {
      logger.log(INFO, "Job {0} is still running from the previous tick, skipping", jobId);
      return JobState.SKIPPED;
    }

    try {
      final SimpleLock held;
      try {
        held = lock.acquire(jobId);
      } catch (final LockAcquisitionTimeoutException e) {
        logger.log(INFO, "Skipping tick of job {0}: {1}", jobId, e.getMessage());
        return transition(registration, JobState.SKIPPED);
      } catch (final RuntimeException e) {
        logger.log(WARNING, "Skipping tick of job %s: lock storage failed".formatted(jobId), e);
        return transition(registration, JobState.SKIPPED);
      }

      transition(registration, JobState.LOCK_ACQUIRED);
      try {
        transition(registration, JobState.RUNNING);
        spec.action().doWork();
        registration.completedRuns.incrementAndGet();
        return transition(registration, JobState.COMPLETED);
      } catch (final Exception e) {
        final var failure = new JobExecutionException(jobId, e);
        logger.log(WARNING, failure.getMessage(), failure);
        return transition(registration, JobState.FAILED);
      } finally {
        release(jobId, held);
      }
    } finally {
      transition(registration, JobState.SCHEDULED);
      registration.running.set(false);
    }
  }

  private JobState transition(final Registration registration, final JobState next) {
    final var previous = registration.state.getAndSet(next);
    listener.onTransition(registration.spec.id(), previous, next);
    return next;
  }

  private static void release(final String jobId, final SimpleLock held) {
    try {
      held.unlock();
    } catch (final RuntimeException e) {
      logger.log(WARNING, "Failed to release lock for job %s".formatted(jobId), e);
    }
  }

  /** Number of completed runs of a job on this process. */
  int completedRuns(final String jobId) {
    return Optional.ofNullable(jobs.get(jobId))
        .map(registration -> registration.completedRuns.get())
        .orElse(0);
  }

  private static ExecutorService newWorkerPool(final int threads) {
    final var counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        threads,
        r -> {
          final var t = new Thread(r, "RecurringJob-worker-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  private static final class Registration {
    private volatile RecurringJobSpec spec;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.REGISTERED);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger completedRuns = new AtomicInteger();
    private DelayScheduler.Handle pending;
    private long generation;

    private Registration(final RecurringJobSpec spec) {
      this.spec = spec;
    }

    private synchronized void cancelPending() {
      if (pending != null) {
        pending.cancel();
        pending = null;
      }
    }
  }
}
