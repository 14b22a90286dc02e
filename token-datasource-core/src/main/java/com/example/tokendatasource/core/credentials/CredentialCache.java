package com.example.tokendatasource.core.credentials;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the current {@link Credential} for one token scope and keeps it fresh in the background.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var cache = CredentialCache.builder()
 *     .tokenSource(new RdsIamTokenSource("app_user"))
 *     .scope("mydb.cluster-abc.us-east-1.rds.amazonaws.com:5432")
 *     .refreshPolicy(new RefreshPolicy(Duration.ofMinutes(10), Duration.ofSeconds(10)))
 *     .build();
 * cache.start();
 *
 * String password = cache.currentPassword();
 * }</pre>
 *
 * <h2>Refresh Cadence</h2>
 *
 * <p>{@link #start()} fetches immediately on the background thread. After a successful fetch the
 * next one runs after {@link RefreshPolicy#successInterval()}; after a failed fetch it runs after
 * {@link RefreshPolicy#failureInterval()}, indefinitely. A failed fetch never clears the cached
 * credential.
 *
 * <h2>Reads</h2>
 *
 * <p>Once a credential is cached, {@link #currentPassword()} is a single volatile read. Only a call
 * made before any fetch has completed blocks: it performs the fetch itself, or waits for the
 * in-flight background fetch, and throws {@link CredentialFetchException} if that fails.
 *
 * <p>While nothing is cached and the last fetch failed, reads rethrow that failure without calling
 * the token source. A started cache leaves the next attempt to the refresh loop; a cache that was
 * never started fetches again on a read once {@link RefreshPolicy#failureInterval()} has passed.
 */
public final class CredentialCache implements PasswordProvider, AutoCloseable {

  private static final Logger logger = System.getLogger(CredentialCache.class.getName());

  private final TokenSource tokenSource;
  private final String scope;
  private final RefreshPolicy refreshPolicy;
  private final DelayScheduler scheduler;
  private final boolean ownsScheduler;
  private final Clock clock;

  private final AtomicReference<Credential> current = new AtomicReference<>();
  private final AtomicReference<FailedFetch> lastFailure = new AtomicReference<>();
  private final AtomicReference<Credential> reportedExpired = new AtomicReference<>();
  private final AtomicReference<DelayScheduler.Handle> pendingRefresh = new AtomicReference<>();
  private final ReentrantLock fetchLock = new ReentrantLock();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private volatile boolean closed;

  private CredentialCache(final Builder builder) {
    this.tokenSource = builder.tokenSource;
    this.scope = builder.scope;
    this.refreshPolicy = builder.refreshPolicy;
    this.ownsScheduler = builder.scheduler == null;
    this.scheduler =
        ownsScheduler ? new ExecutorDelayScheduler("CredentialCache-" + scope) : builder.scheduler;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link CredentialCache}. */
  public static class Builder {
    private TokenSource tokenSource;
    private String scope;
    private RefreshPolicy refreshPolicy = RefreshPolicy.defaults();
    private DelayScheduler scheduler;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /** Sets the token source (required). */
    public Builder tokenSource(final TokenSource tokenSource) {
      this.tokenSource = tokenSource;
      return this;
    }

    /** Sets the scope passed to the token source (required). */
    public Builder scope(final String scope) {
      this.scope = scope;
      return this;
    }

    /**
     * Sets the refresh cadence.
     *
     * <p>Default: {@link RefreshPolicy#defaults()}
     */
    public Builder refreshPolicy(final RefreshPolicy refreshPolicy) {
      this.refreshPolicy = refreshPolicy;
      return this;
    }

    /**
     * Sets the scheduler driving the refresh loop. A scheduler passed here is not closed by the
     * cache.
     *
     * <p>Default: a dedicated daemon thread, closed with the cache
     */
    public Builder scheduler(final DelayScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the cache. No fetch happens until {@link CredentialCache#start()} or the first
     * {@link CredentialCache#currentPassword()}.
     *
     * @throws IllegalStateException if required fields are not set, or if the success interval is
     *     not shorter than {@link TokenSource#tokenLifetime()}
     */
    public CredentialCache build() {
      if (tokenSource == null) throw new IllegalStateException("tokenSource is required");
      if (scope == null || scope.isBlank()) throw new IllegalStateException("scope is required");
      if (refreshPolicy == null) throw new IllegalStateException("refreshPolicy cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      final var lifetime = tokenSource.tokenLifetime();
      if (lifetime.isPresent() && refreshPolicy.successInterval().compareTo(lifetime.get()) >= 0)
        throw new IllegalStateException(
            "successInterval %s must be shorter than the token lifetime %s"
                .formatted(refreshPolicy.successInterval(), lifetime.get()));
      return new CredentialCache(this);
    }
  }

  /**
   * Starts the background refresh loop with an immediate fetch. Calling it again has no effect.
   *
   * @throws IllegalStateException if the cache was closed
   */
  public void start() {
    if (closed) throw new IllegalStateException("CredentialCache is closed");
    if (started.compareAndSet(false, true)) {
      logger.log(INFO, "Starting credential refresh for scope {0}", scope);
      scheduleRefresh(Duration.ZERO);
    }
  }

  @Override
  public String currentPassword() {
    final var cached = current.get();
    if (cached != null) return serve(cached);

    fetchLock.lock();
    try {
      final var fetchedMeanwhile = current.get();
      if (fetchedMeanwhile != null) return serve(fetchedMeanwhile);

      final var failure = lastFailure.get();
      if (failure != null && !retryDueOnRead(failure))
        throw new CredentialFetchException(
            scope,
            "No credential for scope %s, last fetch failed at %s"
                .formatted(scope, failure.failedAt()),
            failure.error());

      logger.log(DEBUG, "No cached credential for scope {0}, fetching synchronously", scope);
      return store(fetchRecordingFailure()).token();
    } finally {
      fetchLock.unlock();
    }
  }

  /** The cached credential, if any fetch has succeeded. */
  public Optional<Credential> current() {
    return Optional.ofNullable(current.get());
  }

  public String scope() {
    return scope;
  }

  public RefreshPolicy refreshPolicy() {
    return refreshPolicy;
  }

  /** Stops the refresh loop. The last cached credential stays readable. */
  @Override
  public void close() {
    closed = true;
    Optional.ofNullable(pendingRefresh.getAndSet(null)).ifPresent(DelayScheduler.Handle::cancel);
    if (ownsScheduler) scheduler.close();
    logger.log(INFO, "Stopped credential refresh for scope {0}", scope);
  }

  /** One iteration of the background loop. Never throws. */
  void refresh() {
    if (closed) return;

    Duration next;
    fetchLock.lock();
    try {
      final var fresh = store(fetchRecordingFailure());
      next = refreshPolicy.successInterval();
      logger.log(
          INFO,
          "Refreshed credential for scope {0}, valid until {1}, next refresh in {2}",
          scope,
          fresh.expiresAt(),
          next);
    } catch (final CredentialFetchException e) {
      next = refreshPolicy.failureInterval();
      logger.log(
          WARNING,
          "Credential refresh for scope %s failed, retrying in %s".formatted(scope, next),
          e);
    } finally {
      fetchLock.unlock();
    }
    scheduleRefresh(next);
  }

  private Credential store(final Credential fresh) {
    current.set(fresh);
    lastFailure.set(null);
    return fresh;
  }

  private Credential fetchRecordingFailure() {
    try {
      return fetch();
    } catch (final CredentialFetchException e) {
      lastFailure.set(new FailedFetch(e, clock.instant()));
      throw e;
    }
  }

  private boolean retryDueOnRead(final FailedFetch failure) {
    if (started.get()) return false;
    return !clock.instant().isBefore(failure.failedAt().plus(refreshPolicy.failureInterval()));
  }

  private Credential fetch() {
    try {
      final var credential = tokenSource.fetch(scope);
      if (credential == null)
        throw new CredentialFetchException(scope, "Token source returned no credential");
      return credential;
    } catch (final CredentialFetchException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new CredentialFetchException(scope, e);
    }
  }

  private String serve(final Credential credential) {
    if (credential.isExpired(clock.instant()) && reportedExpired.getAndSet(credential) != credential)
      logger.log(
          WARNING,
          "Serving expired credential for scope {0} (expired {1}), refresh has not succeeded yet",
          scope,
          credential.expiresAt());
    return credential.token();
  }

  private void scheduleRefresh(final Duration delay) {
    if (closed) return;
    final var handle = scheduler.schedule(this::refresh, delay);
    pendingRefresh.set(handle);
    if (closed) handle.cancel();
  }

  private record FailedFetch(CredentialFetchException error, Instant failedAt) {}

  @Override
  public String toString() {
    return "CredentialCache[scope=%s, credential=%s]"
        .formatted(scope, Objects.toString(current.get(), "none"));
  }
}
