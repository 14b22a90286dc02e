package com.example.tokendatasource.core.credentials;

import com.example.tokendatasource.core.config.Settings;
import java.time.Duration;
import java.util.Objects;

/**
 * Cadence of the background credential refresh.
 *
 * @param successInterval delay before the next fetch after a successful one
 * @param failureInterval delay before retrying after a failed fetch; strictly shorter than
 *     {@code successInterval}
 */
public record RefreshPolicy(Duration successInterval, Duration failureInterval) {

  public static final Duration DEFAULT_SUCCESS_INTERVAL = Duration.ofHours(4);
  public static final Duration DEFAULT_FAILURE_INTERVAL = Duration.ofSeconds(10);

  public RefreshPolicy {
    Objects.requireNonNull(successInterval, "successInterval");
    Objects.requireNonNull(failureInterval, "failureInterval");
    if (successInterval.isNegative() || successInterval.isZero())
      throw new IllegalArgumentException("successInterval must be positive");
    if (failureInterval.isNegative() || failureInterval.isZero())
      throw new IllegalArgumentException("failureInterval must be positive");
    if (failureInterval.compareTo(successInterval) >= 0)
      throw new IllegalArgumentException("failureInterval must be shorter than successInterval");
  }

  /** 4 hours after success, 10 seconds after failure. */
  public static RefreshPolicy defaults() {
    return new RefreshPolicy(DEFAULT_SUCCESS_INTERVAL, DEFAULT_FAILURE_INTERVAL);
  }

  /**
   * Reads {@code credential.refresh.success-interval} and {@code
   * credential.refresh.failure-interval}, falling back to {@link #defaults()}.
   */
  public static RefreshPolicy fromEnvironment() {
    return fromEnvironment(DEFAULT_SUCCESS_INTERVAL);
  }

  /** Same as {@link #fromEnvironment()}, with a different success interval default. */
  public static RefreshPolicy fromEnvironment(final Duration defaultSuccessInterval) {
    return new RefreshPolicy(
        Settings.duration("credential.refresh.success-interval", defaultSuccessInterval),
        Settings.duration("credential.refresh.failure-interval", DEFAULT_FAILURE_INTERVAL));
  }
}
