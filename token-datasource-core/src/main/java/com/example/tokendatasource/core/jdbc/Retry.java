package com.example.tokendatasource.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Caller-side retry for JDBC work.
 *
 * <p>{@link TokenConnectionFactory} never retries; applications and jobs use this helper when an
 * operation should survive a credential that went stale between refreshes.
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Supplier that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlExceptionSupplier<T> {
    T get() throws SQLException;
  }

  /**
   * Executes the supplier up to {@code maxAttempts} times with a fixed delay between attempts.
   *
   * <h3>Retry on Authentication Failures</h3>
   *
   * <pre>{@code
   * String now = Retry.onException(
   *     () -> queryNow(dataSource),
   *     AuthErrors::isAuthError,
   *     () -> {},
   *     3,
   *     Duration.ofSeconds(5));
   * }</pre>
   *
   * @param supplier operation to execute
   * @param shouldRetry predicate determining whether the exception is retryable
   * @param beforeRetry hook run before each retry attempt (not before the first attempt)
   * @param maxAttempts total attempts including the first (must be >= 1)
   * @param delay delay between attempts (non-negative)
   * @param <T> result type
   * @return the supplier result
   * @throws SQLException the last failure if all attempts fail or the failure is not retryable
   */
  public static <T> T onException(
      final SqlExceptionSupplier<T> supplier,
      final Predicate<? super SQLException> shouldRetry,
      final Runnable beforeRetry,
      final int maxAttempts,
      final Duration delay)
      throws SQLException {
    if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    if (delay == null || delay.isNegative())
      throw new IllegalArgumentException("delay must be non-negative");
    var attempt = 0;

    while (true) {
      attempt++;
      try {
        return supplier.get();
      } catch (final SQLException ex) {
        if (!shouldRetry.test(ex) || attempt >= maxAttempts) throw ex;

        LOGGER.log(DEBUG, "Attempt {0} failed, retrying...", attempt);
        beforeRetry.run();

        if (!delay.isZero()) {
          try {
            Thread.sleep(delay.toMillis());
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ex;
          }
        }
      }
    }
  }
}
