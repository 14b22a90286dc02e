package com.example.tokendatasource.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import javax.sql.DataSource;

/**
 * Thin database client that runs operations on connections from a {@link DataSource} and retries
 * when the credential was rejected.
 *
 * @param dataSource source of connections, typically a pool over a {@link TokenDataSource}
 */
public record DbClient(DataSource dataSource) {

  /**
   * Executes a database operation once.
   *
   * @param operation unit of work using an open {@link Connection}
   * @param <T> return type
   * @return operation result
   * @throws SQLException if opening the connection or executing the work fails
   */
  public <T> T execute(final DbOperation<T> operation) throws SQLException {
    try (final var conn = dataSource.getConnection()) {
      return operation.execute(conn);
    }
  }

  /**
   * Executes a database operation, retrying on authentication errors so that a token refreshed in
   * the meantime is picked up by the next attempt.
   *
   * @param operation the database operation to run with an open {@link Connection}
   * @param maxAttempts total attempts including the first
   * @param delay pause between attempts
   * @param <T> the operation result type
   * @return the value returned by the operation
   * @throws SQLException if the operation fails (after retries if applicable)
   */
  public <T> T executeWithRetry(
      final DbOperation<T> operation, final int maxAttempts, final Duration delay)
      throws SQLException {
    return Retry.onException(
        () -> execute(operation), AuthErrors::isAuthError, () -> {}, maxAttempts, delay);
  }

  /**
   * Database operation executed against an open {@link Connection}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface DbOperation<T> {
    T execute(final Connection conn) throws SQLException;
  }
}
