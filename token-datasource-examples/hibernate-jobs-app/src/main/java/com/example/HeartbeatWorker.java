package com.example;

import static java.lang.System.Logger.Level.INFO;

import com.example.tokendatasource.core.jdbc.DbClient;
import com.example.tokendatasource.core.scheduling.RecurringWorker;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the database clock once per tick. A stale credential between refreshes is retried here,
 * at the job level; anything else fails the tick and the job runs again at the next one.
 */
public final class HeartbeatWorker implements RecurringWorker {

  private static final System.Logger LOGGER = System.getLogger(HeartbeatWorker.class.getName());

  private final DbClient client;
  private final int maxAttempts;
  private final Duration retryDelay;
  private volatile Instant lastHeartbeat;

  public HeartbeatWorker(final DbClient client, final int maxAttempts, final Duration retryDelay) {
    this.client = Objects.requireNonNull(client, "client");
    this.maxAttempts = maxAttempts;
    this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
  }

  @Override
  public void doWork() throws SQLException {
    final var now =
        client.executeWithRetry(
            conn -> {
              try (final var st = conn.createStatement();
                  final var rs = st.executeQuery("SELECT now()")) {
                if (!rs.next()) throw new SQLException("SELECT now() returned no row");
                final Timestamp ts = rs.getTimestamp(1);
                return ts.toInstant();
              }
            },
            maxAttempts,
            retryDelay);

    lastHeartbeat = now;
    LOGGER.log(INFO, "Heartbeat: database time is {0}", now);
  }

  /** Database time observed by the last successful tick. */
  public Optional<Instant> lastHeartbeat() {
    return Optional.ofNullable(lastHeartbeat);
  }
}
