package com.example.tokendatasource.core.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Consumer-specific setup applied to a freshly opened connection before it is handed out, e.g.
 * session parameters or a search path.
 */
@FunctionalInterface
public interface ConnectionSetupHook {

  ConnectionSetupHook NONE = connection -> {};

  void apply(final Connection connection) throws SQLException;

  default ConnectionSetupHook andThen(final ConnectionSetupHook next) {
    return connection -> {
      apply(connection);
      next.apply(connection);
    };
  }

  /**
   * Hook executing one SQL statement on every new connection.
   *
   * @param sql statement such as {@code SET application_name = 'jobs'}
   */
  static ConnectionSetupHook execute(final String sql) {
    return connection -> {
      try (final var statement = connection.createStatement()) {
        statement.execute(sql);
      }
    };
  }
}
