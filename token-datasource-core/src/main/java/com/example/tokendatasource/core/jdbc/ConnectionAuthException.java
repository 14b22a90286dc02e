package com.example.tokendatasource.core.jdbc;

import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;

/**
 * The database rejected the credential presented when opening a connection, typically because a
 * token expired between refreshes or the server is still provisioning the identity.
 *
 * <p>Never retried by {@link TokenConnectionFactory}; callers retry at the operation or job level.
 */
public class ConnectionAuthException extends SQLInvalidAuthorizationSpecException {

  public ConnectionAuthException(final String factoryName, final SQLException cause) {
    super(
        "Authentication rejected for connection factory %s: %s"
            .formatted(factoryName, cause.getMessage()),
        cause.getSQLState() == null ? "28000" : cause.getSQLState(),
        cause.getErrorCode(),
        cause);
  }
}
