package com.example.tokendatasource.core.jdbc;

import java.sql.SQLException;
import java.util.Locale;

/** Classifies {@link SQLException}s caused by rejected credentials. */
public final class AuthErrors {

  private static final String[] AUTH_KEYWORDS =
      new String[] {
        "access denied",
        "authentication failed",
        "password authentication failed",
        "pam authentication failed",
        "invalid password"
      };

  private AuthErrors() {}

  /**
   * Detects authentication errors based on exception type, SQLState and message patterns.
   *
   * <p>Checks {@link ConnectionAuthException}, SQLState class 28 (invalid authorization
   * specification), and common auth error keywords, across the cause chain and chained exceptions.
   * Privilege errors on an authenticated session, such as SQLState 42501, are not auth errors.
   *
   * @param t the throwable to check
   * @return true if any SQLException in the chain is an authentication error
   */
  public static boolean isAuthError(final Throwable t) {
    Throwable cur = t;
    while (cur != null) {
      if (cur instanceof SQLException sql) {
        for (SQLException e = sql; e != null; e = e.getNextException()) {
          if (matches(e)) return true;
        }
      }
      cur = cur.getCause();
    }
    return false;
  }

  private static boolean matches(final SQLException e) {
    if (e instanceof ConnectionAuthException) return true;

    final var state = e.getSQLState();
    if (state != null && state.startsWith("28")) return true;

    final var msg = e.getMessage();
    if (msg == null) return false;
    final var lower = msg.toLowerCase(Locale.ROOT);
    for (final var keyword : AUTH_KEYWORDS) if (lower.contains(keyword)) return true;
    return false;
  }
}
