package com.example.tokendatasource.core.jdbc;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Objects;

/**
 * {@link javax.sql.DataSource} view of a {@link TokenConnectionFactory}, for consumers that only
 * accept a DataSource: connection pools, ORMs and the job lock storage.
 *
 * <pre>{@code
 * var config = new HikariConfig();
 * config.setDataSource(new TokenDataSource(ormFactory));
 * var pool = new HikariDataSource(config);
 * }</pre>
 */
public final class TokenDataSource implements javax.sql.DataSource {

  private final TokenConnectionFactory factory;
  private volatile PrintWriter logWriter;
  private volatile int loginTimeout;

  public TokenDataSource(final TokenConnectionFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return factory.getConnection();
  }

  @Override
  public Connection getConnection(final String username, final String password) {
    throw new UnsupportedOperationException(
        "Credentials are managed by the TokenConnectionFactory");
  }

  public TokenConnectionFactory factory() {
    return factory;
  }

  @Override
  public PrintWriter getLogWriter() {
    return logWriter;
  }

  @Override
  public void setLogWriter(final PrintWriter out) {
    this.logWriter = out;
  }

  @Override
  public void setLoginTimeout(final int seconds) {
    this.loginTimeout = seconds;
  }

  @Override
  public int getLoginTimeout() {
    return loginTimeout;
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    throw new SQLFeatureNotSupportedException("TokenDataSource logs through System.Logger");
  }

  @Override
  public <T> T unwrap(final Class<T> clazz) throws SQLException {
    if (clazz.isInstance(this)) return clazz.cast(this);
    throw new SQLException("Not a wrapper for " + clazz.getName());
  }

  @Override
  public boolean isWrapperFor(final Class<?> iface) {
    return iface.isInstance(this);
  }

  @Override
  public String toString() {
    return "TokenDataSource[" + factory.name() + "]";
  }
}
