package com.example.tokendatasource.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.tokendatasource.core.credentials.CredentialFetchException;
import com.example.tokendatasource.core.credentials.PasswordProvider;
import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Opens database connections with the password that is current at the moment of the call.
 *
 * <p>The URL and driver properties are fixed at construction; the password is asked from the
 * {@link PasswordProvider} on every {@link #getConnection()}, so a refreshed token is picked up by
 * the next connection without rebuilding anything.
 *
 * <pre>{@code
 * var jobsFactory = TokenConnectionFactory.builder()
 *     .name("jobs")
 *     .settings(settings)
 *     .passwordProvider(credentialCache)
 *     .setupHook(ConnectionSetupHook.execute("SET application_name = 'jobs'"))
 *     .build();
 * }</pre>
 *
 * <p>Connection failures are not retried here. A rejected credential surfaces as {@link
 * ConnectionAuthException}; a password that cannot be obtained at all surfaces as {@link
 * SQLTransientConnectionException}.
 */
public final class TokenConnectionFactory {

  private static final Logger logger = System.getLogger(TokenConnectionFactory.class.getName());

  private final String name;
  private final ConnectionSettings settings;
  private final PasswordProvider passwordProvider;
  private final ConnectionSetupHook setupHook;
  private final ConnectionOpener opener;

  private TokenConnectionFactory(final Builder builder) {
    this.name = builder.name;
    this.settings = builder.settings;
    this.passwordProvider = builder.passwordProvider;
    this.setupHook = builder.setupHook;
    this.opener = builder.opener;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link TokenConnectionFactory}. */
  public static class Builder {
    private String name = "default";
    private ConnectionSettings settings;
    private PasswordProvider passwordProvider;
    private ConnectionSetupHook setupHook = ConnectionSetupHook.NONE;
    private ConnectionOpener opener = ConnectionOpener.driverManager();

    private Builder() {}

    /** Name used in logs and error messages. Default: {@code default} */
    public Builder name(final String name) {
      this.name = name;
      return this;
    }

    /** Sets the static connection parameters (required). */
    public Builder settings(final ConnectionSettings settings) {
      this.settings = settings;
      return this;
    }

    /** Sets where passwords come from (required). */
    public Builder passwordProvider(final PasswordProvider passwordProvider) {
      this.passwordProvider = passwordProvider;
      return this;
    }

    /** Setup applied to each new connection before it is returned. */
    public Builder setupHook(final ConnectionSetupHook setupHook) {
      this.setupHook = setupHook;
      return this;
    }

    /** Raw driver call. Default: {@link ConnectionOpener#driverManager()} */
    public Builder opener(final ConnectionOpener opener) {
      this.opener = opener;
      return this;
    }

    /**
     * Builds the factory.
     *
     * @throws IllegalStateException if required fields are not set
     */
    public TokenConnectionFactory build() {
      if (name == null || name.isBlank()) throw new IllegalStateException("name is required");
      if (settings == null) throw new IllegalStateException("settings is required");
      if (passwordProvider == null) throw new IllegalStateException("passwordProvider is required");
      if (setupHook == null) throw new IllegalStateException("setupHook cannot be null");
      if (opener == null) throw new IllegalStateException("opener cannot be null");
      return new TokenConnectionFactory(this);
    }
  }

  /**
   * Opens a new connection and applies the setup hook.
   *
   * @return an open connection owned by the caller
   * @throws ConnectionAuthException if the database rejected the credential
   * @throws SQLTransientConnectionException if no password could be obtained
   * @throws SQLException on any other failure opening or preparing the connection
   */
  public Connection getConnection() throws SQLException {
    final var properties = settings.driverProperties();
    properties.setProperty("password", currentPassword());

    final Connection connection;
    try {
      connection = opener.open(settings.jdbcUrl(), properties);
    } catch (final SQLException e) {
      if (AuthErrors.isAuthError(e)) throw new ConnectionAuthException(name, e);
      throw e;
    }

    try {
      setupHook.apply(connection);
    } catch (final SQLException | RuntimeException e) {
      closeAfterFailure(connection, e);
      throw e;
    }

    logger.log(DEBUG, "Opened connection for factory {0}", name);
    return connection;
  }

  public String name() {
    return name;
  }

  public ConnectionSettings settings() {
    return settings;
  }

  private String currentPassword() throws SQLTransientConnectionException {
    try {
      return passwordProvider.currentPassword();
    } catch (final CredentialFetchException e) {
      throw new SQLTransientConnectionException(
          "No credential available for connection factory " + name, "08001", e);
    }
  }

  private static void closeAfterFailure(final Connection connection, final Exception failure) {
    try {
      connection.close();
    } catch (final SQLException closeFailure) {
      failure.addSuppressed(closeFailure);
    }
  }
}
