package com.example.tokendatasource.core;

import static java.lang.System.Logger.Level.INFO;

import com.example.tokendatasource.core.credentials.CredentialCache;
import com.example.tokendatasource.core.credentials.DelayScheduler;
import com.example.tokendatasource.core.credentials.PasswordProvider;
import com.example.tokendatasource.core.credentials.RefreshPolicy;
import com.example.tokendatasource.core.credentials.TokenSource;
import com.example.tokendatasource.core.jdbc.ConnectionOpener;
import com.example.tokendatasource.core.jdbc.ConnectionSettings;
import com.example.tokendatasource.core.jdbc.ConnectionSetupHook;
import com.example.tokendatasource.core.jdbc.TokenConnectionFactory;
import com.example.tokendatasource.core.jdbc.TokenDataSource;
import java.lang.System.Logger;
import java.util.Optional;

/**
 * Decides once, at construction, where database passwords come from, and hands out connection
 * factories that share that decision.
 *
 * <p>If {@link ConnectionSettings#password()} is set, every factory uses it and no token is ever
 * fetched: the {@link TokenSource} is not called and no refresh loop exists. Otherwise a single
 * {@link CredentialCache} is built and started, and every factory reads from it.
 *
 * <pre>{@code
 * var broker = CredentialBroker.builder()
 *     .settings(ConnectionSettings.fromEnvironment())
 *     .tokenSource(new RdsIamTokenSource("app_user"))
 *     .build();
 *
 * var ormDataSource = broker.dataSource("orm", ConnectionSetupHook.NONE);
 * var jobsDataSource = broker.dataSource("jobs", ConnectionSetupHook.execute("SET lock_timeout = '5s'"));
 * }</pre>
 */
public final class CredentialBroker implements AutoCloseable {

  private static final Logger logger = System.getLogger(CredentialBroker.class.getName());

  private final ConnectionSettings settings;
  private final ConnectionOpener opener;
  private final PasswordProvider passwordProvider;
  private final CredentialCache credentialCache;

  private CredentialBroker(final Builder builder) {
    this.settings = builder.settings;
    this.opener = builder.opener;

    final var staticPassword = settings.password();
    if (staticPassword.isPresent()) {
      logger.log(INFO, "Static password configured for {0}, token refresh disabled", settings);
      this.passwordProvider = PasswordProvider.fixed(staticPassword.get());
      this.credentialCache = null;
    } else {
      final var cacheBuilder =
          CredentialCache.builder()
              .tokenSource(builder.tokenSource)
              .scope(builder.tokenScope == null ? settings.endpoint() : builder.tokenScope)
              .refreshPolicy(builder.refreshPolicy);
      if (builder.scheduler != null) cacheBuilder.scheduler(builder.scheduler);
      this.credentialCache = cacheBuilder.build();
      this.passwordProvider = credentialCache;
      credentialCache.start();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link CredentialBroker}. */
  public static class Builder {
    private ConnectionSettings settings;
    private TokenSource tokenSource;
    private String tokenScope;
    private RefreshPolicy refreshPolicy = RefreshPolicy.defaults();
    private DelayScheduler scheduler;
    private ConnectionOpener opener = ConnectionOpener.driverManager();

    private Builder() {}

    /** Sets the connection parameters (required). */
    public Builder settings(final ConnectionSettings settings) {
      this.settings = settings;
      return this;
    }

    /** Sets the token source; required unless the settings carry a static password. */
    public Builder tokenSource(final TokenSource tokenSource) {
      this.tokenSource = tokenSource;
      return this;
    }

    /** Scope passed to the token source. Default: {@link ConnectionSettings#endpoint()} */
    public Builder tokenScope(final String tokenScope) {
      this.tokenScope = tokenScope;
      return this;
    }

    public Builder refreshPolicy(final RefreshPolicy refreshPolicy) {
      this.refreshPolicy = refreshPolicy;
      return this;
    }

    /** Scheduler for the refresh loop. Default: a dedicated daemon thread. */
    public Builder scheduler(final DelayScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public Builder opener(final ConnectionOpener opener) {
      this.opener = opener;
      return this;
    }

    /**
     * Builds the broker and, when no static password is configured, starts the token refresh.
     *
     * @throws IllegalStateException if required fields are not set
     */
    public CredentialBroker build() {
      if (settings == null) throw new IllegalStateException("settings is required");
      if (settings.password().isEmpty() && tokenSource == null)
        throw new IllegalStateException("tokenSource is required when no password is configured");
      if (refreshPolicy == null) throw new IllegalStateException("refreshPolicy cannot be null");
      if (opener == null) throw new IllegalStateException("opener cannot be null");
      return new CredentialBroker(this);
    }
  }

  /**
   * Creates an independent connection factory for one consumer.
   *
   * @param name consumer name used in logs
   * @param setupHook consumer-specific setup for each new connection
   */
  public TokenConnectionFactory connectionFactory(
      final String name, final ConnectionSetupHook setupHook) {
    return TokenConnectionFactory.builder()
        .name(name)
        .settings(settings)
        .passwordProvider(passwordProvider)
        .setupHook(setupHook)
        .opener(opener)
        .build();
  }

  /** {@link javax.sql.DataSource} over a new {@link #connectionFactory}. */
  public TokenDataSource dataSource(final String name, final ConnectionSetupHook setupHook) {
    return new TokenDataSource(connectionFactory(name, setupHook));
  }

  /** The shared cache, absent when a static password is configured. */
  public Optional<CredentialCache> credentialCache() {
    return Optional.ofNullable(credentialCache);
  }

  public PasswordProvider passwordProvider() {
    return passwordProvider;
  }

  public ConnectionSettings settings() {
    return settings;
  }

  /** Stops the token refresh, if any. */
  @Override
  public void close() {
    if (credentialCache != null) credentialCache.close();
  }
}
