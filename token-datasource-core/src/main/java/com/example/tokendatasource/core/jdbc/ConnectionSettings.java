package com.example.tokendatasource.core.jdbc;

import com.example.tokendatasource.core.config.Settings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Static connection parameters. The password is optional: leaving it unset means passwords come
 * from a token-backed {@link com.example.tokendatasource.core.credentials.PasswordProvider};
 * setting it disables token refresh entirely.
 *
 * <pre>{@code
 * var settings = ConnectionSettings.builder()
 *     .host("mydb.cluster-abc.us-east-1.rds.amazonaws.com")
 *     .port(5432)
 *     .database("app")
 *     .username("app_user")
 *     .property("sslmode", "require")
 *     .build();
 * }</pre>
 */
public final class ConnectionSettings {

  public static final String DEFAULT_URL_PREFIX = "jdbc:postgresql://";
  public static final int DEFAULT_PORT = 5432;

  private final String urlPrefix;
  private final String host;
  private final int port;
  private final String database;
  private final String username;
  private final String password;
  private final Map<String, String> properties;

  private ConnectionSettings(final Builder builder) {
    this.urlPrefix = builder.urlPrefix;
    this.host = builder.host;
    this.port = builder.port;
    this.database = builder.database;
    this.username = builder.username;
    this.password = builder.password;
    this.properties = Map.copyOf(builder.properties);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads {@code db.host}, {@code db.port}, {@code db.name}, {@code db.user} and the optional
   * {@code db.password} from system properties or environment variables.
   *
   * @throws IllegalStateException if a mandatory value is missing
   * @throws IllegalArgumentException if a value is malformed
   */
  public static ConnectionSettings fromEnvironment() {
    final var builder =
        builder()
            .host(Settings.required("db.host"))
            .port(Settings.integer("db.port", DEFAULT_PORT))
            .database(Settings.required("db.name"))
            .username(Settings.required("db.user"))
            .urlPrefix(Settings.string("db.url-prefix", DEFAULT_URL_PREFIX));
    Settings.lookup("db.password").ifPresent(builder::password);
    Settings.lookup("db.sslmode").ifPresent(mode -> builder.property("sslmode", mode));
    return builder.build();
  }

  /** Builder for {@link ConnectionSettings}. */
  public static class Builder {
    private String urlPrefix = DEFAULT_URL_PREFIX;
    private String host;
    private int port = DEFAULT_PORT;
    private String database;
    private String username;
    private String password;
    private final Map<String, String> properties = new LinkedHashMap<>();

    private Builder() {}

    /** JDBC URL prefix including the sub-protocol. Default: {@value ConnectionSettings#DEFAULT_URL_PREFIX} */
    public Builder urlPrefix(final String urlPrefix) {
      this.urlPrefix = urlPrefix;
      return this;
    }

    public Builder host(final String host) {
      this.host = host;
      return this;
    }

    public Builder port(final int port) {
      this.port = port;
      return this;
    }

    public Builder database(final String database) {
      this.database = database;
      return this;
    }

    public Builder username(final String username) {
      this.username = username;
      return this;
    }

    /** Explicit password. When set, no token is ever fetched for connections built from here. */
    public Builder password(final String password) {
      this.password = password;
      return this;
    }

    /** Extra driver property, e.g. {@code sslmode=require}. */
    public Builder property(final String key, final String value) {
      if ("user".equals(key) || "password".equals(key))
        throw new IllegalArgumentException("user and password are not driver properties here");
      properties.put(key, value);
      return this;
    }

    /**
     * Builds the settings.
     *
     * @throws IllegalArgumentException if a parameter is missing or out of range
     */
    public ConnectionSettings build() {
      if (urlPrefix == null || !urlPrefix.startsWith("jdbc:"))
        throw new IllegalArgumentException("urlPrefix must start with jdbc:");
      if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
      if (port < 1 || port > 65_535)
        throw new IllegalArgumentException("port must be between 1 and 65535");
      if (database == null || database.isBlank())
        throw new IllegalArgumentException("database is required");
      if (username == null || username.isBlank())
        throw new IllegalArgumentException("username is required");
      if (password != null && password.isEmpty())
        throw new IllegalArgumentException("password must not be empty when set");
      return new ConnectionSettings(this);
    }
  }

  public String jdbcUrl() {
    return "%s%s:%d/%s".formatted(urlPrefix, host, port, database);
  }

  /** Database endpoint as {@code host:port}, the scope RDS IAM tokens are issued for. */
  public String endpoint() {
    return host + ":" + port;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String database() {
    return database;
  }

  public String username() {
    return username;
  }

  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  public Map<String, String> properties() {
    return properties;
  }

  /** Driver properties with the user set and the password slot still empty. */
  Properties driverProperties() {
    final var props = new Properties();
    props.putAll(properties);
    props.setProperty("user", username);
    return props;
  }

  @Override
  public String toString() {
    return "ConnectionSettings[url=%s, user=%s, password=%s]"
        .formatted(jdbcUrl(), username, password == null ? "<token>" : "***");
  }
}
