package com.example.tokendatasource.core.credentials;

import com.example.tokendatasource.core.secrets.SecretsManagerProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.rds.RdsUtilities;
import software.amazon.awssdk.services.rds.model.GenerateAuthenticationTokenRequest;

/**
 * {@link TokenSource} issuing RDS IAM database authentication tokens.
 *
 * <p>The scope is the database endpoint as {@code host:port}. Tokens are signed locally with the
 * default AWS credentials chain and are accepted for 15 minutes, so pair this source with a
 * {@link RefreshPolicy} whose success interval is shorter than that, such as {@link
 * #REFRESH_INTERVAL}.
 */
public final class RdsIamTokenSource implements TokenSource {

  static final Duration TOKEN_LIFETIME = Duration.ofMinutes(15);

  /** Success interval leaving a five minute margin before a token stops being accepted. */
  public static final Duration REFRESH_INTERVAL = Duration.ofMinutes(10);

  private final RdsUtilities utilities;
  private final String username;
  private final Clock clock;

  /**
   * Creates a token source using the region from {@code aws.region} and the default credentials
   * chain.
   *
   * @param username database user mapped to an IAM identity
   */
  public RdsIamTokenSource(final String username) {
    this(
        RdsUtilities.builder()
            .region(SecretsManagerProvider.region())
            .credentialsProvider(DefaultCredentialsProvider.builder().build())
            .build(),
        username,
        Clock.systemUTC());
  }

  public RdsIamTokenSource(final RdsUtilities utilities, final String username, final Clock clock) {
    this.utilities = Objects.requireNonNull(utilities, "utilities");
    this.username = Objects.requireNonNull(username, "username");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<Duration> tokenLifetime() {
    return Optional.of(TOKEN_LIFETIME);
  }

  @Override
  public Credential fetch(final String scope) {
    final var separator = scope.lastIndexOf(':');
    if (separator <= 0 || separator == scope.length() - 1)
      throw new CredentialFetchException(scope, "Scope must be an endpoint of the form host:port");

    final int port;
    try {
      port = Integer.parseInt(scope.substring(separator + 1));
    } catch (final NumberFormatException e) {
      throw new CredentialFetchException(scope, "Scope has an invalid port", e);
    }

    final var request =
        GenerateAuthenticationTokenRequest.builder()
            .hostname(scope.substring(0, separator))
            .port(port)
            .username(username)
            .build();

    try {
      final var now = clock.instant();
      final var token = utilities.generateAuthenticationToken(request);
      return new Credential(token, now, now.plus(TOKEN_LIFETIME));
    } catch (final SdkException e) {
      throw new CredentialFetchException(scope, e);
    }
  }
}
