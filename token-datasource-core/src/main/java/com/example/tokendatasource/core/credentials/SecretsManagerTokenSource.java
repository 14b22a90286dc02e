package com.example.tokendatasource.core.credentials;

import com.example.tokendatasource.core.secrets.DatabaseSecret;
import com.example.tokendatasource.core.secrets.SecretsManagerProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * {@link TokenSource} that reads the {@code password} field of a JSON database secret in AWS
 * Secrets Manager. The scope is the secret id.
 *
 * <p>Secrets Manager does not report an expiry, so each credential is treated as valid for a fixed
 * time-to-live after it was read.
 */
public final class SecretsManagerTokenSource implements TokenSource {

  public static final Duration DEFAULT_TTL = Duration.ofHours(1);

  private final ObjectMapper mapper;
  private final Duration ttl;
  private final Clock clock;

  public SecretsManagerTokenSource() {
    this(new ObjectMapper(), DEFAULT_TTL, Clock.systemUTC());
  }

  public SecretsManagerTokenSource(final ObjectMapper mapper, final Duration ttl, final Clock clock) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");
  }

  @Override
  public Credential fetch(final String secretId) {
    final String raw;
    try {
      raw = SecretsManagerProvider.getSecret(secretId);
    } catch (final SdkException e) {
      throw new CredentialFetchException(secretId, e);
    }

    final DatabaseSecret secret;
    try {
      secret = mapper.readValue(raw, DatabaseSecret.class);
    } catch (final JsonProcessingException e) {
      throw new CredentialFetchException(secretId, "Secret is not a valid database secret", e);
    }
    if (secret.password() == null || secret.password().isBlank())
      throw new CredentialFetchException(secretId, "Secret has no password field");

    final var now = clock.instant();
    return new Credential(secret.password(), now, now.plus(ttl));
  }
}
