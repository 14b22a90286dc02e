package com.example.tokendatasource.core.credentials;

import java.time.Duration;
import java.util.Optional;

/**
 * Issues short-lived bearer tokens for a resource scope.
 *
 * <p>Implementations perform network I/O and may be slow. Callers outside {@link CredentialCache}
 * should not invoke them on connection-opening paths.
 */
@FunctionalInterface
public interface TokenSource {

  /**
   * Fetches a fresh token.
   *
   * @param scope audience the token must be valid for, passed through unchanged
   * @return a new credential
   * @throws CredentialFetchException if no token could be issued
   */
  Credential fetch(final String scope);

  /**
   * How long an issued token is accepted, when the source knows it. A {@link CredentialCache} over
   * this source refuses a {@link RefreshPolicy} that would refresh less often.
   */
  default Optional<Duration> tokenLifetime() {
    return Optional.empty();
  }
}
