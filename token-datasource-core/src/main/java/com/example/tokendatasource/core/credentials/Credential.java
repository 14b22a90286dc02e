package com.example.tokendatasource.core.credentials;

import java.time.Instant;
import java.util.Objects;

/**
 * A bearer token issued by a {@link TokenSource}.
 *
 * <p>Instances are immutable. A refresh never modifies a credential; it replaces it.
 *
 * @param token the token value, used verbatim as the database password
 * @param obtainedAt when the token was issued
 * @param expiresAt when the token stops being accepted
 */
public record Credential(String token, Instant obtainedAt, Instant expiresAt) {

  public Credential {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(obtainedAt, "obtainedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    if (token.isBlank()) throw new IllegalArgumentException("token must not be blank");
    if (expiresAt.isBefore(obtainedAt))
      throw new IllegalArgumentException("expiresAt must not precede obtainedAt");
  }

  public boolean isExpired(final Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "Credential[token=***, obtainedAt=%s, expiresAt=%s]".formatted(obtainedAt, expiresAt);
  }
}
