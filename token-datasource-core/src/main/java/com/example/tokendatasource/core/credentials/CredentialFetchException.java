package com.example.tokendatasource.core.credentials;

/** Raised when a {@link TokenSource} cannot issue a token. */
public class CredentialFetchException extends RuntimeException {

  private final String scope;

  public CredentialFetchException(final String scope, final String message) {
    super(message);
    this.scope = scope;
  }

  public CredentialFetchException(final String scope, final Throwable cause) {
    super("Failed to fetch credential for scope " + scope + ": " + cause.getMessage(), cause);
    this.scope = scope;
  }

  public CredentialFetchException(final String scope, final String message, final Throwable cause) {
    super(message, cause);
    this.scope = scope;
  }

  public String scope() {
    return scope;
  }
}
