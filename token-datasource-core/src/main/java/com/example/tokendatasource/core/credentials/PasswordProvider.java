package com.example.tokendatasource.core.credentials;

import java.util.Objects;

/** Supplies the password used when a database connection is opened. */
@FunctionalInterface
public interface PasswordProvider {

  /**
   * Returns the password to present right now.
   *
   * @throws CredentialFetchException if no password is available yet
   */
  String currentPassword();

  /**
   * Password provider for an explicitly configured, never-changing password.
   *
   * @param password the static password
   * @return provider that always returns {@code password}
   */
  static PasswordProvider fixed(final String password) {
    Objects.requireNonNull(password, "password");
    return () -> password;
  }
}
