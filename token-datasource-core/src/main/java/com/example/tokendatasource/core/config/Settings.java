package com.example.tokendatasource.core.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Typed access to configuration values supplied via system properties or environment variables.
 *
 * <p>A property such as {@code credential.refresh.success-interval} is looked up first as a system
 * property, then as the environment variable {@code CREDENTIAL_REFRESH_SUCCESS_INTERVAL}. Blank
 * values count as absent.
 *
 * <p>Malformed values are startup misconfiguration and fail with {@link IllegalArgumentException}
 * instead of silently falling back to a default.
 */
public final class Settings {

  private Settings() {}

  /**
   * Looks up a raw value.
   *
   * @param property dotted property name
   * @return trimmed value if present and non-blank
   */
  public static Optional<String> lookup(final String property) {
    return lookup(property, envName(property));
  }

  /**
   * Looks up a raw value whose environment variable does not follow the derived naming.
   *
   * @param property dotted property name
   * @param envVar environment variable consulted when the property is absent
   * @return trimmed value if present and non-blank
   */
  public static Optional<String> lookup(final String property, final String envVar) {
    return Optional.ofNullable(System.getProperty(property))
        .filter(value -> !value.isBlank())
        .or(() -> Optional.ofNullable(System.getenv(envVar)))
        .map(String::trim)
        .filter(value -> !value.isBlank());
  }

  public static String string(final String property, final String defaultValue) {
    return lookup(property).orElse(defaultValue);
  }

  /**
   * Looks up a mandatory value.
   *
   * @throws IllegalStateException if neither the property nor the environment variable is set
   */
  public static String required(final String property) {
    return lookup(property)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "Missing configuration: set system property %s or environment variable %s"
                        .formatted(property, envName(property))));
  }

  public static int integer(final String property, final int defaultValue) {
    return lookup(property)
        .map(
            value -> {
              try {
                return Integer.parseInt(value);
              } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid integer for %s: %s".formatted(property, value), e);
              }
            })
        .orElse(defaultValue);
  }

  public static boolean bool(final String property, final boolean defaultValue) {
    return lookup(property)
        .map(
            value -> {
              if ("true".equalsIgnoreCase(value)) return true;
              if ("false".equalsIgnoreCase(value)) return false;
              throw new IllegalArgumentException(
                  "Invalid boolean for %s: %s".formatted(property, value));
            })
        .orElse(defaultValue);
  }

  /**
   * Looks up a duration, written either as ISO-8601 ({@code PT4H}) or as whole seconds.
   *
   * @param property dotted property name
   * @param defaultValue value used when the property is absent
   * @return parsed duration
   */
  public static Duration duration(final String property, final Duration defaultValue) {
    return lookup(property).map(value -> parseDuration(property, value)).orElse(defaultValue);
  }

  static Duration parseDuration(final String property, final String value) {
    try {
      if (value.startsWith("P") || value.startsWith("p")) return Duration.parse(value);
      return Duration.ofSeconds(Long.parseLong(value));
    } catch (final DateTimeParseException | NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid duration for %s: %s".formatted(property, value), e);
    }
  }

  static String envName(final String property) {
    return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }
}
