package com.example.tokendatasource.core.secrets;

import static java.lang.System.Logger.Level.WARNING;

import com.example.tokendatasource.core.config.Settings;
import java.lang.System.Logger;
import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Lazily configured AWS Secrets Manager client.
 *
 * <p>Configuration via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 *
 * <p>Values are not cached here; {@link
 * com.example.tokendatasource.core.credentials.CredentialCache} decides how often secrets are
 * read.
 */
public final class SecretsManagerProvider {

  private static final Logger logger = System.getLogger(SecretsManagerProvider.class.getName());

  private static volatile SecretsManagerClient client;

  static {
    Runtime.getRuntime().addShutdownHook(new Thread(SecretsManagerProvider::closeClient));
  }

  private SecretsManagerProvider() {}

  /**
   * Retrieves the current secret string.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public static String getSecret(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    return getClient().getSecretValue(request).secretString();
  }

  /** Closes the current client; the next access builds a new one with current configuration. */
  public static synchronized void resetClient() {
    closeClient();
    client = null;
  }

  static synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  /** Region from {@code aws.region}, defaulting to us-east-1. */
  public static Region region() {
    return Settings.lookup("aws.region").map(Region::of).orElse(Region.US_EAST_1);
  }

  private static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder().region(region());

    Settings.lookup("aws.sm.endpoint").map(URI::create).ifPresent(builder::endpointOverride);

    Settings.lookup("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                Settings.lookup("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.builder().build()));

    return builder.build();
  }

  private static void closeClient() {
    Optional.ofNullable(client)
        .ifPresent(
            c -> {
              try {
                c.close();
              } catch (final RuntimeException e) {
                logger.log(WARNING, "Failed to close Secrets Manager client", e);
              }
            });
  }
}
