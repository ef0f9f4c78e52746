package com.example.ghostmysql.core.config;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;

/**
 * Lazily configured AWS Secrets Manager client used by {@link SecretsManagerConfigStore}.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 */
public final class SecretsManagerProvider {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerProvider.class.getName());

  private static volatile SecretsManagerClient client;

  static {
    Runtime.getRuntime().addShutdownHook(new Thread(SecretsManagerProvider::resetClient));
  }

  private SecretsManagerProvider() {}

  /** Closes the current client; the next access builds a new one with the current settings. */
  public static synchronized void resetClient() {
    Optional.ofNullable(client)
        .ifPresent(
            c -> {
              try {
                c.close();
              } catch (final RuntimeException e) {
                LOGGER.log(System.Logger.Level.DEBUG, "Failed to close Secrets Manager client", e);
              }
            });
    client = null;
  }

  private static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder();

    final var region =
        Optional.ofNullable(System.getProperty("aws.region"))
            .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
            .map(Region::of)
            .orElse(Region.US_EAST_1);
    builder.region(region);

    Optional.ofNullable(System.getProperty("aws.sm.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")))
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    Optional.ofNullable(System.getProperty("aws.accessKeyId", System.getenv("AWS_ACCESS_KEY_ID")))
        .flatMap(
            accessKey ->
                Optional.ofNullable(
                        System.getProperty(
                            "aws.secretAccessKey", System.getenv("AWS_SECRET_ACCESS_KEY")))
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.create()));

    return builder.build();
  }

  static synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  /**
   * Reads the current secret string.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public static String getSecret(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    return getClient().getSecretValue(request).secretString();
  }

  /**
   * Stores a new version of the secret.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @param secretString new secret payload
   * @return version id of the stored value
   */
  public static String putSecret(final String secretId, final String secretString) {
    final var request =
        PutSecretValueRequest.builder().secretId(secretId).secretString(secretString).build();
    return getClient().putSecretValue(request).versionId();
  }
}
