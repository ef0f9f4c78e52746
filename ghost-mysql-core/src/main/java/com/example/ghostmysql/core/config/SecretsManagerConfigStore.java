package com.example.ghostmysql.core.config;

import static java.lang.System.Logger.Level.DEBUG;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Configuration document kept as a JSON secret in AWS Secrets Manager.
 *
 * <p>The secret is read once on {@link #load(String)}; {@link #save()} stores the full document as
 * a new secret version.
 */
public final class SecretsManagerConfigStore extends AbstractJsonConfigStore {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerConfigStore.class.getName());

  private final String secretId;

  private SecretsManagerConfigStore(
      final ObjectMapper mapper, final ObjectNode root, final String secretId) {
    super(mapper, root);
    this.secretId = secretId;
  }

  /**
   * Reads the configuration secret.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return store backed by the secret
   * @throws RuntimeException if the secret cannot be fetched or parsed
   */
  public static SecretsManagerConfigStore load(final String secretId) {
    final var mapper = new ObjectMapper();
    final var root = parse(mapper, SecretsManagerProvider.getSecret(secretId));
    return new SecretsManagerConfigStore(mapper, root, secretId);
  }

  public String secretId() {
    return secretId;
  }

  @Override
  public void save() {
    final var versionId = SecretsManagerProvider.putSecret(secretId, render());
    LOGGER.log(DEBUG, "Stored configuration secret {0} as version {1}", secretId, versionId);
  }
}
