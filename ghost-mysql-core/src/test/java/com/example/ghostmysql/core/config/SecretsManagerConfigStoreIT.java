package com.example.ghostmysql.core.config;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.net.URI;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledIfSystemProperty;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

@DisabledIfSystemProperty(named = "tests.integration.disable", matches = "true")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SecretsManagerConfigStoreIT {

  private static final String SECRET_ID = "it/ghost/config.production";

  private GenericContainer<?> localstack;
  private SecretsManagerClient smClient;

  @BeforeAll
  void startLocalstack() {
    assumeTrue(
        DockerClientFactory.instance().isDockerAvailable(), "Docker not available, skipping test");

    localstack =
        new GenericContainer<>(DockerImageName.parse("localstack/localstack:3"))
            .withExposedPorts(4566)
            .withEnv("SERVICES", "secretsmanager");
    localstack.start();

    final var endpoint = "http://" + localstack.getHost() + ":" + localstack.getMappedPort(4566);
    System.setProperty("aws.sm.endpoint", endpoint);
    System.setProperty("aws.region", "us-east-1");
    System.setProperty("aws.accessKeyId", "test");
    System.setProperty("aws.secretAccessKey", "test");

    smClient =
        SecretsManagerClient.builder()
            .endpointOverride(URI.create(endpoint))
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
            .build();
    smClient.createSecret(
        r ->
            r.name(SECRET_ID)
                .secretString(
                    "{\"url\":\"https://blog.example.com\","
                        + "\"database\":{\"client\":\"mysql\",\"connection\":{"
                        + "\"host\":\"db.local\",\"user\":\"root\",\"password\":\"rootpass\","
                        + "\"database\":\"ghost_prod\"}}}"));
  }

  @AfterAll
  void cleanup() {
    System.clearProperty("aws.sm.endpoint");
    System.clearProperty("aws.region");
    System.clearProperty("aws.accessKeyId");
    System.clearProperty("aws.secretAccessKey");
    SecretsManagerProvider.resetClient();

    if (smClient != null) smClient.close();
    if (localstack != null) localstack.stop();
  }

  @Test
  @DisplayName("Saved credentials are readable from the next secret version")
  void savedCredentialsAreReadable() {
    final var store = SecretsManagerConfigStore.load(SECRET_ID);
    assertEquals("root", store.get(ConfigKeys.USER).orElseThrow());

    store.set(ConfigKeys.USER, "ghost-17").set(ConfigKeys.PASSWORD, "n3w!Pass").save();

    final var reloaded = SecretsManagerConfigStore.load(SECRET_ID);
    assertEquals("ghost-17", reloaded.get(ConfigKeys.USER).orElseThrow());
    assertEquals("n3w!Pass", reloaded.get(ConfigKeys.PASSWORD).orElseThrow());
    assertEquals("ghost_prod", reloaded.get(ConfigKeys.DATABASE).orElseThrow());
    final var raw = smClient.getSecretValue(r -> r.secretId(SECRET_ID)).secretString();
    assertTrue(raw.contains("blog.example.com"));
  }
}
