package com.example.ghostmysql.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.ghostmysql.core.CredentialCommitter;
import com.example.ghostmysql.core.ProvisionerSettings;
import com.example.ghostmysql.core.SetupPhase;
import com.example.ghostmysql.core.SetupResult;
import com.example.ghostmysql.core.StageTask;
import com.example.ghostmysql.core.config.ConfigKeys;
import com.example.ghostmysql.core.config.ConfigStore;
import com.example.ghostmysql.core.config.ConnectionConfig;
import com.example.ghostmysql.core.credentials.CredentialGenerator;
import com.example.ghostmysql.core.credentials.ProvisionedCredential;
import com.example.ghostmysql.core.credentials.RandomCredentialGenerator;
import com.example.ghostmysql.core.progress.LoggingProgressReporter;
import com.example.ghostmysql.core.progress.ProgressReporter;
import com.example.ghostmysql.core.progress.StepTitles;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provisions the application user over JDBC.
 *
 * <p>Runs connect, create user, grant and save in that order over a single administrative
 * connection. The connection is opened once and closed once, on success as well as on failure, and
 * the configuration is only written after the grant succeeded.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var store = JsonConfigStore.load(JsonConfigStore.fileFor(installDir, "production"));
 * var result = MySqlSetupStage.builder()
 *     .configStore(store)
 *     .environment("production")
 *     .build()
 *     .run();
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * var stage = MySqlSetupStage.builder()
 *     .configStore(store)
 *     .environment("staging")
 *     .settings(ProvisionerSettings.fromEnvironment())
 *     .connectionProvider(ConnectionProvider.driverManager())
 *     .credentialGenerator(new RandomCredentialGenerator(settings))
 *     .progressReporter(new LoggingProgressReporter())
 *     .build();
 * }</pre>
 */
public final class MySqlSetupStage implements StageTask {

  private static final System.Logger LOGGER = System.getLogger(MySqlSetupStage.class.getName());

  private final ConfigStore store;
  private final String rootUser;
  private final AdminConnector connector;
  private final UserProvisioner provisioner;
  private final PrivilegeGrantor grantor;
  private final CredentialCommitter committer;
  private final ProgressReporter reporter;

  private volatile SetupPhase phase = SetupPhase.IDLE;

  private MySqlSetupStage(final Builder builder) {
    final var settings = builder.settings;
    final var generator =
        builder.credentialGenerator != null
            ? builder.credentialGenerator
            : new RandomCredentialGenerator(settings);
    this.store = builder.configStore;
    this.rootUser = settings.rootUser();
    this.connector = new AdminConnector(builder.connectionProvider, builder.environment);
    this.provisioner = new UserProvisioner(generator, settings.collisionPolicy());
    this.grantor = new PrivilegeGrantor();
    this.committer = new CredentialCommitter(builder.configStore);
    this.reporter = builder.progressReporter;
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link MySqlSetupStage}. */
  public static class Builder {
    private ConfigStore configStore;
    private String environment = "production";
    private ProvisionerSettings settings = ProvisionerSettings.defaults();
    private ConnectionProvider connectionProvider = ConnectionProvider.driverManager();
    private CredentialGenerator credentialGenerator;
    private ProgressReporter progressReporter = new LoggingProgressReporter();

    private Builder() {}

    /**
     * Sets the configuration the connection settings are read from and the credential is written
     * to (required).
     *
     * @param configStore the caller's configuration
     * @return this builder
     */
    public Builder configStore(final ConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    /**
     * Sets the environment name reported with configuration errors.
     *
     * <p>Default: {@code production}
     *
     * @param environment environment name
     * @return this builder
     */
    public Builder environment(final String environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Sets the provisioning tunables.
     *
     * <p>Default: {@link ProvisionerSettings#defaults()}
     *
     * @param settings tunables
     * @return this builder
     */
    public Builder settings(final ProvisionerSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder connectionProvider(final ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the source of candidate credentials.
     *
     * <p>Default: {@link RandomCredentialGenerator} built from the settings
     *
     * @param credentialGenerator candidate source
     * @return this builder
     */
    public Builder credentialGenerator(final CredentialGenerator credentialGenerator) {
      this.credentialGenerator = credentialGenerator;
      return this;
    }

    public Builder progressReporter(final ProgressReporter progressReporter) {
      this.progressReporter = progressReporter;
      return this;
    }

    /**
     * Builds the stage.
     *
     * @return configured stage
     * @throws IllegalStateException if required fields are not set
     */
    public MySqlSetupStage build() {
      if (configStore == null) throw new IllegalStateException("configStore is required");
      if (environment == null || environment.isBlank())
        throw new IllegalStateException("environment is required");
      if (settings == null) throw new IllegalStateException("settings cannot be null");
      if (connectionProvider == null)
        throw new IllegalStateException("connectionProvider cannot be null");
      if (progressReporter == null)
        throw new IllegalStateException("progressReporter cannot be null");
      return new MySqlSetupStage(this);
    }
  }

  /**
   * Runs the pipeline.
   *
   * <p>The skip check only reads {@code database.connection.user}, so an incomplete configuration
   * of a non-root user is skipped as well. Once the new credentials are saved the run counts as
   * successful: a failure to close the connection afterwards is logged, not thrown.
   *
   * @return {@link SetupResult#skipped()} when the configured user is not the root user, otherwise
   *     the committed credential
   * @throws com.example.ghostmysql.core.errors.ConfigException if the server is unreachable or
   *     rejects the administrative credentials
   * @throws com.example.ghostmysql.core.errors.SystemException if creating the user or granting
   *     its privileges fails
   * @throws SQLException any other connection failure
   */
  @Override
  public SetupResult run() throws SQLException {
    phase = SetupPhase.IDLE;

    if (!rootUser.equals(store.get(ConfigKeys.USER).orElse(null))) {
      final var reason = StepTitles.NOT_ROOT.formatted(rootUser);
      LOGGER.log(INFO, reason);
      reporter.skipped(StepTitles.STAGE, reason);
      transition(SetupPhase.SKIPPED);
      return SetupResult.skipped();
    }

    try {
      final var config = ConnectionConfig.from(store);
      transition(SetupPhase.CONNECTING);
      final var connection =
          reporter.step(StepTitles.CONNECTING, () -> connector.connect(config));

      final ProvisionedCredential credential;
      try {
        credential = provision(connection, config);
      } catch (final SQLException | RuntimeException e) {
        closeAfterFailure(connection, e);
        throw e;
      }
      closeAfterCommit(connection);

      transition(SetupPhase.DONE);
      return SetupResult.completed(credential);
    } catch (final SQLException | RuntimeException e) {
      transition(SetupPhase.FAILED);
      throw e;
    }
  }

  /** Phase of the current or last run. */
  public SetupPhase phase() {
    return phase;
  }

  private ProvisionedCredential provision(
      final Connection connection, final ConnectionConfig config) throws SQLException {
    transition(SetupPhase.CREATING_USER);
    final var credential =
        reporter.step(StepTitles.CREATING_USER, () -> provisioner.createUser(connection, config));

    transition(SetupPhase.GRANTING_PRIVILEGES);
    reporter.step(
        StepTitles.GRANTING,
        () -> {
          grantor.grant(connection, credential, config);
          return null;
        });

    transition(SetupPhase.COMMITTING);
    reporter.step(
        StepTitles.SAVING,
        () -> {
          committer.commit(credential);
          return null;
        });
    return credential;
  }

  private static void closeAfterFailure(final Connection connection, final Exception failure) {
    try {
      connection.close();
    } catch (final SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static void closeAfterCommit(final Connection connection) {
    try {
      connection.close();
    } catch (final SQLException e) {
      LOGGER.log(
          WARNING, "MySQL: closing the connection failed after the new config was saved", e);
    }
  }

  private void transition(final SetupPhase next) {
    LOGGER.log(DEBUG, "MySQL setup: {0} -> {1}", phase, next);
    phase = next;
  }
}
