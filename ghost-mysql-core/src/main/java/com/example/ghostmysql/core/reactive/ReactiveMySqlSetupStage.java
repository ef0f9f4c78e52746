package com.example.ghostmysql.core.reactive;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.ghostmysql.core.CredentialCommitter;
import com.example.ghostmysql.core.MySqlErrorCodes;
import com.example.ghostmysql.core.ProvisionerSettings;
import com.example.ghostmysql.core.Retry;
import com.example.ghostmysql.core.SetupPhase;
import com.example.ghostmysql.core.SetupResult;
import com.example.ghostmysql.core.StageTask;
import com.example.ghostmysql.core.config.ConfigKeys;
import com.example.ghostmysql.core.config.ConfigStore;
import com.example.ghostmysql.core.config.ConnectionConfig;
import com.example.ghostmysql.core.credentials.CredentialGenerator;
import com.example.ghostmysql.core.credentials.ProvisionedCredential;
import com.example.ghostmysql.core.credentials.RandomCredentialGenerator;
import com.example.ghostmysql.core.errors.ConfigException;
import com.example.ghostmysql.core.errors.ProvisioningException;
import com.example.ghostmysql.core.errors.SystemException;
import com.example.ghostmysql.core.progress.LoggingProgressReporter;
import com.example.ghostmysql.core.progress.ProgressReporter;
import com.example.ghostmysql.core.progress.StepTitles;
import com.example.ghostmysql.core.sql.AdminStatements;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.Result;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Provisions the application user over R2DBC.
 *
 * <p>Same steps, statements and errors as {@link
 * com.example.ghostmysql.core.jdbc.MySqlSetupStage}, without blocking. Each statement is subscribed
 * only after the previous one completed, and the connection is released through {@link
 * Mono#usingWhen} on completion, error and cancellation alike.
 *
 * <pre>{@code
 * var stage = ReactiveMySqlSetupStage.builder()
 *     .configStore(store)
 *     .environment("production")
 *     .build();
 *
 * stage.run()
 *     .subscribe(result -> log.info("MySQL user: {}", result.committedCredential()));
 * }</pre>
 */
public final class ReactiveMySqlSetupStage {

  private static final System.Logger LOGGER =
      System.getLogger(ReactiveMySqlSetupStage.class.getName());

  private final ConfigStore store;
  private final String environment;
  private final String rootUser;
  private final Retry.Policy collisionPolicy;
  private final ConnectionFactoryProvider factory;
  private final CredentialGenerator generator;
  private final CredentialCommitter committer;
  private final ProgressReporter reporter;

  private volatile SetupPhase phase = SetupPhase.IDLE;

  private ReactiveMySqlSetupStage(final Builder builder) {
    this.store = builder.configStore;
    this.environment = builder.environment;
    this.rootUser = builder.settings.rootUser();
    this.collisionPolicy = builder.settings.collisionPolicy();
    this.factory = builder.factory;
    this.generator =
        builder.credentialGenerator != null
            ? builder.credentialGenerator
            : new RandomCredentialGenerator(builder.settings);
    this.committer = new CredentialCommitter(builder.configStore);
    this.reporter = builder.progressReporter;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ReactiveMySqlSetupStage}. */
  public static class Builder {
    private ConfigStore configStore;
    private String environment = "production";
    private ProvisionerSettings settings = ProvisionerSettings.defaults();
    private ConnectionFactoryProvider factory = ConnectionFactoryProvider.discovered();
    private CredentialGenerator credentialGenerator;
    private ProgressReporter progressReporter = new LoggingProgressReporter();

    private Builder() {}

    public Builder configStore(final ConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    public Builder environment(final String environment) {
      this.environment = environment;
      return this;
    }

    public Builder settings(final ProvisionerSettings settings) {
      this.settings = settings;
      return this;
    }

    /**
     * Sets the connection factory source.
     *
     * <p>Default: {@link ConnectionFactoryProvider#discovered()}
     *
     * @param factory connection factory source
     * @return this builder
     */
    public Builder factory(final ConnectionFactoryProvider factory) {
      this.factory = factory;
      return this;
    }

    public Builder credentialGenerator(final CredentialGenerator credentialGenerator) {
      this.credentialGenerator = credentialGenerator;
      return this;
    }

    public Builder progressReporter(final ProgressReporter progressReporter) {
      this.progressReporter = progressReporter;
      return this;
    }

    public ReactiveMySqlSetupStage build() {
      if (configStore == null) throw new IllegalStateException("configStore is required");
      if (environment == null || environment.isBlank())
        throw new IllegalStateException("environment is required");
      if (settings == null) throw new IllegalStateException("settings cannot be null");
      if (factory == null) throw new IllegalStateException("factory cannot be null");
      if (progressReporter == null)
        throw new IllegalStateException("progressReporter cannot be null");
      return new ReactiveMySqlSetupStage(this);
    }
  }

  /**
   * Runs the pipeline when subscribed.
   *
   * <p>The skip check only reads {@code database.connection.user}. A failure to close the
   * connection after the new credentials were saved is logged and does not fail the run.
   *
   * @return emits the result, or errors with {@link ConfigException}, {@link SystemException} or an
   *     unclassified connection failure
   */
  public Mono<SetupResult> run() {
    return Mono.defer(
        () -> {
          phase = SetupPhase.IDLE;

          if (!rootUser.equals(store.get(ConfigKeys.USER).orElse(null))) {
            final var reason = StepTitles.NOT_ROOT.formatted(rootUser);
            LOGGER.log(INFO, reason);
            reporter.skipped(StepTitles.STAGE, reason);
            transition(SetupPhase.SKIPPED);
            return Mono.just(SetupResult.skipped());
          }

          return Mono.fromCallable(() -> ConnectionConfig.from(store))
              .flatMap(
                  config ->
                      Mono.usingWhen(
                          step(StepTitles.CONNECTING, SetupPhase.CONNECTING, connect(config)),
                          connection -> provision(connection, config),
                          ReactiveMySqlSetupStage::closeAfterCommit,
                          (connection, error) -> Mono.from(connection.close()),
                          connection -> Mono.from(connection.close())))
              .map(SetupResult::completed)
              .doOnSuccess(result -> transition(SetupPhase.DONE))
              .doOnError(error -> transition(SetupPhase.FAILED));
        });
  }

  /**
   * Adapts the stage to the blocking {@link StageTask} seam of the host setup command.
   *
   * @return task that blocks on {@link #run()}
   */
  public StageTask asStageTask() {
    return () -> run().block();
  }

  /** Phase of the current or last run. */
  public SetupPhase phase() {
    return phase;
  }

  private Mono<ProvisionedCredential> provision(
      final Connection connection, final ConnectionConfig config) {
    final var created =
        step(StepTitles.CREATING_USER, SetupPhase.CREATING_USER, createUser(connection, config));
    return created.flatMap(credential -> grantAndCommit(connection, credential, config));
  }

  private Mono<ProvisionedCredential> grantAndCommit(
      final Connection connection,
      final ProvisionedCredential credential,
      final ConnectionConfig config) {
    final var granted =
        step(
            StepTitles.GRANTING,
            SetupPhase.GRANTING_PRIVILEGES,
            grant(connection, credential, config));
    final Mono<Void> committed =
        step(
            StepTitles.SAVING,
            SetupPhase.COMMITTING,
            Mono.fromRunnable(() -> committer.commit(credential)));
    return granted.then(committed).thenReturn(credential);
  }

  private Mono<Connection> connect(final ConnectionConfig config) {
    return Mono.defer(() -> Mono.<Connection>from(factory.create(config).create()))
        .doOnNext(
            c ->
                LOGGER.log(
                    DEBUG, "MySQL: connected to {0}:{1}", config.host(), config.displayPort()))
        .onErrorMap(
            error -> !(error instanceof ProvisioningException),
            error -> {
              switch (MySqlErrorCodes.classify(error)) {
                case CONNECTION_REFUSED:
                  return ConfigException.unreachable(config, environment, error);
                case ACCESS_DENIED:
                  return ConfigException.accessDenied(config, environment, error);
                default:
                  return error;
              }
            });
  }

  private Mono<ProvisionedCredential> createUser(
      final Connection connection, final ConnectionConfig config) {
    return Mono.defer(() -> attemptCreate(connection, config))
        .retryWhen(
            Retry.toReactor(
                collisionPolicy,
                error -> {
                  final var duplicate = MySqlErrorCodes.isDuplicateUser(error);
                  if (duplicate)
                    LOGGER.log(
                        DEBUG, "MySQL: user exists, re-trying user creation with new username");
                  return duplicate;
                }))
        .flatMap(
            credential ->
                execute(connection, AdminStatements.DISABLE_OLD_PASSWORDS)
                    .doOnSuccess(
                        v -> LOGGER.log(DEBUG, "MySQL: successfully disabled old_password"))
                    .then(
                        execute(
                            connection,
                            AdminStatements.setPassword(
                                credential.username(), config.host(), credential.password())))
                    .doOnSuccess(
                        v ->
                            LOGGER.log(
                                DEBUG,
                                "MySQL: successfully created password for user {0}",
                                credential.username()))
                    .thenReturn(credential))
        .onErrorMap(
            error -> !(error instanceof ProvisioningException),
            error -> {
              LOGGER.log(DEBUG, "MySQL: Unable to create custom Ghost user");
              return new SystemException(
                  "Creating new mysql user errored with message: " + error.getMessage(), error);
            });
  }

  private Mono<ProvisionedCredential> attemptCreate(
      final Connection connection, final ConnectionConfig config) {
    final var candidate = generator.next();
    return execute(connection, AdminStatements.createUser(candidate.username(), config.host()))
        .doOnSuccess(
            v ->
                LOGGER.log(
                    DEBUG, "MySQL: successfully created new user {0}", candidate.username()))
        .thenReturn(candidate);
  }

  private Mono<Void> grant(
      final Connection connection,
      final ProvisionedCredential credential,
      final ConnectionConfig config) {
    if (config.database() == null || config.database().isBlank()) {
      return Mono.error(
          new SystemException(
              "Granting database permissions errored with message: "
                  + ConfigKeys.DATABASE
                  + " is not set",
              null));
    }
    return execute(
            connection,
            AdminStatements.grantAll(config.database(), credential.username(), config.host()))
        .doOnSuccess(
            v ->
                LOGGER.log(
                    DEBUG,
                    "MySQL: Successfully granted privileges for user \"{0}\"",
                    credential.username()))
        .then(execute(connection, AdminStatements.FLUSH_PRIVILEGES))
        .doOnSuccess(v -> LOGGER.log(DEBUG, "MySQL: flushed privileges"))
        .onErrorMap(
            error -> !(error instanceof ProvisioningException),
            error -> {
              LOGGER.log(DEBUG, "MySQL: Unable either to grant permissions or flush privileges");
              return new SystemException(
                  "Granting database permissions errored with message: " + error.getMessage(),
                  error);
            });
  }

  private Mono<Void> execute(final Connection connection, final String sql) {
    return Mono.defer(
        () -> {
          LOGGER.log(DEBUG, "MySQL: running query > {0}", AdminStatements.redact(sql));
          return Flux.from(connection.createStatement(sql).execute())
              .flatMap(Result::getRowsUpdated)
              .then();
        });
  }

  private <T> Mono<T> step(final String title, final SetupPhase next, final Mono<T> work) {
    return work.doOnSubscribe(
            s -> {
              transition(next);
              reporter.started(title);
            })
        .doOnSuccess(v -> reporter.succeeded(title))
        .doOnError(error -> reporter.failed(title, error));
  }

  private static Mono<Void> closeAfterCommit(final Connection connection) {
    return Mono.from(connection.close())
        .onErrorResume(
            error -> {
              LOGGER.log(
                  WARNING,
                  "MySQL: closing the connection failed after the new config was saved",
                  error);
              return Mono.empty();
            });
  }

  private void transition(final SetupPhase next) {
    LOGGER.log(DEBUG, "MySQL setup: {0} -> {1}", phase, next);
    phase = next;
  }
}
