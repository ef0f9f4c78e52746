package com.example.ghostmysql.cli;

import com.example.ghostmysql.core.MySqlExtension;
import com.example.ghostmysql.core.SetupOptions;
import com.example.ghostmysql.core.config.ConfigStore;
import com.example.ghostmysql.core.config.JsonConfigStore;
import com.example.ghostmysql.core.config.SecretsManagerConfigStore;
import com.example.ghostmysql.core.errors.ConfigException;
import com.example.ghostmysql.core.errors.SystemException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "setup",
    mixinStandardHelpOptions = true,
    description = "Creates a dedicated MySQL user for Ghost and saves it to the configuration")
public class SetupCommand implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_USER_ERROR = 1;
  static final int EXIT_UNEXPECTED = 2;

  // held so the configured level is not lost when the logger is collected
  private static final Logger APP_LOGGER = Logger.getLogger("com.example.ghostmysql");

  @Option(
      names = {"--local"},
      defaultValue = "false",
      description = "Local development install, no MySQL user is created")
  boolean local;

  @Option(
      names = {"--db"},
      defaultValue = "mysql",
      description = "Database engine of the install (default: mysql)")
  String db;

  @Option(
      names = {"-d", "--dir"},
      defaultValue = ".",
      description = "Install directory holding config.<env>.json (default: .)")
  Path dir;

  @Option(
      names = {"-e", "--env"},
      defaultValue = "production",
      description = "Configuration environment (default: production)")
  String env;

  @Option(
      names = {"--secret-id"},
      description = "Read and write the configuration as this AWS Secrets Manager secret")
  String secretId;

  @Option(
      names = {"--reactive"},
      defaultValue = "false",
      description = "Provision over R2DBC instead of JDBC")
  boolean reactive;

  @Option(
      names = {"-v", "--verbose"},
      defaultValue = "false",
      description = "Log every query")
  boolean verbose;

  private final StageFactory stageFactory;
  private final PrintStream out;
  private final PrintStream err;

  public SetupCommand() {
    this(StageFactory.standard(), System.out, System.err);
  }

  SetupCommand(final StageFactory stageFactory, final PrintStream out, final PrintStream err) {
    this.stageFactory = stageFactory;
    this.out = out;
    this.err = err;
  }

  @Override
  public Integer call() {
    if (verbose) enableDebugLogging();

    final var reporter = new ConsoleProgressReporter(out);
    final var runner = new StageRunner();
    final var extension =
        new MySqlExtension(() -> stageFactory.create(openStore(), env, reporter, reactive).run());

    if (!extension.setup(runner, new SetupOptions(local, db, env))) {
      out.println("Nothing to set up for a local or " + db + " install");
      return EXIT_OK;
    }

    try {
      final var results = runner.runAll();
      results.forEach(
          (stage, result) ->
              result
                  .committedCredential()
                  .ifPresent(
                      credential ->
                          out.println(
                              "MySQL user "
                                  + credential.username()
                                  + " created and saved to the "
                                  + env
                                  + " configuration")));
      return EXIT_OK;
    } catch (final ConfigException e) {
      err.print(e.describe());
      return EXIT_USER_ERROR;
    } catch (final SystemException e) {
      err.println(e.getMessage());
      return EXIT_USER_ERROR;
    } catch (final Exception e) {
      err.println("Unexpected error: " + e);
      return EXIT_UNEXPECTED;
    }
  }

  private ConfigStore openStore() {
    if (secretId != null && !secretId.isBlank()) return SecretsManagerConfigStore.load(secretId);
    return JsonConfigStore.load(JsonConfigStore.fileFor(dir, env));
  }

  private static void enableDebugLogging() {
    APP_LOGGER.setLevel(Level.FINE);
    if (APP_LOGGER.getHandlers().length == 0) {
      final var handler = new ConsoleHandler();
      handler.setLevel(Level.FINE);
      APP_LOGGER.addHandler(handler);
      APP_LOGGER.setUseParentHandlers(false);
    }
  }
}
