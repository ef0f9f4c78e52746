package com.example.ghostmysql.core;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Hooks the MySQL user stage into the host setup command.
 *
 * <p>The stage is not registered for local installs or when sqlite3 was chosen, since neither has
 * a MySQL server to provision.
 */
public final class MySqlExtension {

  public static final String STAGE_NAME = "mysql";
  public static final String STAGE_DESCRIPTION = "\"ghost\" mysql user";

  private static final System.Logger LOGGER = System.getLogger(MySqlExtension.class.getName());

  private final StageTask stage;

  public MySqlExtension(final StageTask stage) {
    this.stage = stage;
  }

  /**
   * Registers the stage when it applies to the install.
   *
   * @param registrar host setup command
   * @param options install-mode flags
   * @return true if the stage was registered
   */
  public boolean setup(final StageRegistrar registrar, final SetupOptions options) {
    if (!options.usesNetworkedDatabase()) {
      LOGGER.log(DEBUG, "Local or sqlite3 install, not registering the mysql stage");
      return false;
    }
    registrar.addStage(STAGE_NAME, stage, STAGE_DESCRIPTION);
    return true;
  }
}
