package com.example.ghostmysql.core;

/** A unit of work registered with the host setup command. */
@FunctionalInterface
public interface StageTask {

  /**
   * Runs the stage.
   *
   * @return what the stage did
   * @throws Exception on failure; {@link com.example.ghostmysql.core.errors.ProvisioningException}
   *     subclasses carry user-facing detail
   */
  SetupResult run() throws Exception;
}
