package com.example.ghostmysql.core;

/** The part of the host setup command that extensions register stages with. */
@FunctionalInterface
public interface StageRegistrar {

  /**
   * Adds a stage to the setup run.
   *
   * @param name stage name, used to enable or disable it
   * @param task work to run
   * @param description short human description
   */
  void addStage(String name, StageTask task, String description);
}
