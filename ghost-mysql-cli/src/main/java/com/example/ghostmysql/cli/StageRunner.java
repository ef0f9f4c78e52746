package com.example.ghostmysql.cli;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ghostmysql.core.SetupResult;
import com.example.ghostmysql.core.StageRegistrar;
import com.example.ghostmysql.core.StageTask;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the stages registered by extensions and runs them in registration order. The first
 * failing stage stops the run.
 */
final class StageRunner implements StageRegistrar {

  private static final System.Logger LOGGER = System.getLogger(StageRunner.class.getName());

  private record Stage(String name, StageTask task, String description) {}

  private final Map<String, Stage> stages = new LinkedHashMap<>();

  @Override
  public void addStage(final String name, final StageTask task, final String description) {
    if (stages.containsKey(name)) {
      throw new IllegalArgumentException("Stage already registered: " + name);
    }
    stages.put(name, new Stage(name, task, description));
  }

  /**
   * Runs every registered stage.
   *
   * @return results keyed by stage name, in run order
   * @throws Exception the failure of the first failing stage
   */
  Map<String, SetupResult> runAll() throws Exception {
    final var results = new LinkedHashMap<String, SetupResult>();
    for (final var stage : stages.values()) {
      LOGGER.log(DEBUG, "Running stage {0} ({1})", stage.name(), stage.description());
      results.put(stage.name(), stage.task().run());
    }
    return results;
  }
}
