package com.example.ghostmysql.cli;

import com.example.ghostmysql.core.ProvisionerSettings;
import com.example.ghostmysql.core.StageTask;
import com.example.ghostmysql.core.config.ConfigStore;
import com.example.ghostmysql.core.jdbc.MySqlSetupStage;
import com.example.ghostmysql.core.progress.ProgressReporter;
import com.example.ghostmysql.core.reactive.ReactiveMySqlSetupStage;

/** Builds the provisioning task once the configuration store is known. */
@FunctionalInterface
interface StageFactory {

  StageTask create(
      ConfigStore store, String environment, ProgressReporter reporter, boolean reactive);

  /** JDBC or R2DBC pipeline with settings from system properties and environment variables. */
  static StageFactory standard() {
    return (store, environment, reporter, reactive) -> {
      final var settings = ProvisionerSettings.fromEnvironment();
      if (reactive) {
        return ReactiveMySqlSetupStage.builder()
            .configStore(store)
            .environment(environment)
            .settings(settings)
            .progressReporter(reporter)
            .build()
            .asStageTask();
      }
      return MySqlSetupStage.builder()
          .configStore(store)
          .environment(environment)
          .settings(settings)
          .progressReporter(reporter)
          .build();
    };
  }
}
