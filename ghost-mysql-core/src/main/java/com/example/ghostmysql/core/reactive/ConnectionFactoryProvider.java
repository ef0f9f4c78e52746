package com.example.ghostmysql.core.reactive;

import static io.r2dbc.spi.ConnectionFactoryOptions.DRIVER;
import static io.r2dbc.spi.ConnectionFactoryOptions.HOST;
import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.PORT;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;

import com.example.ghostmysql.core.config.ConnectionConfig;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;

/**
 * Factory that creates an R2DBC {@link ConnectionFactory} from connection settings. As with JDBC,
 * the target database is left out.
 */
@FunctionalInterface
public interface ConnectionFactoryProvider {

  /**
   * Creates a new {@link ConnectionFactory}.
   *
   * @param config connection settings
   * @return a connection factory for the administrative connection
   */
  ConnectionFactory create(final ConnectionConfig config);

  /** Factories discovered through {@link ConnectionFactories} with the {@code mysql} driver. */
  static ConnectionFactoryProvider discovered() {
    return config -> {
      final var options =
          ConnectionFactoryOptions.builder()
              .option(DRIVER, "mysql")
              .option(HOST, config.host())
              .option(PORT, config.portOrDefault())
              .option(USER, config.user());
      if (config.password() != null) options.option(PASSWORD, config.password());
      return ConnectionFactories.get(options.build());
    };
  }
}
