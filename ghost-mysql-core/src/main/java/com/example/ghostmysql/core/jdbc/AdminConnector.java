package com.example.ghostmysql.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ghostmysql.core.MySqlErrorCodes;
import com.example.ghostmysql.core.config.ConnectionConfig;
import com.example.ghostmysql.core.errors.ConfigException;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the administrative connection and turns the two failures a user can fix into {@link
 * ConfigException}s. There is no retry: a failed connect ends the run.
 */
public final class AdminConnector {

  private static final System.Logger LOGGER = System.getLogger(AdminConnector.class.getName());

  private final ConnectionProvider provider;
  private final String environment;

  /**
   * @param provider opens the physical connection
   * @param environment environment name reported with configuration errors
   */
  public AdminConnector(final ConnectionProvider provider, final String environment) {
    this.provider = provider;
    this.environment = environment;
  }

  /**
   * Connects with every setting except the target database.
   *
   * @param config connection settings
   * @return an open connection, owned by the caller
   * @throws ConfigException if the server is unreachable or rejects the credentials
   * @throws SQLException any other connection failure, unchanged
   */
  public Connection connect(final ConnectionConfig config) throws SQLException {
    try {
      final var connection = provider.open(config);
      LOGGER.log(DEBUG, "MySQL: connected to {0}:{1}", config.host(), config.displayPort());
      return connection;
    } catch (final SQLException e) {
      switch (MySqlErrorCodes.classify(e)) {
        case CONNECTION_REFUSED:
          throw ConfigException.unreachable(config, environment, e);
        case ACCESS_DENIED:
          throw ConfigException.accessDenied(config, environment, e);
        default:
          throw e;
      }
    }
  }
}
