package com.example.ghostmysql.core.jdbc;

import com.example.ghostmysql.core.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens a JDBC connection from connection settings. The target database is never part of the
 * connection: administrative work must not depend on it existing.
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Opens a new connection.
   *
   * @param config connection settings
   * @return an open connection, owned by the caller
   * @throws SQLException if the connection cannot be established
   */
  Connection open(final ConnectionConfig config) throws SQLException;

  /** Connections through {@link DriverManager} and MySQL Connector/J. */
  static ConnectionProvider driverManager() {
    return config -> DriverManager.getConnection(jdbcUrl(config), config.user(), config.password());
  }

  /**
   * JDBC URL of the server, without a database.
   *
   * @param config connection settings
   * @return {@code jdbc:mysql://host:port/}
   */
  static String jdbcUrl(final ConnectionConfig config) {
    return String.format("jdbc:mysql://%s:%d/", config.host(), config.portOrDefault());
  }
}
