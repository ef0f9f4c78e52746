package com.example.ghostmysql.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ghostmysql.core.config.ConfigKeys;
import com.example.ghostmysql.core.config.ConnectionConfig;
import com.example.ghostmysql.core.credentials.ProvisionedCredential;
import com.example.ghostmysql.core.errors.SystemException;
import com.example.ghostmysql.core.sql.AdminStatements;
import java.sql.Connection;
import java.sql.SQLException;

/** Grants the new user every privilege on the target database and reloads the grant tables. */
public final class PrivilegeGrantor {

  private static final System.Logger LOGGER = System.getLogger(PrivilegeGrantor.class.getName());

  static final String ERROR_PREFIX = "Granting database permissions errored with message: ";

  /**
   * Issues {@code GRANT ALL PRIVILEGES} on {@code <database>.*} followed by {@code FLUSH
   * PRIVILEGES}.
   *
   * @param connection open administrative connection
   * @param credential the user to grant to
   * @param config connection settings holding host and target database
   * @throws SystemException if no database is configured or either statement fails
   */
  public void grant(
      final Connection connection,
      final ProvisionedCredential credential,
      final ConnectionConfig config) {
    if (config.database() == null || config.database().isBlank()) {
      throw new SystemException(ERROR_PREFIX + ConfigKeys.DATABASE + " is not set", null);
    }
    try {
      JdbcQueries.execute(
          connection,
          AdminStatements.grantAll(config.database(), credential.username(), config.host()));
      LOGGER.log(
          DEBUG, "MySQL: Successfully granted privileges for user \"{0}\"", credential.username());

      JdbcQueries.execute(connection, AdminStatements.FLUSH_PRIVILEGES);
      LOGGER.log(DEBUG, "MySQL: flushed privileges");
    } catch (final SQLException e) {
      LOGGER.log(DEBUG, "MySQL: Unable either to grant permissions or flush privileges");
      throw new SystemException(ERROR_PREFIX + e.getMessage(), e);
    }
  }
}
