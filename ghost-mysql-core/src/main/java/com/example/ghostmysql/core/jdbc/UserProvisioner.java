package com.example.ghostmysql.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ghostmysql.core.MySqlErrorCodes;
import com.example.ghostmysql.core.Retry;
import com.example.ghostmysql.core.config.ConnectionConfig;
import com.example.ghostmysql.core.credentials.CredentialGenerator;
import com.example.ghostmysql.core.credentials.ProvisionedCredential;
import com.example.ghostmysql.core.errors.SystemException;
import com.example.ghostmysql.core.sql.AdminStatements;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Creates the application user under a random name and sets its password.
 *
 * <p>The password of an existing account cannot be read back, so an existing name is never
 * reused: when {@code CREATE USER} reports that the account exists, a new candidate is generated
 * and the creation is attempted again.
 */
public final class UserProvisioner {

  private static final System.Logger LOGGER = System.getLogger(UserProvisioner.class.getName());

  private final CredentialGenerator generator;
  private final Retry.Policy collisionPolicy;

  /**
   * @param generator source of candidate names and passwords
   * @param collisionPolicy how often a name collision may be retried
   */
  public UserProvisioner(final CredentialGenerator generator, final Retry.Policy collisionPolicy) {
    this.generator = generator;
    this.collisionPolicy = collisionPolicy;
  }

  /**
   * Creates the user at {@code config.host()} and sets its password.
   *
   * @param connection open administrative connection
   * @param config connection settings
   * @return the created user's credential
   * @throws SystemException on any failure other than a retried name collision
   */
  public ProvisionedCredential createUser(
      final Connection connection, final ConnectionConfig config) {
    try {
      final var credential =
          Retry.onException(
              () -> attemptCreate(connection, config),
              MySqlErrorCodes::isDuplicateUser,
              () ->
                  LOGGER.log(
                      DEBUG, "MySQL: user exists, re-trying user creation with new username"),
              collisionPolicy);

      JdbcQueries.execute(connection, AdminStatements.DISABLE_OLD_PASSWORDS);
      LOGGER.log(DEBUG, "MySQL: successfully disabled old_password");

      JdbcQueries.execute(
          connection,
          AdminStatements.setPassword(credential.username(), config.host(), credential.password()));
      LOGGER.log(
          DEBUG, "MySQL: successfully created password for user {0}", credential.username());

      return credential;
    } catch (final SQLException e) {
      LOGGER.log(DEBUG, "MySQL: Unable to create custom Ghost user");
      throw new SystemException(
          "Creating new mysql user errored with message: " + e.getMessage(), e);
    }
  }

  private ProvisionedCredential attemptCreate(
      final Connection connection, final ConnectionConfig config) throws SQLException {
    final var candidate = generator.next();
    JdbcQueries.execute(
        connection, AdminStatements.createUser(candidate.username(), config.host()));
    LOGGER.log(DEBUG, "MySQL: successfully created new user {0}", candidate.username());
    return candidate;
  }
}
