package com.example.ghostmysql.core.jdbc;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ghostmysql.core.sql.AdminStatements;
import java.sql.Connection;
import java.sql.SQLException;

final class JdbcQueries {

  private static final System.Logger LOGGER = System.getLogger(JdbcQueries.class.getName());

  private JdbcQueries() {}

  static void execute(final Connection connection, final String sql) throws SQLException {
    LOGGER.log(DEBUG, "MySQL: running query > {0}", AdminStatements.redact(sql));
    try (final var stmt = connection.createStatement()) {
      stmt.execute(sql);
    }
  }
}
