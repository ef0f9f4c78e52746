package com.example.ghostmysql.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.ghostmysql.core.config.ConfigKeys;
import com.example.ghostmysql.core.config.ConnectionConfig;
import com.example.ghostmysql.core.errors.ConfigException;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.SQLException;
import org.junit.jupiter.api.*;

class AdminConnectorTest {

  private final ConnectionConfig config =
      new ConnectionConfig("mysql.internal", 3307, "root", "secret", "ghost");

  @Test
  @DisplayName("Returns the opened connection")
  void returnsOpenedConnection() throws Exception {
    final var connection = mock(Connection.class);

    assertSame(connection, new AdminConnector(c -> connection, "production").connect(config));
    verify(connection, never()).close();
  }

  @Test
  @DisplayName("Unknown host is reported with the configured port")
  void unknownHostIsUnreachable() {
    final var connector =
        new AdminConnector(
            c -> {
              throw new SQLException(
                  "Communications link failure",
                  "08S01",
                  new UnknownHostException("mysql.internal"));
            },
            "staging");

    final var thrown = assertThrows(ConfigException.class, () -> connector.connect(config));

    assertEquals("mysql.internal", thrown.config().get(ConfigKeys.HOST));
    assertEquals("3307", thrown.config().get(ConfigKeys.PORT));
    assertEquals("staging", thrown.environment());
    assertInstanceOf(SQLException.class, thrown.getCause());
  }

  @Test
  @DisplayName("Unclassified failures are rethrown as is")
  void unclassifiedFailuresAreRethrown() {
    final var original = new SQLException("Host is blocked", "HY000", 1129);
    final var connector =
        new AdminConnector(
            c -> {
              throw original;
            },
            "production");

    assertSame(original, assertThrows(SQLException.class, () -> connector.connect(config)));
  }
}
