package com.example.ghostmysql.core.errors;

import static org.junit.jupiter.api.Assertions.*;

import com.example.ghostmysql.core.config.ConnectionConfig;
import java.sql.SQLException;
import org.junit.jupiter.api.*;

class ConfigExceptionTest {

  private final ConnectionConfig config =
      new ConnectionConfig("db.local", null, "root", "hunter2", "ghost");

  @Test
  @DisplayName("Unreachable carries host, default port and the reachability help")
  void unreachable() {
    final var e =
        ConfigException.unreachable(config, "production", new SQLException("Connection refused"));

    assertEquals("Connection refused", e.getMessage());
    assertEquals("db.local", e.config().get("database.connection.host"));
    assertEquals("3306", e.config().get("database.connection.port"));
    assertEquals(ConfigException.UNREACHABLE_HELP, e.help().orElseThrow());
  }

  @Test
  @DisplayName("Describe masks the password")
  void describeMasksPassword() {
    final var e =
        ConfigException.accessDenied(config, "staging", new SQLException("Access denied"));

    final var text = e.describe();

    assertFalse(text.contains("hunter2"));
    assertTrue(text.contains("database.connection.password = ********"));
    assertTrue(text.contains("database.connection.user = root"));
    assertTrue(text.contains("Environment: staging"));
    assertTrue(text.contains(ConfigException.ACCESS_DENIED_HELP));
  }

  @Test
  @DisplayName("Implicated keys cannot be modified")
  void keysAreUnmodifiable() {
    final var e = ConfigException.accessDenied(config, "production", new SQLException("x"));

    assertThrows(UnsupportedOperationException.class, () -> e.config().put("k", "v"));
  }

  @Test
  @DisplayName("System errors have no help text")
  void systemErrorsHaveNoHelp() {
    assertTrue(new SystemException("boom", null).help().isEmpty());
  }
}
