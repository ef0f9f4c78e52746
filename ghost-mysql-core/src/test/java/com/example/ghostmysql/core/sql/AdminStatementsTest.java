package com.example.ghostmysql.core.sql;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

class AdminStatementsTest {

  @Nested
  @DisplayName("Statement text")
  class StatementText {

    @Test
    void createUser() {
      assertEquals(
          "CREATE USER 'ghost-42'@'db.local' IDENTIFIED WITH mysql_native_password",
          AdminStatements.createUser("ghost-42", "db.local"));
    }

    @Test
    void setPassword() {
      assertEquals(
          "SET PASSWORD FOR 'ghost-42'@'db.local' = PASSWORD('abc')",
          AdminStatements.setPassword("ghost-42", "db.local", "abc"));
    }

    @Test
    void grantAll() {
      assertEquals(
          "GRANT ALL PRIVILEGES ON `ghost_prod`.* TO 'ghost-42'@'%'",
          AdminStatements.grantAll("ghost_prod", "ghost-42", "%"));
    }
  }

  @Nested
  @DisplayName("Quoting")
  class Quoting {

    @Test
    @DisplayName("Quotes and backslashes in passwords are escaped")
    void passwordIsEscaped() {
      assertEquals(
          "SET PASSWORD FOR 'u'@'h' = PASSWORD('it''s\\\\x')",
          AdminStatements.setPassword("u", "h", "it's\\x"));
    }

    @Test
    @DisplayName("Backticks in the database name are doubled")
    void databaseIdentifierIsEscaped() {
      assertEquals("`a``b`", AdminStatements.identifier("a`b"));
    }
  }

  @Nested
  @DisplayName("Redaction")
  class Redaction {

    @Test
    @DisplayName("Password literal is masked")
    void passwordIsMasked() {
      final var sql = AdminStatements.setPassword("ghost-1", "h", "it's)('x\\'");

      assertEquals(
          "SET PASSWORD FOR 'ghost-1'@'h' = PASSWORD('********')", AdminStatements.redact(sql));
    }

    @Test
    @DisplayName("Statements without a password are unchanged")
    void otherStatementsUnchanged() {
      final var sql = AdminStatements.createUser("ghost-1", "h");

      assertEquals(sql, AdminStatements.redact(sql));
    }
  }
}
