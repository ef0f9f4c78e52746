package com.example.ghostmysql.core.sql;

import java.util.regex.Pattern;

/**
 * The administrative statements issued by the provisioner.
 *
 * <p>Account names, hosts and passwords are written as MySQL string literals and the database name
 * as a quoted identifier, so configuration values cannot change the statement shape.
 */
public final class AdminStatements {

  public static final String DISABLE_OLD_PASSWORDS = "SET old_passwords = 0";
  public static final String FLUSH_PRIVILEGES = "FLUSH PRIVILEGES";

  private static final Pattern PASSWORD_LITERAL =
      Pattern.compile("PASSWORD\\('(?:[^'\\\\]|''|\\\\.)*'\\)");

  private AdminStatements() {}

  /**
   * {@code CREATE USER} without a password, using the native password plugin.
   *
   * @param username account name
   * @param host account host
   * @return statement text
   */
  public static String createUser(final String username, final String host) {
    return "CREATE USER " + account(username, host) + " IDENTIFIED WITH mysql_native_password";
  }

  public static String setPassword(
      final String username, final String host, final String password) {
    return "SET PASSWORD FOR " + account(username, host) + " = PASSWORD(" + literal(password) + ")";
  }

  public static String grantAll(final String database, final String username, final String host) {
    return "GRANT ALL PRIVILEGES ON " + identifier(database) + ".* TO " + account(username, host);
  }

  /**
   * Statement text safe for logs: the password literal is masked.
   *
   * @param sql statement text
   * @return masked text
   */
  public static String redact(final String sql) {
    return PASSWORD_LITERAL.matcher(sql).replaceAll("PASSWORD('********')");
  }

  static String account(final String username, final String host) {
    return literal(username) + "@" + literal(host);
  }

  static String literal(final String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  static String identifier(final String name) {
    return "`" + name.replace("`", "``") + "`";
  }
}
