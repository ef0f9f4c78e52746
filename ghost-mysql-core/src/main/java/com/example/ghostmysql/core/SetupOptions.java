package com.example.ghostmysql.core;

/**
 * Install-mode flags of the host setup command.
 *
 * @param local installing for local development
 * @param db database engine chosen for the install, e.g. {@code mysql} or {@code sqlite3}
 * @param environment configuration environment name, e.g. {@code production}
 */
public record SetupOptions(boolean local, String db, String environment) {

  public static final String SQLITE = "sqlite3";

  /**
   * Whether the install talks to a networked MySQL server that needs its own user.
   *
   * @return false for local installs and for sqlite3
   */
  public boolean usesNetworkedDatabase() {
    return !local && !SQLITE.equals(db);
  }
}
