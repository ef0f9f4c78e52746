package com.example.ghostmysql.core.config;

import java.util.Objects;

/**
 * Administrative connection settings read from {@code database.connection.*}.
 *
 * @param host database host name or address
 * @param port port, or {@code null} when not configured
 * @param user administrative user
 * @param password administrative password, may be {@code null}
 * @param database database the provisioned user is granted rights on
 */
public record ConnectionConfig(
    String host, Integer port, String user, String password, String database) {

  public static final int DEFAULT_PORT = 3306;

  public ConnectionConfig {
    Objects.requireNonNull(host, ConfigKeys.HOST + " is required");
    Objects.requireNonNull(user, ConfigKeys.USER + " is required");
  }

  /**
   * Reads the connection section from a configuration store.
   *
   * @param store configuration to read
   * @return connection settings
   * @throws IllegalArgumentException if the port is not a number
   */
  public static ConnectionConfig from(final ConfigStore store) {
    final var port =
        store
            .get(ConfigKeys.PORT)
            .filter(val -> !val.isBlank())
            .map(String::trim)
            .map(
                val -> {
                  try {
                    return Integer.valueOf(val);
                  } catch (final NumberFormatException e) {
                    throw new IllegalArgumentException(
                        ConfigKeys.PORT + " must be a number, was: " + val, e);
                  }
                })
            .orElse(null);
    return new ConnectionConfig(
        store.get(ConfigKeys.HOST).orElse(null),
        port,
        store.get(ConfigKeys.USER).orElse(null),
        store.get(ConfigKeys.PASSWORD).orElse(null),
        store.get(ConfigKeys.DATABASE).orElse(null));
  }

  public int portOrDefault() {
    return port == null ? DEFAULT_PORT : port;
  }

  /** Port as shown to the user, {@code "3306"} when unset. */
  public String displayPort() {
    return String.valueOf(portOrDefault());
  }

  @Override
  public String toString() {
    return "ConnectionConfig[host=%s, port=%s, user=%s, password=%s, database=%s]"
        .formatted(host, displayPort(), user, password == null ? null : "********", database);
  }
}
