package com.example.ghostmysql.core.errors;

import static com.example.ghostmysql.core.config.ConfigKeys.HOST;
import static com.example.ghostmysql.core.config.ConfigKeys.PASSWORD;
import static com.example.ghostmysql.core.config.ConfigKeys.PORT;
import static com.example.ghostmysql.core.config.ConfigKeys.USER;

import com.example.ghostmysql.core.config.ConnectionConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The administrative connection settings are wrong or the server cannot be reached.
 *
 * <p>Names the configuration keys that need attention together with their current values, and the
 * environment whose configuration holds them.
 */
public final class ConfigException extends ProvisioningException {

  static final String UNREACHABLE_HELP =
      "Please ensure that MySQL is installed and reachable. "
          + "You can always re-run `ghost setup` to try again.";

  static final String ACCESS_DENIED_HELP =
      "You can run `ghost config` to re-enter the correct credentials. "
          + "Alternatively you can run `ghost setup` again.";

  private final Map<String, String> config;
  private final String environment;

  public ConfigException(
      final String message,
      final Map<String, String> config,
      final String environment,
      final String help,
      final Throwable cause) {
    super(message, help, cause);
    this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
    this.environment = environment;
  }

  /**
   * Connection refused or host unreachable: points at host and port.
   *
   * @param connection settings used for the failed attempt
   * @param environment current environment name
   * @param cause underlying driver failure
   * @return classified error
   */
  public static ConfigException unreachable(
      final ConnectionConfig connection, final String environment, final Throwable cause) {
    final var keys = new LinkedHashMap<String, String>();
    keys.put(HOST, connection.host());
    keys.put(PORT, connection.displayPort());
    return new ConfigException(messageOf(cause), keys, environment, UNREACHABLE_HELP, cause);
  }

  /**
   * Credentials rejected by the server: points at user and password.
   *
   * @param connection settings used for the failed attempt
   * @param environment current environment name
   * @param cause underlying driver failure
   * @return classified error
   */
  public static ConfigException accessDenied(
      final ConnectionConfig connection, final String environment, final Throwable cause) {
    final var keys = new LinkedHashMap<String, String>();
    keys.put(USER, connection.user());
    keys.put(PASSWORD, connection.password());
    return new ConfigException(messageOf(cause), keys, environment, ACCESS_DENIED_HELP, cause);
  }

  /**
   * Implicated configuration keys and their current values, in display order.
   *
   * @return unmodifiable key to value map
   */
  public Map<String, String> config() {
    return config;
  }

  public String environment() {
    return environment;
  }

  /**
   * Renders the error for a terminal. Password values are masked.
   *
   * @return multi-line description
   */
  public String describe() {
    final var sb = new StringBuilder(getMessage()).append(System.lineSeparator());
    sb.append("Environment: ").append(environment).append(System.lineSeparator());
    config.forEach(
        (key, value) ->
            sb.append("  ")
                .append(key)
                .append(" = ")
                .append(PASSWORD.equals(key) && value != null ? "********" : value)
                .append(System.lineSeparator()));
    help().ifPresent(h -> sb.append(h).append(System.lineSeparator()));
    return sb.toString();
  }

  private static String messageOf(final Throwable cause) {
    return Optional.ofNullable(cause)
        .map(Throwable::getMessage)
        .orElseGet(() -> cause == null ? "Unknown database error" : cause.getClass().getName());
  }
}
