package com.example.ghostmysql.core;

import java.util.Optional;

/**
 * Tunables of the provisioning stage.
 *
 * <p>{@link #fromEnvironment()} resolves every value from a system property, then an environment
 * variable, then the default:
 *
 * <ul>
 *   <li>ghost.mysql.root-user / GHOST_MYSQL_ROOT_USER (default {@code root})
 *   <li>ghost.mysql.user.prefix / GHOST_MYSQL_USER_PREFIX (default {@code ghost-})
 *   <li>ghost.mysql.user.range / GHOST_MYSQL_USER_RANGE (default 1000)
 *   <li>ghost.mysql.user.max-attempts / GHOST_MYSQL_USER_MAX_ATTEMPTS (default 0 = unbounded)
 *   <li>ghost.mysql.password.length / GHOST_MYSQL_PASSWORD_LENGTH (default 10)
 * </ul>
 *
 * @param rootUser administrative user name that enables the stage
 * @param usernamePrefix prefix of generated usernames
 * @param usernameRange generated usernames end in a number in {@code [0, usernameRange)}
 * @param maxUserAttempts cap on {@code CREATE USER} attempts, 0 for no cap
 * @param passwordLength length of generated passwords
 */
public record ProvisionerSettings(
    String rootUser,
    String usernamePrefix,
    int usernameRange,
    int maxUserAttempts,
    int passwordLength) {

  public static final String DEFAULT_ROOT_USER = "root";
  public static final String DEFAULT_USERNAME_PREFIX = "ghost-";
  public static final int DEFAULT_USERNAME_RANGE = 1000;
  public static final int DEFAULT_PASSWORD_LENGTH = 10;

  public ProvisionerSettings {
    if (rootUser == null || rootUser.isBlank())
      throw new IllegalArgumentException("rootUser is required");
    if (usernamePrefix == null) throw new IllegalArgumentException("usernamePrefix is required");
    if (usernameRange < 1) throw new IllegalArgumentException("usernameRange must be >= 1");
    if (maxUserAttempts < 0) throw new IllegalArgumentException("maxUserAttempts must be >= 0");
    if (passwordLength < 4) throw new IllegalArgumentException("passwordLength must be >= 4");
  }

  public static ProvisionerSettings defaults() {
    return new ProvisionerSettings(
        DEFAULT_ROOT_USER,
        DEFAULT_USERNAME_PREFIX,
        DEFAULT_USERNAME_RANGE,
        Retry.Policy.UNBOUNDED,
        DEFAULT_PASSWORD_LENGTH);
  }

  public static ProvisionerSettings fromEnvironment() {
    return new ProvisionerSettings(
        setting("ghost.mysql.root-user", "GHOST_MYSQL_ROOT_USER").orElse(DEFAULT_ROOT_USER),
        setting("ghost.mysql.user.prefix", "GHOST_MYSQL_USER_PREFIX")
            .orElse(DEFAULT_USERNAME_PREFIX),
        intSetting("ghost.mysql.user.range", "GHOST_MYSQL_USER_RANGE", DEFAULT_USERNAME_RANGE),
        intSetting(
            "ghost.mysql.user.max-attempts",
            "GHOST_MYSQL_USER_MAX_ATTEMPTS",
            Retry.Policy.UNBOUNDED),
        intSetting(
            "ghost.mysql.password.length", "GHOST_MYSQL_PASSWORD_LENGTH", DEFAULT_PASSWORD_LENGTH));
  }

  /** Retry policy for username collisions derived from {@link #maxUserAttempts()}. */
  public Retry.Policy collisionPolicy() {
    return maxUserAttempts == Retry.Policy.UNBOUNDED
        ? Retry.Policy.unbounded()
        : Retry.Policy.capped(maxUserAttempts);
  }

  private static Optional<String> setting(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim);
  }

  private static int intSetting(final String property, final String env, final int fallback) {
    return setting(property, env)
        .map(
            val -> {
              try {
                return Integer.parseInt(val);
              } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(property + " must be a number, was: " + val, e);
              }
            })
        .orElse(fallback);
  }
}
