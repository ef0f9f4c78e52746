package com.example.ghostmysql.core.errors;

import java.util.Optional;

/**
 * Base type for the user-facing failures raised while provisioning the application user.
 *
 * <p>Subclasses carry enough context for a command line front end to tell the user what went wrong
 * and how to fix it.
 */
public abstract class ProvisioningException extends RuntimeException {

  private final String help;

  protected ProvisioningException(final String message, final String help, final Throwable cause) {
    super(message, cause);
    this.help = help;
  }

  /**
   * Remediation hint for the user, if any.
   *
   * @return help text
   */
  public Optional<String> help() {
    return Optional.ofNullable(help);
  }
}
