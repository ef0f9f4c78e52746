package com.example.ghostmysql.core.credentials;

/** Source of candidate usernames and passwords for the application user. */
public interface CredentialGenerator {

  /** Next candidate username. Successive calls may repeat earlier values. */
  String username();

  /** A fresh password. */
  String password();

  /**
   * Generates a complete candidate.
   *
   * @return username and password pair
   */
  default ProvisionedCredential next() {
    return new ProvisionedCredential(username(), password());
  }
}
