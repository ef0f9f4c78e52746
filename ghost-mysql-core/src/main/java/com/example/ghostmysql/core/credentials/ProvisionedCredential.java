package com.example.ghostmysql.core.credentials;

import java.util.Objects;

/**
 * Username and password of the application user created by the provisioner.
 *
 * @param username generated account name, e.g. {@code ghost-417}
 * @param password generated password
 */
public record ProvisionedCredential(String username, String password) {

  public ProvisionedCredential {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  @Override
  public String toString() {
    return "ProvisionedCredential[username=" + username + ", password=********]";
  }
}
