package com.example.ghostmysql.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ghostmysql.core.config.ConfigKeys;
import com.example.ghostmysql.core.config.ConfigStore;
import com.example.ghostmysql.core.credentials.ProvisionedCredential;

/** Writes the provisioned credential into the caller's configuration and saves it. */
public final class CredentialCommitter {

  private static final System.Logger LOGGER =
      System.getLogger(CredentialCommitter.class.getName());

  private final ConfigStore store;

  public CredentialCommitter(final ConfigStore store) {
    this.store = store;
  }

  /**
   * Replaces the configured database user and password and saves the configuration. Store
   * failures propagate unchanged.
   *
   * @param credential credential to persist
   */
  public void commit(final ProvisionedCredential credential) {
    store
        .set(ConfigKeys.USER, credential.username())
        .set(ConfigKeys.PASSWORD, credential.password())
        .save();
    LOGGER.log(DEBUG, "MySQL: saved credentials of user {0}", credential.username());
  }
}
