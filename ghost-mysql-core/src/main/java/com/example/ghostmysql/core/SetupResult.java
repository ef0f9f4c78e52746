package com.example.ghostmysql.core;

import com.example.ghostmysql.core.credentials.ProvisionedCredential;
import java.util.Optional;

/**
 * Outcome of a provisioning run that did not fail.
 *
 * @param status whether the user was created or the stage was skipped
 * @param credential the committed credential, {@code null} when skipped
 */
public record SetupResult(Status status, ProvisionedCredential credential) {

  public enum Status {
    COMPLETED,
    SKIPPED
  }

  public static SetupResult skipped() {
    return new SetupResult(Status.SKIPPED, null);
  }

  public static SetupResult completed(final ProvisionedCredential credential) {
    return new SetupResult(Status.COMPLETED, credential);
  }

  public boolean isSkipped() {
    return status == Status.SKIPPED;
  }

  public Optional<ProvisionedCredential> committedCredential() {
    return Optional.ofNullable(credential);
  }
}
