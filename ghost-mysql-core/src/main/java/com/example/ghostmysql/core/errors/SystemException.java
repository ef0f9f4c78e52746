package com.example.ghostmysql.core.errors;

/** Unexpected database-side failure while creating the user or granting its privileges. */
public final class SystemException extends ProvisioningException {

  public SystemException(final String message, final Throwable cause) {
    super(message, null, cause);
  }
}
