package com.example.ghostmysql.core;

/** Where a provisioning run currently is. */
public enum SetupPhase {
  IDLE,
  CONNECTING,
  CREATING_USER,
  GRANTING_PRIVILEGES,
  COMMITTING,
  DONE,
  /** Absorbing state after any non-collision failure. */
  FAILED,
  /** The administrative user is not the root-equivalent user; nothing was done. */
  SKIPPED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED || this == SKIPPED;
  }
}
