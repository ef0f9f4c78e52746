package com.example.ghostmysql.core.progress;

import java.sql.SQLException;

/**
 * Receives progress of the named steps of a stage.
 *
 * <p>{@link #step(String, Step)} covers the blocking pipeline; the reactive pipeline calls the
 * individual callbacks from its signal hooks.
 */
public interface ProgressReporter {

  void started(String title);

  void succeeded(String title);

  void failed(String title, Throwable error);

  void skipped(String title, String reason);

  /**
   * Runs one step, reporting its start and its outcome.
   *
   * @param title step title
   * @param step work to run
   * @param <T> step result type
   * @return the step result
   * @throws SQLException if the step fails with one
   */
  default <T> T step(final String title, final Step<T> step) throws SQLException {
    started(title);
    try {
      final var result = step.run();
      succeeded(title);
      return result;
    } catch (final SQLException | RuntimeException e) {
      failed(title, e);
      throw e;
    }
  }

  /**
   * Work performed by a step.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface Step<T> {
    T run() throws SQLException;
  }
}
