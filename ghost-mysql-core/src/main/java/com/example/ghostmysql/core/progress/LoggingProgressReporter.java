package com.example.ghostmysql.core.progress;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

/** {@link ProgressReporter} that writes every event to a {@link System.Logger}. */
public final class LoggingProgressReporter implements ProgressReporter {

  private static final System.Logger LOGGER =
      System.getLogger(LoggingProgressReporter.class.getName());

  @Override
  public void started(final String title) {
    LOGGER.log(INFO, "{0} ...", title);
  }

  @Override
  public void succeeded(final String title) {
    LOGGER.log(INFO, "{0} done", title);
  }

  @Override
  public void failed(final String title, final Throwable error) {
    LOGGER.log(WARNING, "{0} failed: {1}", title, error.getMessage());
  }

  @Override
  public void skipped(final String title, final String reason) {
    LOGGER.log(INFO, "{0} skipped: {1}", title, reason);
  }
}
