package com.example.ghostmysql.cli;

import com.example.ghostmysql.core.progress.ProgressReporter;
import java.io.PrintStream;

/** Prints one line per step event. */
final class ConsoleProgressReporter implements ProgressReporter {

  private final PrintStream out;

  ConsoleProgressReporter(final PrintStream out) {
    this.out = out;
  }

  @Override
  public void started(final String title) {
    out.println("> " + title);
  }

  @Override
  public void succeeded(final String title) {
    out.println("+ " + title);
  }

  @Override
  public void failed(final String title, final Throwable error) {
    out.println("x " + title);
  }

  @Override
  public void skipped(final String title, final String reason) {
    out.println("- " + title + " (" + reason + ")");
  }
}
