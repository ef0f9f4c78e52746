package com.example.ghostmysql.cli;

import picocli.CommandLine;

public final class Main {

  private Main() {}

  public static void main(final String[] args) {
    System.exit(new CommandLine(new GhostMysqlCommand()).execute(args));
  }
}
