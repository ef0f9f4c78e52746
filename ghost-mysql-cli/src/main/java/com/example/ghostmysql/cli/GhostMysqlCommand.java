package com.example.ghostmysql.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Command(
    name = "ghost-mysql",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Provisions the MySQL user a Ghost install connects with",
    subcommands = {SetupCommand.class})
public class GhostMysqlCommand implements Runnable {

  @Spec CommandSpec spec;

  @Override
  public void run() {
    throw new ParameterException(spec.commandLine(), "Missing required subcommand");
  }
}
