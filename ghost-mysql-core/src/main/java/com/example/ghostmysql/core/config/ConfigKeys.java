package com.example.ghostmysql.core.config;

/** Keys of the database section in the caller's configuration. */
public final class ConfigKeys {

  public static final String CONNECTION = "database.connection";
  public static final String HOST = CONNECTION + ".host";
  public static final String PORT = CONNECTION + ".port";
  public static final String USER = CONNECTION + ".user";
  public static final String PASSWORD = CONNECTION + ".password";
  public static final String DATABASE = CONNECTION + ".database";

  private ConfigKeys() {}
}
