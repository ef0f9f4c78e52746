package com.example.ghostmysql.core.progress;

/** Titles of the steps reported while provisioning the MySQL user. */
public final class StepTitles {

  public static final String STAGE = "Setting up \"ghost\" mysql user";
  public static final String CONNECTING = "Connecting to database";
  public static final String CREATING_USER = "Creating new MySQL user";
  public static final String GRANTING = "Granting new user permissions";
  public static final String SAVING = "Saving new config";

  public static final String NOT_ROOT = "MySQL user is not \"%s\", skipping additional user setup";

  private StepTitles() {}
}
