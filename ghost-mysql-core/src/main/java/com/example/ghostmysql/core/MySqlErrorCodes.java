package com.example.ghostmysql.core;

import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcPermissionDeniedException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps MySQL failures raised by JDBC ({@link SQLException}) or R2DBC ({@link R2dbcException}) to
 * the few conditions the provisioner reacts to.
 */
public final class MySqlErrorCodes {

  /** {@code ER_ACCESS_DENIED_ERROR}. */
  public static final int ER_ACCESS_DENIED_ERROR = 1045;

  /** {@code ER_CANNOT_USER}: CREATE USER for an account that already exists. */
  public static final int ER_CANNOT_USER = 1396;

  private static final String SQL_STATE_ACCESS_DENIED = "28000";

  private static final String[] ACCESS_DENIED_KEYWORDS = {"access denied"};

  private static final String[] UNREACHABLE_KEYWORDS = {
    "connection refused", "no route to host", "unknown host"
  };

  /** Conditions the pipeline distinguishes. */
  public enum Failure {
    /** The server could not be reached. */
    CONNECTION_REFUSED,
    /** The server rejected the credentials. */
    ACCESS_DENIED,
    /** The account already exists. */
    DUPLICATE_USER,
    /** Anything else. */
    OTHER
  }

  private MySqlErrorCodes() {}

  /**
   * Classifies a failure by walking its cause chain. Vendor codes and SQL states win over exception
   * types, which win over message keywords.
   *
   * @param error failure raised by a driver, may be {@code null}
   * @return the matching condition, {@link Failure#OTHER} when nothing matches
   */
  public static Failure classify(final Throwable error) {
    if (error == null) return Failure.OTHER;

    for (Throwable cur = error; cur != null; cur = next(cur)) {
      final var vendor = vendorCode(cur);
      if (vendor == ER_CANNOT_USER) return Failure.DUPLICATE_USER;
      if (vendor == ER_ACCESS_DENIED_ERROR
          || SQL_STATE_ACCESS_DENIED.equals(sqlState(cur))
          || cur instanceof R2dbcPermissionDeniedException) {
        return Failure.ACCESS_DENIED;
      }
    }

    for (Throwable cur = error; cur != null; cur = next(cur)) {
      if (cur instanceof ConnectException
          || cur instanceof NoRouteToHostException
          || cur instanceof UnknownHostException) {
        return Failure.CONNECTION_REFUSED;
      }
    }

    for (Throwable cur = error; cur != null; cur = next(cur)) {
      final var msg = cur.getMessage();
      if (msg == null) continue;
      final var lower = msg.toLowerCase(Locale.ROOT);
      for (final var keyword : ACCESS_DENIED_KEYWORDS)
        if (lower.contains(keyword)) return Failure.ACCESS_DENIED;
      for (final var keyword : UNREACHABLE_KEYWORDS)
        if (lower.contains(keyword)) return Failure.CONNECTION_REFUSED;
    }

    return Failure.OTHER;
  }

  /**
   * Whether the failure means the requested account already exists.
   *
   * @param error failure to check
   * @return true on MySQL error 1396
   */
  public static boolean isDuplicateUser(final Throwable error) {
    return classify(error) == Failure.DUPLICATE_USER;
  }

  private static int vendorCode(final Throwable t) {
    if (t instanceof SQLException sql) return sql.getErrorCode();
    if (t instanceof R2dbcException r2dbc) return r2dbc.getErrorCode();
    return 0;
  }

  private static String sqlState(final Throwable t) {
    if (t instanceof SQLException sql) return sql.getSQLState();
    if (t instanceof R2dbcException r2dbc) return r2dbc.getSqlState();
    return null;
  }

  private static Throwable next(final Throwable t) {
    final var cause = t.getCause();
    return cause == t ? null : cause;
  }
}
