package com.example.ghostmysql.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.sql.SQLException;
import java.util.function.Predicate;

/**
 * Retry helper for the user-creation loop.
 *
 * <p>Used by both pipelines: the JDBC one calls {@link #onException} directly, the R2DBC one turns
 * the same {@link Policy} into a Reactor retry spec with {@link #toReactor(Policy, Predicate)}.
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /**
   * Supplier that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlExceptionSupplier<T> {
    T get() throws SQLException;
  }

  /**
   * Retry policy. Attempts follow each other without delay.
   *
   * @param maxAttempts maximum number of attempts including the first, {@link #UNBOUNDED} for none
   */
  public record Policy(int maxAttempts) {

    public static final int UNBOUNDED = 0;

    public Policy {
      if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
    }

    /** Retries for as long as the exception stays retryable. */
    public static Policy unbounded() {
      return new Policy(UNBOUNDED);
    }

    /**
     * Creates a capped policy.
     *
     * @param attempts number of attempts (including first), must be >= 1
     * @return capped retry policy
     */
    public static Policy capped(final int attempts) {
      if (attempts < 1) throw new IllegalArgumentException("attempts must be >= 1");
      return new Policy(attempts);
    }

    public boolean isUnbounded() {
      return maxAttempts == UNBOUNDED;
    }

    boolean isExhausted(final long attempt) {
      return !isUnbounded() && attempt >= maxAttempts;
    }
  }

  /**
   * Executes the supplier until it succeeds, the exception is not retryable, or the policy is
   * exhausted.
   *
   * <p>When an exception is thrown and {@code shouldRetry} returns true, runs {@code beforeRetry}
   * and calls the supplier again. The supplier is expected to build a fresh attempt each time.
   *
   * <pre>{@code
   * var credential = Retry.onException(
   *     () -> attemptCreate(connection, config),
   *     MySqlErrorCodes::isDuplicateUser,
   *     () -> logger.log(DEBUG, "user exists, retrying"),
   *     Retry.Policy.unbounded());
   * }</pre>
   *
   * @param supplier operation to execute
   * @param shouldRetry predicate determining whether the exception is retryable
   * @param beforeRetry hook to run before each retry attempt (not before first attempt)
   * @param policy attempt cap
   * @param <T> result type
   * @return the supplier result
   * @throws SQLException the last failure, if it is not retryable or the policy is exhausted
   */
  public static <T> T onException(
      final SqlExceptionSupplier<T> supplier,
      final Predicate<SQLException> shouldRetry,
      final Runnable beforeRetry,
      final Policy policy)
      throws SQLException {
    long attempt = 0;

    while (true) {
      attempt++;
      try {
        return supplier.get();
      } catch (final SQLException ex) {
        if (!shouldRetry.test(ex)) throw ex;
        if (policy.isExhausted(attempt)) {
          LOGGER.log(WARNING, "All {0} attempts failed", attempt);
          throw ex;
        }

        LOGGER.log(DEBUG, "Attempt {0} failed, retrying...", attempt);
        beforeRetry.run();
      }
    }
  }

  /**
   * Builds the Reactor equivalent of a policy. Exhaustion surfaces the last failure itself rather
   * than Reactor's wrapper exception.
   *
   * @param policy attempt cap
   * @param shouldRetry predicate determining whether an error is retryable
   * @return retry spec for {@code Mono#retryWhen}
   */
  public static reactor.util.retry.Retry toReactor(
      final Policy policy, final Predicate<Throwable> shouldRetry) {
    final long maxRetries = policy.isUnbounded() ? Long.MAX_VALUE : policy.maxAttempts() - 1L;
    return reactor.util.retry.Retry.max(maxRetries)
        .filter(shouldRetry)
        .doBeforeRetry(sig -> logRetry(sig.totalRetries() + 1))
        .onRetryExhaustedThrow((spec, sig) -> sig.failure());
  }

  private static void logRetry(final long failedAttempt) {
    LOGGER.log(DEBUG, "Attempt {0} failed, retrying...", failedAttempt);
  }
}
