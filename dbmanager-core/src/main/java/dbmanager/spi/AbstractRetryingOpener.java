package dbmanager.spi;

import dbmanager.AccessMode;
import dbmanager.DatabaseHandle;
import dbmanager.DatabaseOpenException;
import dbmanager.OpenOptions;
import dbmanager.PoolShape;
import dbmanager.retry.RetryPolicy;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base opener implementing the shared "connect with retries" loop.
 *
 * <p>Each attempt creates a {@link DatabaseHandle} for the engine's {@link ConnectionSpec},
 * applies {@link PoolShape#SINGLE_CONNECTION} and pings it. A failed attempt closes the
 * handle, logs one line to the {@link dbmanager.DbLogger}, gives the subclass one chance per
 * call to repair the database ({@link #canRecover}/{@link #recover}) and waits the policy's
 * linear backoff before the next attempt. No wait follows the last attempt.
 *
 * <p>The wait is cancelled by interrupting the calling thread or by the optional
 * {@link OpenOptions#timeout()}; both raise {@link DatabaseOpenException.Reason#CANCELLED}.
 */
public abstract class AbstractRetryingOpener implements EngineOpener {
  private static final Logger logger = Logger.getLogger(AbstractRetryingOpener.class.getName());

  @Override
  public final DatabaseHandle open(OpenOptions options, OpenContext context) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(context, "context");

    ConnectionSpec spec = connectionSpec(options, context);
    RetryPolicy policy = context.retryPolicyFor(options);
    int maxAttempts = policy.maxAttempts();
    long deadlineNanos = deadline(options.timeout());

    SQLException lastError = null;
    boolean recoveryAttempted = false;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        DatabaseHandle handle = connect(spec, options.mode(), context);
        if (attempt > 1) {
          logger.fine(() -> engine() + " database at " + options.path() + " opened after retries");
        }
        return handle;
      } catch (SQLException e) {
        lastError = e;
        context.logger().log("[DB] " + engine() + " open attempt " + attempt + "/" + maxAttempts +
            " failed for " + options.path() + ": " + e.getMessage());
        logger.log(Level.FINE, engine() + " open attempt " + attempt + " failed for " + options.path(), e);
      }

      if (!recoveryAttempted && canRecover(options)) {
        recoveryAttempted = true;
        recover(options, context);
      }

      if (attempt < maxAttempts) {
        backoff(policy.computeDelayMs(attempt), deadlineNanos, options, context, attempt, lastError);
      }
    }

    logger.warning(() -> "Giving up on " + engine() + " database at " + options.path() +
        " after " + maxAttempts + " attempts");
    throw DatabaseOpenException.retriesExhausted(engine(), options.path(), maxAttempts,
        lastError, recoveryAttempted);
  }

  /**
   * Builds the engine-specific connection description. Called once per open call, before
   * the first attempt; throwing here fails the call without any attempt.
   */
  protected abstract ConnectionSpec connectionSpec(OpenOptions options, OpenContext context);

  /**
   * Whether a failed attempt should trigger the one recovery step allowed per call.
   * Default: never.
   */
  protected boolean canRecover(OpenOptions options) {
    return false;
  }

  /**
   * Repairs the database after a failed attempt. Failures must be logged, not thrown:
   * recovery never aborts the retry loop.
   */
  protected void recover(OpenOptions options, OpenContext context) {
  }

  /**
   * Creates a single-connection handle for {@code spec} and verifies it with a ping.
   * The handle is closed again if the ping fails.
   */
  protected final DatabaseHandle connect(ConnectionSpec spec, AccessMode mode, OpenContext context)
      throws SQLException {
    DatabaseHandle handle = new DatabaseHandle(engine(), mode, spec, context.connectionFactory());
    try {
      PoolShape.SINGLE_CONNECTION.enforce(handle);
      handle.ping();
      return handle;
    } catch (SQLException | RuntimeException e) {
      handle.close();
      throw e;
    }
  }

  private void backoff(long delayMs, long deadlineNanos, OpenOptions options, OpenContext context,
      int attempt, SQLException lastError) {
    if (deadlineNanos != Long.MAX_VALUE) {
      long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
      if (delayMs > remainingMs) {
        throw DatabaseOpenException.cancelled(engine(), options.path(), attempt,
            "timeout of " + options.timeout().toMillis() + " ms exceeded", lastError);
      }
    }
    try {
      context.sleeper().sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      DatabaseOpenException cancelled = DatabaseOpenException.cancelled(engine(), options.path(),
          attempt, "interrupted", e);
      if (lastError != null) {
        cancelled.addSuppressed(lastError);
      }
      throw cancelled;
    }
  }

  private static long deadline(Duration timeout) {
    if (timeout == null) {
      return Long.MAX_VALUE;
    }
    try {
      return Math.addExact(System.nanoTime(), timeout.toNanos());
    } catch (ArithmeticException e) {
      // Beyond the nanosecond range: no effective deadline
      return Long.MAX_VALUE;
    }
  }
}
