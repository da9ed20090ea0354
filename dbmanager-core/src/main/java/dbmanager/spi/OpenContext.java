package dbmanager.spi;

import dbmanager.DbLogger;
import dbmanager.OpenOptions;
import dbmanager.retry.LinearBackoffRetryPolicy;
import dbmanager.retry.RetryPolicy;

import java.util.Objects;

/**
 * Collaborators an {@link EngineOpener} uses for one open call.
 *
 * @param logger            diagnostic sink
 * @param connectionFactory source of physical connections
 * @param sleeper           backoff wait
 * @param defaultMaxRetries attempts used when the options leave {@code maxRetries} unset
 * @param defaultRetryBaseMs backoff base used when the options leave {@code retryBaseMs} unset
 */
public record OpenContext(
    DbLogger logger,
    ConnectionFactory connectionFactory,
    Sleeper sleeper,
    int defaultMaxRetries,
    long defaultRetryBaseMs
) {

  public OpenContext {
    logger = logger != null ? logger : DbLogger.NOOP;
    Objects.requireNonNull(connectionFactory, "connectionFactory");
    Objects.requireNonNull(sleeper, "sleeper");
    if (defaultMaxRetries <= 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be > 0, got: " + defaultMaxRetries);
    }
    if (defaultRetryBaseMs < 0) {
      throw new IllegalArgumentException("defaultRetryBaseMs must be >= 0, got: " + defaultRetryBaseMs);
    }
  }

  /**
   * Context with the JDBC {@code DriverManager}, real sleeping and the built-in retry defaults.
   */
  public static OpenContext defaults(DbLogger logger) {
    return new OpenContext(logger, ConnectionFactory.DRIVER_MANAGER, Sleeper.THREAD,
        LinearBackoffRetryPolicy.DEFAULT_MAX_RETRIES, LinearBackoffRetryPolicy.DEFAULT_BASE_MS);
  }

  public RetryPolicy retryPolicyFor(OpenOptions options) {
    return LinearBackoffRetryPolicy.forOptions(options, defaultMaxRetries, defaultRetryBaseMs);
  }
}
