package dbmanager.retry;

/**
 * Strategy for bounding connection attempts and computing the delay between them.
 *
 * @see LinearBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Maximum number of connection attempts for one open call (at least 1).
   */
  int maxAttempts();

  /**
   * Computes the delay in milliseconds to wait after a failed attempt.
   *
   * @param attempts the number of attempts so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempts);
}
