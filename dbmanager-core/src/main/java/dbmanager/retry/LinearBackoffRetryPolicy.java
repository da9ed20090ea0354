package dbmanager.retry;

import dbmanager.OpenOptions;

/**
 * Retry policy with linear backoff and no jitter.
 *
 * <p>Delay formula: {@code baseDelay * attempt}, so the total wait over {@code n} attempts
 * is bounded by {@code baseDelay * n(n+1)/2}. Short-lived file locks (virus scanners, a
 * previous process still flushing) usually clear within that window.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  public static final int DEFAULT_MAX_RETRIES = 8;
  public static final long DEFAULT_BASE_MS = 400L;

  private final int maxAttempts;
  private final long baseDelayMs;

  /**
   * @param maxAttempts maximum number of attempts (must be > 0)
   * @param baseDelayMs delay after the first failed attempt (milliseconds)
   */
  public LinearBackoffRetryPolicy(int maxAttempts, long baseDelayMs) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
    }
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMs = baseDelayMs;
  }

  /**
   * Policy for the given options, substituting {@link #DEFAULT_MAX_RETRIES} and
   * {@link #DEFAULT_BASE_MS} for unset (zero) values.
   */
  public static LinearBackoffRetryPolicy forOptions(OpenOptions options) {
    return forOptions(options, DEFAULT_MAX_RETRIES, DEFAULT_BASE_MS);
  }

  /**
   * Policy for the given options, substituting the supplied defaults for unset (zero) values.
   */
  public static LinearBackoffRetryPolicy forOptions(OpenOptions options,
      int defaultMaxRetries, long defaultBaseMs) {
    int retries = options.maxRetries() > 0 ? options.maxRetries() : defaultMaxRetries;
    long base = options.retryBaseMs() > 0 ? options.retryBaseMs() : defaultBaseMs;
    return new LinearBackoffRetryPolicy(retries, base);
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    // Guard against overflow for absurd bases
    if (baseDelayMs != 0 && attempts > Long.MAX_VALUE / baseDelayMs) {
      return Long.MAX_VALUE;
    }
    return baseDelayMs * attempts;
  }

  /**
   * Total time spent sleeping if every attempt fails (no sleep follows the last attempt
   * of the loop, but the bound includes it).
   */
  public long worstCaseWaitMs() {
    return baseDelayMs * maxAttempts * (maxAttempts + 1L) / 2;
  }

  @Override
  public String toString() {
    return "LinearBackoffRetryPolicy{maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs + "}";
  }
}
