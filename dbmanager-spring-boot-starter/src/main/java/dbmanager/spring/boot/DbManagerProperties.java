package dbmanager.spring.boot;

import dbmanager.Engine;
import dbmanager.retry.LinearBackoffRetryPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the database connection manager.
 *
 * @see DbManagerAutoConfiguration
 */
@ConfigurationProperties(prefix = "dbmanager")
public class DbManagerProperties {

  /**
   * Whether to create a {@code DBManager} bean.
   */
  private boolean enabled = true;

  /**
   * Engine used when a caller does not name one: duckdb, sqlite or mysql.
   */
  private Engine defaultEngine = Engine.DUCKDB;

  private final Retry retry = new Retry();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Engine getDefaultEngine() {
    return defaultEngine;
  }

  public void setDefaultEngine(Engine defaultEngine) {
    this.defaultEngine = defaultEngine;
  }

  public Retry getRetry() {
    return retry;
  }

  public static class Retry {
    /**
     * Connection attempts per open call when the caller leaves it unset.
     */
    private int maxRetries = LinearBackoffRetryPolicy.DEFAULT_MAX_RETRIES;

    /**
     * Linear backoff base in milliseconds when the caller leaves it unset.
     */
    private long baseDelayMs = LinearBackoffRetryPolicy.DEFAULT_BASE_MS;

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }
  }
}
