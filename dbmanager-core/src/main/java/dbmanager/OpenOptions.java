package dbmanager;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call options for {@link DBManager#open(OpenOptions)}.
 *
 * <p>The meaning of {@link #path()} depends on the engine: a filesystem path for the
 * embedded engines and an opaque DSN for {@link Engine#MYSQL}. It is passed through
 * without parsing or validation.
 *
 * <p>Zero values of {@code maxRetries} and {@code retryBaseMs} select the defaults of the
 * manager (8 attempts and 400 ms unless configured otherwise). A {@code null} engine selects
 * the manager's default engine.
 *
 * <p>Create instances via {@link #builder(String)}.
 */
public final class OpenOptions {
  private final Engine engine;
  private final String path;
  private final AccessMode mode;
  private final int maxRetries;
  private final long retryBaseMs;
  private final Duration timeout;

  private OpenOptions(Builder builder) {
    this.engine = builder.engine;
    this.path = Objects.requireNonNull(builder.path, "path");
    this.mode = builder.mode != null ? builder.mode : AccessMode.READ_WRITE;
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    if (builder.retryBaseMs < 0) {
      throw new IllegalArgumentException("retryBaseMs must be >= 0, got: " + builder.retryBaseMs);
    }
    if (builder.timeout != null && builder.timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0");
    }
    this.maxRetries = builder.maxRetries;
    this.retryBaseMs = builder.retryBaseMs;
    this.timeout = builder.timeout;
  }

  public static Builder builder(String path) {
    return new Builder(path);
  }

  /**
   * Engine to open, or {@code null} to use the manager default.
   */
  public Engine engine() {
    return engine;
  }

  public String path() {
    return path;
  }

  public AccessMode mode() {
    return mode;
  }

  /**
   * Maximum number of connection attempts; 0 selects the default.
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Linear backoff base in milliseconds; 0 selects the default.
   */
  public long retryBaseMs() {
    return retryBaseMs;
  }

  /**
   * Upper bound on the whole open call, or {@code null} when bounded only by retries.
   */
  public Duration timeout() {
    return timeout;
  }

  public OpenOptions withEngine(Engine engine) {
    return toBuilder().engine(engine).build();
  }

  public OpenOptions withMode(AccessMode mode) {
    return toBuilder().mode(mode).build();
  }

  public OpenOptions withMaxRetries(int maxRetries) {
    return toBuilder().maxRetries(maxRetries).build();
  }

  public Builder toBuilder() {
    return new Builder(path)
        .engine(engine)
        .mode(mode)
        .maxRetries(maxRetries)
        .retryBaseMs(retryBaseMs)
        .timeout(timeout);
  }

  @Override
  public String toString() {
    return "OpenOptions{engine=" + engine + ", path=" + path + ", mode=" + mode +
        ", maxRetries=" + maxRetries + ", retryBaseMs=" + retryBaseMs +
        ", timeout=" + timeout + "}";
  }

  public static final class Builder {
    private Engine engine;
    private final String path;
    private AccessMode mode;
    private int maxRetries;
    private long retryBaseMs;
    private Duration timeout;

    private Builder(String path) {
      this.path = path;
    }

    public Builder engine(Engine engine) {
      this.engine = engine;
      return this;
    }

    public Builder mode(AccessMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder readOnly() {
      return mode(AccessMode.READ_ONLY);
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder retryBaseMs(long retryBaseMs) {
      this.retryBaseMs = retryBaseMs;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public OpenOptions build() {
      return new OpenOptions(this);
    }
  }
}
