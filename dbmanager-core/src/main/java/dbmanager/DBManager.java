package dbmanager;

import dbmanager.retry.LinearBackoffRetryPolicy;
import dbmanager.spi.ConnectionFactory;
import dbmanager.spi.EngineOpener;
import dbmanager.spi.OpenContext;
import dbmanager.spi.Sleeper;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Single entry point for opening database handles on any supported {@link Engine}.
 *
 * <p>The manager holds a default engine, a {@link DbLogger} and a lookup table of
 * {@link EngineOpener}s. {@link #open(OpenOptions)} resolves the engine, dispatches to its
 * opener and returns a fresh {@link DatabaseHandle} owned by the caller; the manager keeps
 * no reference to it.
 *
 * <p>Instances are immutable and may be shared. Every open call is synchronous and may block
 * for the whole backoff budget of the call.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DBManager db = DBManager.create(Engine.DUCKDB, System.out::println);
 * try (DatabaseHandle handle = db.openReadOnly("/data/cache/sales.duckdb");
 *      Connection conn = handle.getConnection()) {
 *   // query
 * }
 * }</pre>
 *
 * @see OpenOptions
 * @see EngineOpeners
 */
public final class DBManager {
  private static final Logger logger = Logger.getLogger(DBManager.class.getName());

  private final Engine defaultEngine;
  private final DbLogger dbLogger;
  private final Map<Engine, EngineOpener> openers;
  private final OpenContext context;

  private DBManager(Builder builder) {
    this.defaultEngine = Objects.requireNonNull(builder.defaultEngine, "defaultEngine");
    this.dbLogger = builder.logger != null ? builder.logger : DbLogger.NOOP;
    Map<Engine, EngineOpener> table = new EnumMap<>(Engine.class);
    table.putAll(EngineOpeners.byEngine());
    table.putAll(builder.openers);
    this.openers = Collections.unmodifiableMap(table);
    this.context = new OpenContext(
        dbLogger,
        builder.connectionFactory != null ? builder.connectionFactory : ConnectionFactory.DRIVER_MANAGER,
        builder.sleeper != null ? builder.sleeper : Sleeper.THREAD,
        builder.defaultMaxRetries,
        builder.defaultRetryBaseMs);
  }

  /**
   * Creates a manager with the classpath openers, the JDBC {@code DriverManager} and the
   * built-in retry defaults.
   *
   * @param defaultEngine engine used when options do not name one
   * @param logger        diagnostic sink, or {@code null} to discard diagnostics
   */
  public static DBManager create(Engine defaultEngine, DbLogger logger) {
    return builder().defaultEngine(defaultEngine).logger(logger).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Engine defaultEngine() {
    return defaultEngine;
  }

  public DbLogger logger() {
    return dbLogger;
  }

  /**
   * Engines this manager can dispatch to.
   */
  public Set<Engine> supportedEngines() {
    return openers.keySet();
  }

  /**
   * Opens a handle with explicit options.
   *
   * @throws DatabaseOpenException with reason {@code UNSUPPORTED_ENGINE} if no opener is
   *     registered for the engine (no attempt is made), or whatever the opener raises
   */
  public DatabaseHandle open(OpenOptions options) {
    Objects.requireNonNull(options, "options");
    Engine engine = options.engine() != null ? options.engine() : defaultEngine;
    EngineOpener opener = openers.get(engine);
    if (opener == null) {
      throw DatabaseOpenException.unsupportedEngine(engine, options.path());
    }
    OpenOptions resolved = options.engine() == engine ? options : options.withEngine(engine);
    logger.fine(() -> "Opening " + resolved);
    return opener.open(resolved, context);
  }

  /**
   * Opens {@code path} read-only on the default engine with default retry settings.
   */
  public DatabaseHandle openReadOnly(String path) {
    return open(OpenOptions.builder(path).mode(AccessMode.READ_ONLY).build());
  }

  /**
   * Opens {@code path} read-write on the default engine with default retry settings.
   */
  public DatabaseHandle openWritable(String path) {
    return open(OpenOptions.builder(path).mode(AccessMode.READ_WRITE).build());
  }

  /**
   * Opens a file that was just created and cannot be contended for yet: read-write,
   * exactly one attempt, never sleeps.
   */
  public DatabaseHandle openNew(String path) {
    return open(OpenOptions.builder(path).mode(AccessMode.READ_WRITE).maxRetries(1).build());
  }

  public static final class Builder {
    private Engine defaultEngine = Engine.DUCKDB;
    private DbLogger logger;
    private ConnectionFactory connectionFactory;
    private Sleeper sleeper;
    private int defaultMaxRetries = LinearBackoffRetryPolicy.DEFAULT_MAX_RETRIES;
    private long defaultRetryBaseMs = LinearBackoffRetryPolicy.DEFAULT_BASE_MS;
    private final Map<Engine, EngineOpener> openers = new EnumMap<>(Engine.class);

    private Builder() {
    }

    public Builder defaultEngine(Engine defaultEngine) {
      this.defaultEngine = defaultEngine;
      return this;
    }

    public Builder logger(DbLogger logger) {
      this.logger = logger;
      return this;
    }

    public Builder connectionFactory(ConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Registers an opener, replacing any classpath opener for the same engine.
     */
    public Builder opener(EngineOpener opener) {
      Objects.requireNonNull(opener, "opener");
      openers.put(Objects.requireNonNull(opener.engine(), "opener.engine()"), opener);
      return this;
    }

    /**
     * Retry settings used when options leave {@code maxRetries} or {@code retryBaseMs} at 0.
     */
    public Builder retryDefaults(int maxRetries, long baseMs) {
      if (maxRetries <= 0) {
        throw new IllegalArgumentException("maxRetries must be > 0, got: " + maxRetries);
      }
      if (baseMs < 0) {
        throw new IllegalArgumentException("baseMs must be >= 0, got: " + baseMs);
      }
      this.defaultMaxRetries = maxRetries;
      this.defaultRetryBaseMs = baseMs;
      return this;
    }

    public DBManager build() {
      return new DBManager(this);
    }
  }
}
