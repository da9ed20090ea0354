package dbmanager;

import dbmanager.spi.ConnectionFactory;
import dbmanager.spi.ConnectionSpec;

import org.apache.commons.dbcp2.PoolableConnection;
import org.apache.commons.dbcp2.PoolableConnectionFactory;
import org.apache.commons.dbcp2.PoolingDataSource;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Database handle returned by {@link DBManager}: a {@link DataSource} over one engine,
 * connection string and access mode.
 *
 * <p>Backed by a commons-dbcp2 {@link PoolingDataSource}. Physical connections are opened
 * lazily through a {@link ConnectionFactory}. The handle bounds how many are open at once
 * ({@link #setMaxOpenConnections}; {@link #getConnection()} blocks while the limit is
 * reached) and how many released connections it keeps for reuse
 * ({@link #setMaxIdleConnections}; with 0 a released connection is closed immediately).
 *
 * <p>The caller owns the handle and must {@link #close()} it. Closing closes the idle
 * connections at once; a connection still borrowed is closed when it is given back.
 * This class is thread-safe.
 *
 * @see PoolShape
 */
public final class DatabaseHandle implements DataSource, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DatabaseHandle.class.getName());

  /**
   * Idle limit of a handle whose pool shape has not been set.
   */
  public static final int DEFAULT_MAX_IDLE = 2;

  private static final int PING_TIMEOUT_SECONDS = 5;

  private final Engine engine;
  private final AccessMode accessMode;
  private final ConnectionSpec spec;
  private final GenericObjectPool<PoolableConnection> pool;
  private final PoolingDataSource<PoolableConnection> dataSource;

  private volatile int maxOpen;
  private volatile PrintWriter logWriter;
  private volatile int loginTimeout;

  public DatabaseHandle(Engine engine, AccessMode accessMode, ConnectionSpec spec,
      ConnectionFactory connectionFactory) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.accessMode = Objects.requireNonNull(accessMode, "accessMode");
    this.spec = Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(connectionFactory, "connectionFactory");

    PoolableConnectionFactory factory = new PoolableConnectionFactory(() -> {
      Connection conn = connectionFactory.connect(spec.jdbcUrl(), spec.toProperties());
      if (conn == null) {
        throw new SQLException("no suitable driver found for " + spec.jdbcUrl());
      }
      return conn;
    }, null);

    GenericObjectPoolConfig<PoolableConnection> config = new GenericObjectPoolConfig<>();
    config.setJmxEnabled(false);
    config.setMaxTotal(-1);
    config.setMaxIdle(DEFAULT_MAX_IDLE);
    config.setMinIdle(0);

    this.pool = new GenericObjectPool<>(factory, config);
    factory.setPool(pool);
    this.dataSource = new PoolingDataSource<>(pool);
  }

  public Engine engine() {
    return engine;
  }

  public AccessMode accessMode() {
    return accessMode;
  }

  /**
   * Connection string in the engine's own dialect.
   */
  public String connectionString() {
    return spec.connectionString();
  }

  public String jdbcUrl() {
    return spec.jdbcUrl();
  }

  /**
   * Sets the maximum number of simultaneously open connections (0 or less = unlimited).
   * Lowers the idle limit when it would exceed the new maximum.
   */
  public void setMaxOpenConnections(int n) {
    maxOpen = Math.max(0, n);
    pool.setMaxTotal(maxOpen == 0 ? -1 : maxOpen);
    if (maxOpen > 0 && pool.getMaxIdle() > maxOpen) {
      setMaxIdleConnections(maxOpen);
    }
  }

  /**
   * Sets the maximum number of released connections kept for reuse (0 or less = none).
   * Capped at the open-connection limit. When more connections are idle than the new
   * limit allows, the idle ones are closed.
   */
  public void setMaxIdleConnections(int n) {
    int maxIdle = Math.max(0, n);
    if (maxOpen > 0 && maxIdle > maxOpen) {
      maxIdle = maxOpen;
    }
    pool.setMaxIdle(maxIdle);
    if (pool.getNumIdle() > maxIdle) {
      pool.clear();
    }
  }

  public int maxOpenConnections() {
    return maxOpen;
  }

  public int maxIdleConnections() {
    return pool.getMaxIdle();
  }

  /**
   * Number of physical connections currently open (in use or idle).
   */
  public int openConnections() {
    return pool.getNumActive() + pool.getNumIdle();
  }

  public int idleConnections() {
    return pool.getNumIdle();
  }

  public boolean isClosed() {
    return pool.isClosed();
  }

  /**
   * Verifies that a connection can be established and is valid.
   *
   * @throws SQLException if the database is unreachable or the connection is invalid
   */
  public void ping() throws SQLException {
    try (Connection conn = getConnection()) {
      if (!conn.isValid(PING_TIMEOUT_SECONDS)) {
        throw new SQLException("connection to " + spec.connectionString() + " is not valid");
      }
    }
  }

  /**
   * Borrows a connection, blocking while the open-connection limit is reached.
   * Closing the returned connection gives it back to the handle.
   */
  @Override
  public Connection getConnection() throws SQLException {
    if (pool.isClosed()) {
      throw closedError(null);
    }
    try {
      return dataSource.getConnection();
    } catch (IllegalStateException e) {
      if (pool.isClosed()) {
        // Closed while waiting
        throw closedError(e);
      }
      throw e;
    }
  }

  /**
   * Not supported: credentials belong to the connection string.
   */
  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    throw new SQLFeatureNotSupportedException("credentials are part of the connection string");
  }

  /**
   * Closes the handle. Idempotent.
   */
  @Override
  public void close() {
    if (pool.isClosed()) {
      return;
    }
    try {
      dataSource.close();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close " + engine + " handle for " + spec.connectionString(), e);
    }
  }

  private SQLException closedError(Throwable cause) {
    return new SQLException("database handle for " + spec.connectionString() + " is closed", cause);
  }

  @Override
  public PrintWriter getLogWriter() {
    return logWriter;
  }

  @Override
  public void setLogWriter(PrintWriter out) {
    this.logWriter = out;
  }

  @Override
  public void setLoginTimeout(int seconds) {
    this.loginTimeout = seconds;
  }

  @Override
  public int getLoginTimeout() {
    return loginTimeout;
  }

  @Override
  public Logger getParentLogger() {
    return Logger.getLogger("dbmanager");
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) {
      return iface.cast(this);
    }
    throw new SQLException("DatabaseHandle does not wrap " + iface.getName());
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return iface.isInstance(this);
  }

  @Override
  public String toString() {
    return "DatabaseHandle{engine=" + engine + ", connectionString=" + spec.connectionString() +
        ", mode=" + accessMode + "}";
  }
}
