package dbmanager.jdbc;

import dbmanager.spi.ConnectionFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds which SQLite JDBC driver is actually registered and working.
 *
 * <p>Candidates are JDBC sub-protocols tried in order by opening and validating an
 * in-memory database ({@code jdbc:<id>::memory:}). The first that works is remembered and
 * returned by every later call without probing again. A failed resolution is not
 * remembered, so a driver registered later is still found.
 *
 * <p>Resolution is serialized: concurrent first callers test the candidates once and all observe the
 * same result. {@link #shared()} is the process-wide instance used by the default
 * {@link SqliteOpener}.
 */
public final class SqliteDriverResolver {
  private static final Logger logger = Logger.getLogger(SqliteDriverResolver.class.getName());

  /**
   * xerial sqlite-jdbc first, then SQLDroid.
   */
  public static final List<String> DEFAULT_CANDIDATES = List.of("sqlite", "sqldroid");

  private static final int CHECK_TIMEOUT_SECONDS = 2;
  private static final SqliteDriverResolver SHARED = new SqliteDriverResolver(DEFAULT_CANDIDATES);

  private final List<String> candidates;
  private final Object lock = new Object();
  private volatile String resolved;

  public SqliteDriverResolver(List<String> candidates) {
    Objects.requireNonNull(candidates, "candidates");
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("candidates must not be empty");
    }
    this.candidates = List.copyOf(candidates);
  }

  public static SqliteDriverResolver shared() {
    return SHARED;
  }

  public List<String> candidates() {
    return candidates;
  }

  /**
   * The driver identifier found by an earlier resolution, if any.
   */
  public Optional<String> cached() {
    return Optional.ofNullable(resolved);
  }

  /**
   * Returns the working driver identifier, probing the candidates on first use.
   *
   * @param connectionFactory used to try the candidates
   * @return the identifier, or empty if no candidate works
   */
  public Optional<String> resolve(ConnectionFactory connectionFactory) {
    String cached = resolved;
    if (cached != null) {
      return Optional.of(cached);
    }
    synchronized (lock) {
      if (resolved != null) {
        return Optional.of(resolved);
      }
      for (String candidate : candidates) {
        if (isUsable(connectionFactory, candidate)) {
          resolved = candidate;
          logger.info(() -> "Using SQLite JDBC driver '" + candidate + "'");
          return Optional.of(candidate);
        }
      }
      logger.warning(() -> "No SQLite JDBC driver registered; tried " + candidates);
      return Optional.empty();
    }
  }

  static String candidateUrl(String driverId) {
    return "jdbc:" + driverId + "::memory:";
  }

  private static boolean isUsable(ConnectionFactory connectionFactory, String driverId) {
    try (Connection conn = connectionFactory.connect(candidateUrl(driverId), new Properties())) {
      return conn != null && conn.isValid(CHECK_TIMEOUT_SECONDS);
    } catch (SQLException e) {
      logger.log(Level.FINE, "SQLite driver candidate '" + driverId + "' unavailable", e);
      return false;
    }
  }
}
