package dbmanager.jdbc;

import dbmanager.AccessMode;
import dbmanager.DatabaseOpenException;
import dbmanager.Engine;
import dbmanager.OpenOptions;
import dbmanager.spi.AbstractRetryingOpener;
import dbmanager.spi.ConnectionSpec;
import dbmanager.spi.OpenContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opener for the embedded SQLite engine.
 *
 * <p>Connections always request WAL journaling and a driver-level busy timeout, which
 * absorbs short lock contention inside the driver; the retry loop covers longer windows.
 * The driver is resolved once through a {@link SqliteDriverResolver}; when none is
 * registered the call fails before any attempt.
 *
 * <p>The JDBC URL is an SQLite URI ({@code jdbc:<driver>:file:<connection string>}) so that
 * {@code mode=ro} is honoured by SQLite itself. The same settings are also passed as
 * driver properties for drivers that read pragmas from properties.
 */
public final class SqliteOpener extends AbstractRetryingOpener {
  static final int BUSY_TIMEOUT_MS = 5000;

  private final SqliteDriverResolver resolver;

  public SqliteOpener() {
    this(SqliteDriverResolver.shared());
  }

  public SqliteOpener(SqliteDriverResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  @Override
  public Engine engine() {
    return Engine.SQLITE;
  }

  @Override
  protected ConnectionSpec connectionSpec(OpenOptions options, OpenContext context) {
    String driverId = resolver.resolve(context.connectionFactory())
        .orElseThrow(() -> DatabaseOpenException.noDriver(Engine.SQLITE, options.path(),
            "tried " + resolver.candidates()));
    return spec(driverId, options.path(), options.mode());
  }

  static ConnectionSpec spec(String driverId, String path, AccessMode mode) {
    String connectionString = connectionString(path, mode);
    Map<String, String> properties = new LinkedHashMap<>();
    properties.put("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
    if (!mode.isReadOnly()) {
      // Switching journal mode needs write access
      properties.put("journal_mode", "WAL");
    }
    return new ConnectionSpec(connectionString, "jdbc:" + driverId + ":file:" + connectionString, properties);
  }

  /**
   * SQLite connection string: {@code <path>?_journal_mode=WAL&_busy_timeout=5000}, with
   * {@code &mode=ro} appended when read-only.
   */
  public static String connectionString(String path, AccessMode mode) {
    StringBuilder sb = new StringBuilder(path)
        .append("?_journal_mode=WAL&_busy_timeout=").append(BUSY_TIMEOUT_MS);
    if (mode.isReadOnly()) {
      sb.append("&mode=ro");
    }
    return sb.toString();
  }
}
