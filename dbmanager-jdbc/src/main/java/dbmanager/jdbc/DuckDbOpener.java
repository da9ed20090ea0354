package dbmanager.jdbc;

import dbmanager.AccessMode;
import dbmanager.DatabaseHandle;
import dbmanager.Engine;
import dbmanager.OpenOptions;
import dbmanager.spi.AbstractRetryingOpener;
import dbmanager.spi.ConnectionSpec;
import dbmanager.spi.OpenContext;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opener for the embedded DuckDB engine.
 *
 * <p>DuckDB refuses to open a file read-only while an uncheckpointed write-ahead log sits
 * next to it, because replaying the log needs write access. A writer that exited without
 * checkpointing leaves the file in that state. On the first failed read-only attempt of a
 * call this opener therefore opens the same file read-write, runs {@code CHECKPOINT} and
 * closes it again before retrying. The recovery runs at most once per call and its failure
 * is logged, never thrown. A missing file is never recovered, so a read-only open does not
 * create one.
 */
public final class DuckDbOpener extends AbstractRetryingOpener {
  private static final Logger logger = Logger.getLogger(DuckDbOpener.class.getName());

  static final String URL_PREFIX = "jdbc:duckdb:";
  static final String READ_ONLY_PROPERTY = "duckdb.read_only";
  static final String CHECKPOINT_SQL = "CHECKPOINT";

  @Override
  public Engine engine() {
    return Engine.DUCKDB;
  }

  @Override
  protected ConnectionSpec connectionSpec(OpenOptions options, OpenContext context) {
    return spec(options.path(), options.mode());
  }

  /**
   * Only read-only opens of a database file that already exists; opening a missing file
   * read-write would create it.
   */
  @Override
  protected boolean canRecover(OpenOptions options) {
    return options.mode().isReadOnly() && databaseFileExists(options.path());
  }

  @Override
  protected void recover(OpenOptions options, OpenContext context) {
    String path = options.path();
    try (DatabaseHandle handle = connect(spec(path, AccessMode.READ_WRITE), AccessMode.READ_WRITE, context);
         Connection conn = handle.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute(CHECKPOINT_SQL);
      context.logger().log("[DB] checkpoint recovery succeeded for " + path);
      logger.info(() -> "Checkpointed write-ahead log of " + path);
    } catch (SQLException | RuntimeException e) {
      context.logger().log("[DB] checkpoint recovery failed for " + path + ": " + e.getMessage());
      logger.log(Level.WARNING, "Checkpoint recovery failed for " + path, e);
    }
  }

  static boolean databaseFileExists(String path) {
    try {
      return Files.isRegularFile(Path.of(path));
    } catch (InvalidPathException e) {
      return false;
    }
  }

  static ConnectionSpec spec(String path, AccessMode mode) {
    if (mode.isReadOnly()) {
      return new ConnectionSpec(connectionString(path, mode), URL_PREFIX + path,
          Map.of(READ_ONLY_PROPERTY, "true"));
    }
    return ConnectionSpec.of(connectionString(path, mode), URL_PREFIX + path);
  }

  /**
   * DuckDB connection string: {@code <path>} or {@code <path>?access_mode=read_only}.
   */
  public static String connectionString(String path, AccessMode mode) {
    return mode.isReadOnly() ? path + "?access_mode=read_only" : path;
  }
}
