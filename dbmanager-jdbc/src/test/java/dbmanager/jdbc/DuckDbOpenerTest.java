package dbmanager.jdbc;

import dbmanager.AccessMode;
import dbmanager.DBManager;
import dbmanager.DatabaseHandle;
import dbmanager.DatabaseOpenException;
import dbmanager.Engine;
import dbmanager.OpenOptions;
import dbmanager.spi.ConnectionFactory;
import dbmanager.spi.ConnectionSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuckDbOpenerTest {

  private static final String STALE_WAL = "IO Error: Cannot open database in read-only mode: WAL needs replay";

  @TempDir
  Path dir;

  private String dbPath;
  private final RecordingLogger log = new RecordingLogger();
  private final RecordingSleeper sleeper = new RecordingSleeper();

  @BeforeEach
  void createDatabaseFile() throws IOException {
    dbPath = Files.createFile(dir.resolve("cache.duckdb")).toString();
  }

  private DBManager manager(ConnectionFactory factory) {
    return DBManager.builder()
        .defaultEngine(Engine.DUCKDB)
        .logger(log)
        .connectionFactory(factory)
        .sleeper(sleeper)
        .opener(new DuckDbOpener())
        .build();
  }

  @Test
  void connectionStringCarriesAccessMode() {
    assertEquals("/data/a.duckdb", DuckDbOpener.connectionString("/data/a.duckdb", AccessMode.READ_WRITE));
    assertEquals("/data/a.duckdb?access_mode=read_only",
        DuckDbOpener.connectionString("/data/a.duckdb", AccessMode.READ_ONLY));
  }

  @Test
  void readOnlySpecSetsDriverProperty() {
    ConnectionSpec ro = DuckDbOpener.spec("/data/a.duckdb", AccessMode.READ_ONLY);
    ConnectionSpec rw = DuckDbOpener.spec("/data/a.duckdb", AccessMode.READ_WRITE);

    assertEquals("jdbc:duckdb:/data/a.duckdb", ro.jdbcUrl());
    assertEquals("true", ro.properties().get(DuckDbOpener.READ_ONLY_PROPERTY));
    assertEquals("jdbc:duckdb:/data/a.duckdb", rw.jdbcUrl());
    assertTrue(rw.properties().isEmpty());
  }

  @Test
  void staleWriteAheadLogIsCheckpointedOnce() throws SQLException {
    // read-only opens fail until a writer has connected
    ScriptedConnectionFactory factory = new ScriptedConnectionFactory((call, history) ->
        call.readOnly() && history.stream().noneMatch(c -> !c.readOnly()) ? STALE_WAL : null);

    try (DatabaseHandle handle = manager(factory).openReadOnly(dbPath);
         Connection conn = handle.getConnection()) {
      assertTrue(conn.isValid(1));
      assertEquals(AccessMode.READ_ONLY, handle.accessMode());
      assertEquals(dbPath + "?access_mode=read_only", handle.connectionString());
    }

    assertEquals(1, log.count("open attempt 1/8 failed for " + dbPath));
    assertEquals(1, log.count("checkpoint recovery"));
    assertEquals(1, log.count("[DB] checkpoint recovery succeeded for " + dbPath));
    assertEquals(List.of(400L), sleeper.delays());
    assertTrue(factory.count(c -> !c.readOnly()) >= 1);
  }

  @Test
  void recoveryIsAttemptedAtMostOncePerCall() {
    ScriptedConnectionFactory factory = new ScriptedConnectionFactory((call, history) ->
        call.readOnly() ? STALE_WAL : null);

    DatabaseOpenException e = assertThrows(DatabaseOpenException.class,
        () -> manager(factory).openReadOnly(dbPath));

    assertEquals(DatabaseOpenException.Reason.RETRIES_EXHAUSTED, e.reason());
    assertTrue(e.recoveryAttempted());
    assertTrue(e.getMessage().endsWith("; checkpoint recovery was attempted"), e.getMessage());
    assertEquals(8, log.count("open attempt"));
    assertEquals(1, log.count("checkpoint recovery succeeded"));
    assertEquals(8, factory.count(ScriptedConnectionFactory.Call::readOnly));
  }

  @Test
  void failedCheckpointDoesNotAbortRetries() throws SQLException {
    // writers are always refused; the third read-only attempt succeeds
    ScriptedConnectionFactory factory = new ScriptedConnectionFactory((call, history) -> {
      if (!call.readOnly()) {
        return "Could not set lock on file";
      }
      long previousReadOnly = history.stream().filter(ScriptedConnectionFactory.Call::readOnly).count();
      return previousReadOnly < 2 ? STALE_WAL : null;
    });

    try (DatabaseHandle handle = manager(factory).openReadOnly(dbPath)) {
      handle.ping();
    }

    assertEquals(2, log.count("open attempt"));
    assertEquals(1, log.count("[DB] checkpoint recovery failed for " + dbPath + ": Could not set lock on file"));
    assertEquals(0, log.count("checkpoint recovery succeeded"));
    assertEquals(1, factory.count(c -> !c.readOnly()));
    assertEquals(List.of(400L, 800L), sleeper.delays());
  }

  @Test
  void driverRuntimeErrorDuringCheckpointIsNotFatal() throws SQLException {
    ScriptedConnectionFactory scripted = new ScriptedConnectionFactory((call, history) ->
        history.isEmpty() ? STALE_WAL : null);
    ConnectionFactory factory = (url, info) -> {
      if (!"true".equals(info.getProperty(DuckDbOpener.READ_ONLY_PROPERTY))) {
        throw new IllegalStateException("native library failed to load");
      }
      return scripted.connect(url, info);
    };

    try (DatabaseHandle handle = manager(factory).openReadOnly(dbPath)) {
      assertFalse(handle.isClosed());
    }

    assertEquals(1, log.count("open attempt"));
    assertEquals(1, log.count("checkpoint recovery failed for " + dbPath + ": native library failed to load"));
  }

  @Test
  void missingFileIsNeverRecovered() {
    String missing = dir.resolve("missing.duckdb").toString();
    ScriptedConnectionFactory factory = ScriptedConnectionFactory.alwaysFailing(
        "IO Error: Cannot open database \"" + missing + "\" in read-only mode: database does not exist");

    DatabaseOpenException e = assertThrows(DatabaseOpenException.class,
        () -> manager(factory).openReadOnly(missing));

    assertEquals(DatabaseOpenException.Reason.RETRIES_EXHAUSTED, e.reason());
    assertEquals(Engine.DUCKDB, e.engine());
    assertTrue(e.getMessage().contains(missing), e.getMessage());
    assertTrue(e.getMessage().contains("after 8 retries"), e.getMessage());
    assertFalse(e.recoveryAttempted());
    assertEquals(8, log.count("open attempt"));
    assertEquals(0, log.count("checkpoint recovery"));
    assertEquals(8, factory.count(ScriptedConnectionFactory.Call::readOnly));
    assertEquals(8, factory.calls().size());
    assertEquals(7, sleeper.delays().size());
  }

  @Test
  void databaseFileExistsOnlyForRegularFiles() {
    assertTrue(DuckDbOpener.databaseFileExists(dbPath));
    assertFalse(DuckDbOpener.databaseFileExists(dir.toString()));
    assertFalse(DuckDbOpener.databaseFileExists(dir.resolve("missing.duckdb").toString()));
    assertFalse(DuckDbOpener.databaseFileExists("bad\u0000path"));
  }

  @Test
  void writableOpenNeverRecovers() {
    ScriptedConnectionFactory factory = ScriptedConnectionFactory.alwaysFailing("Could not set lock on file");

    DatabaseOpenException e = assertThrows(DatabaseOpenException.class,
        () -> manager(factory).openWritable(dbPath));

    assertFalse(e.recoveryAttempted());
    assertEquals(0, log.count("checkpoint recovery"));
    assertEquals(8, factory.calls().size());
  }

  @Test
  void explicitRetryBudgetIsHonoured() {
    ScriptedConnectionFactory factory = ScriptedConnectionFactory.alwaysFailing("Could not set lock on file");

    DatabaseOpenException e = assertThrows(DatabaseOpenException.class,
        () -> manager(factory).open(OpenOptions.builder(dbPath).maxRetries(3).retryBaseMs(50).build()));

    assertEquals(3, e.attempts());
    assertEquals(List.of(50L, 100L), sleeper.delays());
  }

  @Test
  void openNewMakesSingleAttempt() {
    ScriptedConnectionFactory factory = ScriptedConnectionFactory.alwaysFailing("driver failure");

    DatabaseOpenException e = assertThrows(DatabaseOpenException.class,
        () -> manager(factory).openNew(dir.resolve("new.duckdb").toString()));

    assertEquals(1, e.attempts());
    assertEquals(1, factory.calls().size());
    assertTrue(sleeper.delays().isEmpty());
    assertTrue(e.getMessage().contains("driver failure"));
  }
}
