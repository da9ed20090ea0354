package dbmanager.jdbc;

import dbmanager.AccessMode;
import dbmanager.DBManager;
import dbmanager.DatabaseHandle;
import dbmanager.DatabaseOpenException;
import dbmanager.Engine;
import dbmanager.spi.ConnectionSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SqliteOpenerTest {

  private final RecordingLogger log = new RecordingLogger();
  private final RecordingSleeper sleeper = new RecordingSleeper();

  private DBManager manager(ScriptedConnectionFactory factory, SqliteDriverResolver resolver) {
    return DBManager.builder()
        .defaultEngine(Engine.SQLITE)
        .logger(log)
        .connectionFactory(factory)
        .sleeper(sleeper)
        .opener(new SqliteOpener(resolver))
        .build();
  }

  @Test
  void writableConnectionString() {
    assertEquals("/data/app.db?_journal_mode=WAL&_busy_timeout=5000",
        SqliteOpener.connectionString("/data/app.db", AccessMode.READ_WRITE));
  }

  @Test
  void readOnlyFlagAppearsExactlyOnce() {
    String cs = SqliteOpener.connectionString("/data/app.db", AccessMode.READ_ONLY);

    assertEquals("/data/app.db?_journal_mode=WAL&_busy_timeout=5000&mode=ro", cs);
    assertEquals(cs.indexOf("mode=ro"), cs.lastIndexOf("mode=ro"));
    assertFalse(SqliteOpener.connectionString("/data/app.db", AccessMode.READ_WRITE).contains("mode=ro"));
  }

  @Test
  void specUsesUriFilenameAndPragmaProperties() {
    ConnectionSpec rw = SqliteOpener.spec("sqlite", "/data/app.db", AccessMode.READ_WRITE);
    ConnectionSpec ro = SqliteOpener.spec("sqldroid", "/data/app.db", AccessMode.READ_ONLY);

    assertEquals("jdbc:sqlite:file:/data/app.db?_journal_mode=WAL&_busy_timeout=5000", rw.jdbcUrl());
    assertEquals("5000", rw.properties().get("busy_timeout"));
    assertEquals("WAL", rw.properties().get("journal_mode"));

    assertEquals("jdbc:sqldroid:file:/data/app.db?_journal_mode=WAL&_busy_timeout=5000&mode=ro", ro.jdbcUrl());
    assertEquals("5000", ro.properties().get("busy_timeout"));
    assertFalse(ro.properties().containsKey("journal_mode"));
  }

  @Test
  void opensWithResolvedDriver() {
    ScriptedConnectionFactory factory = new ScriptedConnectionFactory((call, history) ->
        call.url().startsWith("jdbc:sqldroid:") ? null : "No suitable driver found for " + call.url());
    SqliteDriverResolver resolver = new SqliteDriverResolver(List.of("sqlite", "sqldroid"));

    DBManager db = manager(factory, resolver);
    try (DatabaseHandle handle = db.openReadOnly("/data/app.db")) {
      assertEquals(Engine.SQLITE, handle.engine());
      assertEquals("jdbc:sqldroid:file:/data/app.db?_journal_mode=WAL&_busy_timeout=5000&mode=ro",
          handle.jdbcUrl());
    }

    ScriptedConnectionFactory.Call open = factory.calls().get(2);
    Properties info = open.info();
    assertEquals("5000", info.getProperty("busy_timeout"));
    assertTrue(log.lines().isEmpty());
  }

  @Test
  void missingDriverFailsBeforeAnyAttempt() {
    ScriptedConnectionFactory factory = ScriptedConnectionFactory.alwaysFailing("No suitable driver");
    SqliteDriverResolver resolver = new SqliteDriverResolver(SqliteDriverResolver.DEFAULT_CANDIDATES);

    DatabaseOpenException e = assertThrows(DatabaseOpenException.class,
        () -> manager(factory, resolver).openWritable("/data/app.db"));

    assertEquals(DatabaseOpenException.Reason.NO_DRIVER, e.reason());
    assertEquals(0, e.attempts());
    assertTrue(e.getMessage().contains("sqlite"), e.getMessage());
    assertEquals(0, log.count("open attempt"));
    assertTrue(sleeper.delays().isEmpty());
    assertEquals(List.of("jdbc:sqlite::memory:", "jdbc:sqldroid::memory:"),
        factory.calls().stream().map(ScriptedConnectionFactory.Call::url).toList());
  }

  @Test
  void lockedDatabaseIsRetried() {
    ScriptedConnectionFactory factory = new ScriptedConnectionFactory((call, history) ->
        call.url().contains(":memory:") || history.size() > 3 ? null : "[SQLITE_BUSY] database is locked");
    SqliteDriverResolver resolver = new SqliteDriverResolver(SqliteDriverResolver.DEFAULT_CANDIDATES);

    try (DatabaseHandle handle = manager(factory, resolver).openWritable("/data/app.db")) {
      assertEquals(1, handle.maxOpenConnections());
    }

    assertEquals(3, log.count("[DB] sqlite open attempt"));
    assertEquals(List.of(400L, 800L, 1200L), sleeper.delays());
  }
}
