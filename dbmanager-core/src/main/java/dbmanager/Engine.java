package dbmanager;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Database engines the manager can open.
 *
 * <p>Each engine carries a stable string identifier ({@code "duckdb"}, {@code "sqlite"},
 * {@code "mysql"}) that is safe to persist in configuration and compare across processes.
 *
 * <ul>
 *   <li>{@link #DUCKDB}: embedded analytical engine; {@code path} is a file path.
 *   <li>{@link #SQLITE}: embedded row-store engine; {@code path} is a file path.
 *   <li>{@link #MYSQL}: network relational engine; {@code path} is an opaque DSN.
 * </ul>
 */
public enum Engine {
  DUCKDB("duckdb"),
  SQLITE("sqlite"),
  MYSQL("mysql");

  private final String id;

  Engine(String id) {
    this.id = id;
  }

  /**
   * Stable identifier of this engine.
   */
  public String id() {
    return id;
  }

  /**
   * Parses an engine identifier (case-insensitive).
   *
   * @param id engine identifier, e.g. {@code "duckdb"}
   * @return the engine
   * @throws IllegalArgumentException if the identifier is unknown
   */
  public static Engine fromId(String id) {
    Objects.requireNonNull(id, "id");
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    for (Engine engine : values()) {
      if (engine.id.equals(normalized)) {
        return engine;
      }
    }
    throw new IllegalArgumentException("Unknown engine: " + id +
        ". Available: " + Arrays.stream(values()).map(Engine::id).toList());
  }

  @Override
  public String toString() {
    return id;
  }
}
