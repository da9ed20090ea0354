package dbmanager;

import dbmanager.spi.EngineOpener;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry of engine openers discovered on the classpath.
 *
 * <p>Openers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/dbmanager.spi.EngineOpener}. When two providers claim the same
 * engine the first one found wins.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Opener for one engine
 * EngineOpener opener = EngineOpeners.get(Engine.DUCKDB);
 *
 * // Lookup table used by DBManager
 * Map<Engine, EngineOpener> table = EngineOpeners.byEngine();
 * }</pre>
 */
public final class EngineOpeners {

  private static final List<EngineOpener> OPENERS;
  private static final Map<Engine, EngineOpener> BY_ENGINE;

  static {
    OPENERS = ServiceLoader.load(EngineOpener.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    Map<Engine, EngineOpener> byEngine = new EnumMap<>(Engine.class);
    for (EngineOpener opener : OPENERS) {
      byEngine.putIfAbsent(opener.engine(), opener);
    }
    BY_ENGINE = Collections.unmodifiableMap(byEngine);
  }

  private EngineOpeners() {
  }

  /**
   * Returns all registered openers.
   */
  public static List<EngineOpener> all() {
    return OPENERS;
  }

  /**
   * Registered openers keyed by engine.
   */
  public static Map<Engine, EngineOpener> byEngine() {
    return BY_ENGINE;
  }

  public static Optional<EngineOpener> find(Engine engine) {
    return Optional.ofNullable(BY_ENGINE.get(engine));
  }

  /**
   * Gets the opener for an engine.
   *
   * @throws IllegalArgumentException if no opener is registered for it
   */
  public static EngineOpener get(Engine engine) {
    EngineOpener opener = BY_ENGINE.get(engine);
    if (opener == null) {
      throw new IllegalArgumentException("No opener registered for engine: " + engine +
          ". Available: " + BY_ENGINE.keySet());
    }
    return opener;
  }
}
