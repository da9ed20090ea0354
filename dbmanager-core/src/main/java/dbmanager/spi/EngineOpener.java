package dbmanager.spi;

import dbmanager.DatabaseHandle;
import dbmanager.DatabaseOpenException;
import dbmanager.Engine;
import dbmanager.OpenOptions;

/**
 * SPI for engine-specific "connect with retries" strategies.
 *
 * <p>Implementations are discovered via {@code META-INF/services/dbmanager.spi.EngineOpener}
 * or registered explicitly on {@link dbmanager.DBManager.Builder#opener(EngineOpener)}.
 * They must be stateless apart from process-wide caches and safe to call from several
 * threads at once.
 *
 * @see AbstractRetryingOpener
 * @see dbmanager.EngineOpeners
 */
public interface EngineOpener {

  /**
   * Engine handled by this opener.
   */
  Engine engine();

  /**
   * Opens a live handle, blocking through the retry budget if needed.
   *
   * @param options per-call options; {@code options.engine()} is already resolved
   * @param context collaborators for this call
   * @return a handle whose pool shape is single-connection and whose liveness was verified
   * @throws DatabaseOpenException if no live handle can be produced
   */
  DatabaseHandle open(OpenOptions options, OpenContext context);
}
