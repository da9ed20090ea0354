/**
 * Service provider interfaces for plugging engines and drivers into the manager.
 *
 * <p>{@link dbmanager.spi.EngineOpener} is the per-engine strategy, usually built on
 * {@link dbmanager.spi.AbstractRetryingOpener}. {@link dbmanager.spi.ConnectionFactory} is the
 * driver seam and {@link dbmanager.spi.Sleeper} the backoff wait; both are carried to the
 * opener in an {@link dbmanager.spi.OpenContext}.
 *
 * @see dbmanager.spi.EngineOpener
 * @see dbmanager.spi.AbstractRetryingOpener
 */
package dbmanager.spi;
