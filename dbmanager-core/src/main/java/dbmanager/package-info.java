/**
 * Engine-agnostic database connection manager.
 *
 * <p>{@link dbmanager.DBManager} opens {@link dbmanager.DatabaseHandle}s on DuckDB, SQLite
 * or MySQL behind one entry point, retrying with linear backoff when the database is
 * locked or unreachable and, for read-only DuckDB opens, checkpointing a leftover
 * write-ahead log once per call.
 *
 * @see dbmanager.DBManager
 * @see dbmanager.OpenOptions
 * @see dbmanager.DatabaseOpenException
 */
package dbmanager;
