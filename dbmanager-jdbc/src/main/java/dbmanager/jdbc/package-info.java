/**
 * JDBC openers for the engines the manager supports.
 *
 * <p>All three build on {@link dbmanager.spi.AbstractRetryingOpener}: DuckDB adds
 * write-ahead-log checkpoint recovery for read-only opens, SQLite resolves its driver once
 * per process and requests WAL journaling with a busy timeout, and MySQL passes the DSN
 * through unchanged.
 *
 * @see dbmanager.jdbc.DuckDbOpener
 * @see dbmanager.jdbc.SqliteOpener
 * @see dbmanager.jdbc.SqliteDriverResolver
 * @see dbmanager.jdbc.MySqlOpener
 */
package dbmanager.jdbc;
