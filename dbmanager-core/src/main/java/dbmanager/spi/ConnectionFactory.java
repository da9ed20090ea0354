package dbmanager.spi;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens physical JDBC connections; the seam between the manager and the drivers the
 * embedding application has registered.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see #DRIVER_MANAGER
 */
@FunctionalInterface
public interface ConnectionFactory {

  /**
   * Factory delegating to {@link DriverManager#getConnection(String, Properties)}.
   */
  ConnectionFactory DRIVER_MANAGER = DriverManager::getConnection;

  /**
   * Opens a new physical connection.
   *
   * @param jdbcUrl JDBC URL
   * @param info    driver connection properties (never {@code null})
   * @return an open connection; the caller must close it
   * @throws SQLException if no registered driver accepts the URL or the connection fails
   */
  Connection connect(String jdbcUrl, Properties info) throws SQLException;
}
