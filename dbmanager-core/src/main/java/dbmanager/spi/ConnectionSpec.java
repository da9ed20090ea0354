package dbmanager.spi;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine-specific description of how to reach a database.
 *
 * @param connectionString engine dialect connection string (logged and exposed on the handle)
 * @param jdbcUrl          JDBC URL handed to the {@link ConnectionFactory}
 * @param properties       driver connection properties
 */
public record ConnectionSpec(String connectionString, String jdbcUrl, Map<String, String> properties) {

  public ConnectionSpec {
    Objects.requireNonNull(connectionString, "connectionString");
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  public static ConnectionSpec of(String connectionString, String jdbcUrl) {
    return new ConnectionSpec(connectionString, jdbcUrl, Map.of());
  }

  /**
   * Fresh {@link Properties} copy for a driver call.
   */
  public Properties toProperties() {
    Properties info = new Properties();
    info.putAll(properties);
    return info;
  }
}
