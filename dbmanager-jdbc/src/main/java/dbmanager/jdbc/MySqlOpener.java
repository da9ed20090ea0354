package dbmanager.jdbc;

import dbmanager.Engine;
import dbmanager.OpenOptions;
import dbmanager.spi.AbstractRetryingOpener;
import dbmanager.spi.ConnectionSpec;
import dbmanager.spi.OpenContext;

/**
 * Opener for a MySQL server.
 *
 * <p>The path is an opaque DSN (a {@code jdbc:mysql:} URL carrying host, schema and
 * credentials) and is passed to the driver verbatim. Retries here cover transient network
 * and authentication failures while the server is still starting.
 */
public final class MySqlOpener extends AbstractRetryingOpener {

  @Override
  public Engine engine() {
    return Engine.MYSQL;
  }

  @Override
  protected ConnectionSpec connectionSpec(OpenOptions options, OpenContext context) {
    return ConnectionSpec.of(options.path(), options.path());
  }
}
