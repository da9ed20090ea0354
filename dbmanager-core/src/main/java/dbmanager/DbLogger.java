package dbmanager;

/**
 * Sink for human-readable diagnostic lines emitted while opening a database
 * (failed attempts, checkpoint recovery outcome).
 *
 * <p>Nothing in this library serializes calls to the sink. A logger shared by threads that
 * open databases concurrently must be thread-safe itself.
 *
 * <p>The {@link #NOOP} instance discards all lines.
 */
@FunctionalInterface
public interface DbLogger {

  /**
   * No-op instance that discards all lines.
   */
  DbLogger NOOP = line -> {
  };

  void log(String line);
}
