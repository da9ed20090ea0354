package dbmanager;

/**
 * Connection limits applied to a {@link DatabaseHandle}.
 *
 * <p>{@link #SINGLE_CONNECTION} is applied to every handle the manager returns: one open
 * connection at most and none kept idle, so the engine's file lock is released the moment
 * the caller closes the connection. Callers needing concurrent access open several handles
 * or serialize access themselves.
 *
 * @param maxOpen maximum simultaneously open connections (0 = unlimited)
 * @param maxIdle maximum released connections kept for reuse
 */
public record PoolShape(int maxOpen, int maxIdle) {

  public static final PoolShape SINGLE_CONNECTION = new PoolShape(1, 0);

  public PoolShape {
    if (maxOpen < 0) {
      throw new IllegalArgumentException("maxOpen must be >= 0, got: " + maxOpen);
    }
    if (maxIdle < 0) {
      throw new IllegalArgumentException("maxIdle must be >= 0, got: " + maxIdle);
    }
  }

  /**
   * Applies these limits to a freshly opened handle.
   */
  public void enforce(DatabaseHandle handle) {
    handle.setMaxIdleConnections(maxIdle);
    handle.setMaxOpenConnections(maxOpen);
  }
}
