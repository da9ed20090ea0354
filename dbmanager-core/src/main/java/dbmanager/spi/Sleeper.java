package dbmanager.spi;

/**
 * Blocking wait used between connection attempts.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = Thread::sleep;

  /**
   * Blocks the calling thread.
   *
   * @param millis time to wait in milliseconds
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  void sleep(long millis) throws InterruptedException;
}
