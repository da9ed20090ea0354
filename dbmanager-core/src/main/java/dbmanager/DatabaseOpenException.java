package dbmanager;

/**
 * Unchecked exception raised when {@link DBManager} cannot produce a live handle.
 *
 * <p>{@link #reason()} tells callers whether the failure was a programming or deployment
 * error that was never retried ({@link Reason#UNSUPPORTED_ENGINE}, {@link Reason#NO_DRIVER}),
 * a transient failure that outlived the retry budget ({@link Reason#RETRIES_EXHAUSTED}),
 * or an interrupted/deadline-bounded wait ({@link Reason#CANCELLED}). The cause, when
 * present, is the last error reported by the driver.
 */
public final class DatabaseOpenException extends RuntimeException {

  public enum Reason {
    UNSUPPORTED_ENGINE,
    NO_DRIVER,
    RETRIES_EXHAUSTED,
    CANCELLED
  }

  private final Reason reason;
  private final Engine engine;
  private final String path;
  private final int attempts;
  private final boolean recoveryAttempted;

  private DatabaseOpenException(String message, Throwable cause, Reason reason, Engine engine,
      String path, int attempts, boolean recoveryAttempted) {
    super(message, cause);
    this.reason = reason;
    this.engine = engine;
    this.path = path;
    this.attempts = attempts;
    this.recoveryAttempted = recoveryAttempted;
  }

  public static DatabaseOpenException unsupportedEngine(Engine engine, String path) {
    return new DatabaseOpenException("unsupported database engine: " + engine,
        null, Reason.UNSUPPORTED_ENGINE, engine, path, 0, false);
  }

  public static DatabaseOpenException noDriver(Engine engine, String path, String detail) {
    return new DatabaseOpenException("no usable " + engine + " driver registered: " + detail,
        null, Reason.NO_DRIVER, engine, path, 0, false);
  }

  public static DatabaseOpenException retriesExhausted(Engine engine, String path, int attempts,
      Throwable lastError, boolean recoveryAttempted) {
    String message = "failed to open " + engine + " database at " + path +
        " after " + attempts + " retries: " + describe(lastError);
    if (recoveryAttempted) {
      message += "; checkpoint recovery was attempted";
    }
    return new DatabaseOpenException(message, lastError, Reason.RETRIES_EXHAUSTED,
        engine, path, attempts, recoveryAttempted);
  }

  public static DatabaseOpenException cancelled(Engine engine, String path, int attempts,
      String why, Throwable cause) {
    return new DatabaseOpenException("opening " + engine + " database at " + path +
        " cancelled after " + attempts + " attempts: " + why, cause, Reason.CANCELLED,
        engine, path, attempts, false);
  }

  public Reason reason() {
    return reason;
  }

  public Engine engine() {
    return engine;
  }

  public String path() {
    return path;
  }

  /**
   * Number of connection attempts made before giving up (0 when none were made).
   */
  public int attempts() {
    return attempts;
  }

  /**
   * Whether a write-ahead-log checkpoint recovery was attempted during the call.
   */
  public boolean recoveryAttempted() {
    return recoveryAttempted;
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
  }
}
