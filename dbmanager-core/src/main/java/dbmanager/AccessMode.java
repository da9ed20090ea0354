package dbmanager;

/**
 * Whether a handle may write to the underlying database.
 */
public enum AccessMode {
  READ_WRITE,
  READ_ONLY;

  public boolean isReadOnly() {
    return this == READ_ONLY;
  }
}
