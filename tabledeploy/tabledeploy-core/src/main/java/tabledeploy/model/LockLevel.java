package tabledeploy.model;

/**
 * The granularity at which the data-table service enforces optimistic concurrency, from no enforcement to
 * one lock version per individual value.
 */
public enum LockLevel {
  NONE,
  DATA_TABLE,
  PRIMARY_VALUE,
  ATTRIBUTE,
  VALUE;

  public boolean requiresLockVersion() {
    return this != NONE;
  }
}
