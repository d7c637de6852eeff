package com.scholary.audiosync.ledger;

/** Lifecycle of a sync session. Transitions only from IN_PROGRESS to a terminal state, once. */
public enum SessionStatus {
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String dbValue;

  SessionStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }

  public static SessionStatus fromDb(String value) {
    for (SessionStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown session status: " + value);
  }
}
