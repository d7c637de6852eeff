package com.scholary.audiosync.ledger;

/** Outcome of one file sync attempt. */
public enum FileSyncStatus {
  PENDING("pending"),
  SUCCESS("success"),
  FAILED("failed"),
  SKIPPED("skipped");

  private final String dbValue;

  FileSyncStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static FileSyncStatus fromDb(String value) {
    for (FileSyncStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sync status: " + value);
  }
}
