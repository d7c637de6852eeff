package com.scholary.audiosync.ledger;

/** Running counters of a sync session. */
public record SessionCounters(
    int totalFiles,
    int syncedFiles,
    int failedFiles,
    int skippedFiles,
    long totalBytes,
    long syncedBytes) {

  public SessionCounters {
    if (totalFiles < 0 || syncedFiles < 0 || failedFiles < 0 || skippedFiles < 0) {
      throw new IllegalArgumentException("File counters cannot be negative");
    }
    if (totalBytes < 0 || syncedBytes < 0) {
      throw new IllegalArgumentException("Byte counters cannot be negative");
    }
  }

  public static SessionCounters empty() {
    return new SessionCounters(0, 0, 0, 0, 0, 0);
  }

  public SessionCounters plus(SessionCounters other) {
    return new SessionCounters(
        totalFiles + other.totalFiles,
        syncedFiles + other.syncedFiles,
        failedFiles + other.failedFiles,
        skippedFiles + other.skippedFiles,
        totalBytes + other.totalBytes,
        syncedBytes + other.syncedBytes);
  }
}
