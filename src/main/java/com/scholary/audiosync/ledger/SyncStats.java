package com.scholary.audiosync.ledger;

import java.time.Instant;
import java.util.List;

/** Aggregated ledger statistics. Computed from a full scan, so callers get a cached copy. */
public record SyncStats(
    long totalSessions,
    long successfulFiles,
    long bytesSynced,
    long uniqueFingerprints,
    long filesToday,
    long bytesToday,
    long failuresLast7Days,
    List<ExtensionTotal> byExtension,
    Instant computedAt) {

  public SyncStats {
    byExtension = byExtension != null ? List.copyOf(byExtension) : List.of();
  }

  /** Successful sync totals for one file extension. */
  public record ExtensionTotal(String extension, long count, long totalBytes) {}
}
