package com.scholary.audiosync.upload;

import java.util.List;

/**
 * Everything a batch produced: one outcome per input in input order, the totals, and why the batch
 * stopped early if it did.
 */
public record UploadReport(
    String destinationFolderId,
    List<UploadOutcome> outcomes,
    UploadStatistics statistics,
    RuntimeException abortCause,
    boolean cancelled) {

  public UploadReport {
    outcomes = List.copyOf(outcomes);
  }

  public boolean aborted() {
    return abortCause != null;
  }

  public static UploadReport empty(String destinationFolderId) {
    return new UploadReport(
        destinationFolderId, List.of(), UploadStatistics.from(List.of()), null, false);
  }
}
