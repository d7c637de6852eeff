package com.scholary.audiosync.upload;

import com.scholary.audiosync.ledger.SessionCounters;
import java.util.List;

/** Per-batch totals. A new instance is computed for every batch. */
public record UploadStatistics(
    int totalFiles,
    int uploadedFiles,
    int failedFiles,
    int skippedFiles,
    long totalBytes,
    long uploadedBytes) {

  public static UploadStatistics from(List<UploadOutcome> outcomes) {
    int uploaded = 0;
    int failed = 0;
    int skipped = 0;
    long totalBytes = 0;
    long uploadedBytes = 0;
    for (UploadOutcome outcome : outcomes) {
      totalBytes += outcome.bytes();
      if (outcome.isUploaded()) {
        uploaded++;
        uploadedBytes += outcome.bytes();
      } else if (outcome.isSkipped()) {
        skipped++;
      } else {
        failed++;
      }
    }
    return new UploadStatistics(
        outcomes.size(), uploaded, failed, skipped, totalBytes, uploadedBytes);
  }

  public SessionCounters toCounters() {
    return new SessionCounters(
        totalFiles, uploadedFiles, failedFiles, skippedFiles, totalBytes, uploadedBytes);
  }
}
