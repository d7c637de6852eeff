package com.scholary.audiosync.upload;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import com.scholary.audiosync.ledger.FileSyncStatus;
import java.nio.file.Path;

/**
 * Terminal result for one file of a batch.
 *
 * <p>{@code status} is SUCCESS, SKIPPED or FAILED; {@code attempts} is zero when no transfer was
 * tried.
 */
public record UploadOutcome(
    Path path,
    FileSyncStatus status,
    ContentFingerprint fingerprint,
    String remoteId,
    String remoteFolderId,
    long bytes,
    int attempts,
    String detail) {

  public static UploadOutcome uploaded(
      Path path,
      ContentFingerprint fingerprint,
      String remoteId,
      String remoteFolderId,
      long bytes,
      int attempts) {
    return new UploadOutcome(
        path, FileSyncStatus.SUCCESS, fingerprint, remoteId, remoteFolderId, bytes, attempts, null);
  }

  public static UploadOutcome skipped(
      Path path, ContentFingerprint fingerprint, String remoteId, long bytes, String reason) {
    return new UploadOutcome(
        path, FileSyncStatus.SKIPPED, fingerprint, remoteId, null, bytes, 0, reason);
  }

  public static UploadOutcome failed(
      Path path, ContentFingerprint fingerprint, long bytes, int attempts, String error) {
    return new UploadOutcome(
        path, FileSyncStatus.FAILED, fingerprint, null, null, bytes, attempts, error);
  }

  public boolean isUploaded() {
    return status == FileSyncStatus.SUCCESS;
  }

  public boolean isSkipped() {
    return status == FileSyncStatus.SKIPPED;
  }

  public boolean isFailed() {
    return status == FileSyncStatus.FAILED;
  }
}
