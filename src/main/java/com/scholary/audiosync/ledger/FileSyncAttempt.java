package com.scholary.audiosync.ledger;

/** What is known about a file when an attempt to sync it is recorded. */
public record FileSyncAttempt(
    FileMeta file, String remoteId, String remoteFolderId, int retryCount) {

  public FileSyncAttempt {
    if (file == null) {
      throw new IllegalArgumentException("file cannot be null");
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount cannot be negative");
    }
  }

  public static FileSyncAttempt of(FileMeta file) {
    return new FileSyncAttempt(file, null, null, 0);
  }

  public static FileSyncAttempt of(FileMeta file, String remoteFolderId) {
    return new FileSyncAttempt(file, null, remoteFolderId, 0);
  }

  public FileSyncAttempt withRemote(String newRemoteId, int newRetryCount) {
    return new FileSyncAttempt(file, newRemoteId, remoteFolderId, newRetryCount);
  }
}
