package com.scholary.audiosync.staging;

/** Bytes held in each staging area plus the free space of the disk they live on. */
public record StorageUsage(
    long rawBytes,
    long processedBytes,
    long archiveBytes,
    long diskFreeBytes,
    long diskTotalBytes,
    long maxStorageBytes) {

  public long totalBytes() {
    return rawBytes + processedBytes + archiveBytes;
  }

  /** Staged bytes as a percentage of the configured storage allowance. */
  public double usagePercent() {
    if (maxStorageBytes <= 0) {
      return 0.0;
    }
    return totalBytes() * 100.0 / maxStorageBytes;
  }
}
