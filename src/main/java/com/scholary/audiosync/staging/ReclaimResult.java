package com.scholary.audiosync.staging;

/** Files removed from the archive by a retention sweep. */
public record ReclaimResult(int filesDeleted, long bytesReclaimed) {

  public static ReclaimResult none() {
    return new ReclaimResult(0, 0);
  }
}
