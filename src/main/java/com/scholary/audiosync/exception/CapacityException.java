package com.scholary.audiosync.exception;

import java.nio.file.Path;

/** Thrown when a file exceeds the configured upload size limit. The file is skipped. */
public class CapacityException extends AudioSyncException {

  private final Path path;
  private final long sizeBytes;
  private final long limitBytes;

  public CapacityException(Path path, long sizeBytes, long limitBytes) {
    super(
        String.format(
            "File exceeds size limit: %s (%d bytes > %d bytes)", path, sizeBytes, limitBytes));
    this.path = path;
    this.sizeBytes = sizeBytes;
    this.limitBytes = limitBytes;
  }

  public Path getPath() {
    return path;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }
}
