package com.scholary.audiosync.ledger;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * A candidate file for sync, as seen on the local disk.
 *
 * <p>The fingerprint is optional: candidates without one are always considered in need of sync.
 */
public record FileMeta(
    Path path,
    String name,
    long size,
    Instant lastModified,
    ContentFingerprint fingerprint,
    boolean forceSync) {

  public FileMeta {
    if (path == null) {
      throw new IllegalArgumentException("path cannot be null");
    }
    if (size < 0) {
      throw new IllegalArgumentException("size cannot be negative");
    }
    path = path.toAbsolutePath().normalize();
    name = name != null ? name : path.getFileName().toString();
  }

  /** Read size and modification time from disk. The fingerprint is left unset. */
  public static FileMeta of(Path path) throws IOException {
    return new FileMeta(
        path,
        null,
        Files.size(path),
        Files.getLastModifiedTime(path).toInstant(),
        null,
        false);
  }

  /** Same as {@link #of(Path)} but also hashes the content. */
  public static FileMeta fingerprinted(Path path) throws IOException {
    return of(path).withFingerprint(ContentFingerprint.of(path));
  }

  public FileMeta withFingerprint(ContentFingerprint newFingerprint) {
    return new FileMeta(path, name, size, lastModified, newFingerprint, forceSync);
  }

  public FileMeta forced() {
    return new FileMeta(path, name, size, lastModified, fingerprint, true);
  }

  /** The key used for this file in the tracking table. */
  public String pathKey() {
    return path.toString();
  }

  public boolean hasFingerprint() {
    return fingerprint != null;
  }
}
