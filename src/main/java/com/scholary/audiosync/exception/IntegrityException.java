package com.scholary.audiosync.exception;

import java.nio.file.Path;

/** Thrown when a staged copy does not match its source. The copy is deleted before throwing. */
public class IntegrityException extends AudioSyncException {

  private final Path source;
  private final Path destination;

  public IntegrityException(Path source, Path destination) {
    super(String.format("Copy verification failed: %s -> %s", source, destination));
    this.source = source;
    this.destination = destination;
  }

  public Path getSource() {
    return source;
  }

  public Path getDestination() {
    return destination;
  }
}
