package com.scholary.audiosync.ledger;

import java.time.Instant;

/**
 * One execution of the sync pipeline.
 *
 * <p>Created at pipeline start, updated incrementally while in progress and immutable once it
 * reaches a terminal status.
 */
public record SyncSession(
    String sessionId,
    String sourcePath,
    Instant startTime,
    Instant endTime,
    SessionStatus status,
    SessionCounters counters,
    String errorMessage) {

  public SyncSession {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("sessionId cannot be blank");
    }
    if (status == null) {
      throw new IllegalArgumentException("status cannot be null");
    }
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
