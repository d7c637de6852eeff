package com.scholary.audiosync.ledger;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.time.Instant;

/**
 * One row of the append-only sync history: a single (session, file) attempt.
 *
 * <p>Records are never updated. A later record for the same path supersedes an earlier one.
 */
public record FileSyncRecord(
    long id,
    String sessionId,
    String path,
    String name,
    long size,
    ContentFingerprint fingerprint,
    String remoteId,
    String remoteFolderId,
    FileSyncStatus status,
    Instant timestamp,
    String error,
    int retryCount) {}
