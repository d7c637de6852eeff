package com.scholary.audiosync.ledger;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.time.Instant;

/**
 * Current state of one local path: what was last delivered for it and how often.
 *
 * <p>This is the projection used for differential sync decisions. It is upserted on every
 * successful attempt.
 */
public record FileTrackingEntry(
    String path,
    String name,
    long size,
    ContentFingerprint fingerprint,
    Instant lastModified,
    Instant lastSynced,
    String remoteId,
    int syncCount) {}
