package com.scholary.audiosync.ledger;

/** Rows removed by a retention sweep. */
public record PurgeResult(int sessionsDeleted, int recordsDeleted) {}
