package com.scholary.audiosync.pipeline;

import com.scholary.audiosync.ledger.SyncSession;
import com.scholary.audiosync.ledger.SyncStats;
import com.scholary.audiosync.staging.StorageUsage;
import java.util.List;

/** Snapshot for the status command. */
public record PipelineStatus(
    StorageUsage storage, SyncStats stats, List<SyncSession> recentSessions, int unprocessedFiles) {

  public PipelineStatus {
    recentSessions = List.copyOf(recentSessions);
  }
}
