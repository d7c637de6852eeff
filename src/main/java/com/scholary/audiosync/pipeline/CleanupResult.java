package com.scholary.audiosync.pipeline;

import com.scholary.audiosync.ledger.PurgeResult;
import com.scholary.audiosync.staging.ReclaimResult;

/** What a cleanup run removed from the archive and from the ledger. */
public record CleanupResult(ReclaimResult archive, PurgeResult ledger) {}
