package com.scholary.audiosync.pipeline;

import com.scholary.audiosync.upload.UploadReport;

/** Result of one full or upload-only run. */
public record SyncSummary(
    String sessionId, int stagedFiles, ProcessingSummary processing, UploadReport upload) {}
