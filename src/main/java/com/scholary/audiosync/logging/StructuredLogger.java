package com.scholary.audiosync.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so a JSON or
 * pattern encoder can emit them as separate keys. The session context is longer lived: it is set
 * once per pipeline run and copied onto upload worker threads by the executor's task decorator.
 */
public class StructuredLogger {

  public static final String SESSION_ID = "sessionId";
  public static final String SOURCE = "source";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a file copied into the raw staging area. */
  public void logFileStaged(String source, String destination, long bytes, boolean alreadyStaged) {
    try {
      MDC.put("event_type", "file_staged");
      MDC.put("file", source);
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("alreadyStaged", String.valueOf(alreadyStaged));

      logger.info(
          "File staged: source={}, destination={}, bytes={}, alreadyStaged={}",
          source,
          destination,
          bytes,
          alreadyStaged);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of trimming one staged file. */
  public void logFileProcessed(String file, String outcome, long originalMs, long trimmedMs) {
    try {
      MDC.put("event_type", "file_processed");
      MDC.put("file", file);
      MDC.put("outcome", outcome);
      MDC.put("originalMs", String.valueOf(originalMs));
      MDC.put("trimmedMs", String.valueOf(trimmedMs));

      logger.info(
          "File processed: file={}, outcome={}, duration={}ms -> {}ms",
          file,
          outcome,
          originalMs,
          trimmedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a file that was not uploaded because its content is already delivered or unchanged. */
  public void logSyncSkipped(String file, String fingerprint, String reason) {
    try {
      MDC.put("event_type", "sync_skipped");
      MDC.put("file", file);
      MDC.put("fingerprint", fingerprint);
      MDC.put("reason", reason);

      logger.info("Sync skipped: file={}, fingerprint={}, reason={}", file, fingerprint, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log upload retry event. */
  public void logUploadRetry(
      String file, int attempt, int maxAttempts, String errorType, String message, long backoffMs) {
    try {
      MDC.put("event_type", "upload_retry");
      MDC.put("file", file);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Upload retry: file={}, attempt={}/{}, backoff={}ms, error={}, message={}",
          file,
          attempt,
          maxAttempts,
          backoffMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log upload failure event. */
  public void logUploadFailed(String file, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "upload_failed");
      MDC.put("file", file);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Upload failed: file={}, attempts={}, error={}, message={}",
          file,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch progress event. */
  public void logBatchProgress(int completed, int total, int uploaded, int skipped, int failed) {
    try {
      MDC.put("event_type", "batch_progress");
      MDC.put("completed", String.valueOf(completed));
      MDC.put("total", String.valueOf(total));

      logger.info(
          "Batch progress: {}/{} (uploaded={}, skipped={}, failed={})",
          completed,
          total,
          uploaded,
          skipped,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId, String source) {
    MDC.put(SESSION_ID, sessionId);
    if (source != null) {
      MDC.put(SOURCE, source);
    }
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove(SESSION_ID);
    MDC.remove(SOURCE);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("file");
    MDC.remove("bytes");
    MDC.remove("alreadyStaged");
    MDC.remove("outcome");
    MDC.remove("originalMs");
    MDC.remove("trimmedMs");
    MDC.remove("fingerprint");
    MDC.remove("reason");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("completed");
    MDC.remove("total");
  }
}
