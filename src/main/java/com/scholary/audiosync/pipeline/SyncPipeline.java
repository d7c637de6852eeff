package com.scholary.audiosync.pipeline;

import com.scholary.audiosync.audio.AudioProcessor;
import com.scholary.audiosync.audio.ProcessingResult;
import com.scholary.audiosync.exception.AudioSyncException;
import com.scholary.audiosync.exception.StorageException;
import com.scholary.audiosync.ledger.FileMeta;
import com.scholary.audiosync.ledger.FingerprintLedger;
import com.scholary.audiosync.ledger.LedgerProperties;
import com.scholary.audiosync.ledger.PurgeResult;
import com.scholary.audiosync.logging.StructuredLogger;
import com.scholary.audiosync.remote.RemoteAccount;
import com.scholary.audiosync.remote.RemoteStore;
import com.scholary.audiosync.staging.ReclaimResult;
import com.scholary.audiosync.staging.StagingLifecycle;
import com.scholary.audiosync.staging.StagingProperties;
import com.scholary.audiosync.upload.UploadReport;
import com.scholary.audiosync.upload.UploadScheduler;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one run of the sync pipeline: stage, process, upload.
 *
 * <p>Full and upload-only runs happen inside a ledger session. The session is closed COMPLETED
 * when every file reached an outcome, or FAILED with the cause when a run-level error (bad
 * credentials, broken ledger) stopped the run; that error is then rethrown to the caller.
 * Per-file failures are only counted.
 */
public class SyncPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncPipeline.class);

  static final String STAGING_LABEL = "staging";
  private static final int STATUS_SESSIONS = 5;

  private final StagingLifecycle staging;
  private final AudioProcessor processor;
  private final UploadScheduler scheduler;
  private final FingerprintLedger ledger;
  private final RemoteStore remoteStore;
  private final StagingProperties stagingProperties;
  private final LedgerProperties ledgerProperties;

  public SyncPipeline(
      StagingLifecycle staging,
      AudioProcessor processor,
      UploadScheduler scheduler,
      FingerprintLedger ledger,
      RemoteStore remoteStore,
      StagingProperties stagingProperties,
      LedgerProperties ledgerProperties) {
    this.staging = staging;
    this.processor = processor;
    this.scheduler = scheduler;
    this.ledger = ledger;
    this.remoteStore = remoteStore;
    this.stagingProperties = stagingProperties;
    this.ledgerProperties = ledgerProperties;
  }

  /**
   * Stage files from the source, process everything unprocessed and upload everything pending.
   *
   * @param source mounted media to copy from, or null to work on what is already staged
   */
  public SyncSummary runFull(Path source) {
    String label = source != null ? source.toString() : STAGING_LABEL;
    String sessionId = ledger.openSession(label);
    StructuredLogger.setSessionContext(sessionId, label);
    try {
      LOGGER.info("Sync run started: source={}", label);
      List<Path> staged =
          source != null
              ? staging.stageFromSource(source, stagingProperties.patterns())
              : List.of();
      ProcessingSummary processing = processPending();
      UploadReport upload = uploadPending(sessionId);
      finish(sessionId, upload);
      LOGGER.info(
          "Sync run finished: staged={}, processed={}, uploaded={}, skipped={}, failed={}",
          staged.size(),
          processing.processed(),
          upload.statistics().uploadedFiles(),
          upload.statistics().skippedFiles(),
          upload.statistics().failedFiles());
      return new SyncSummary(sessionId, staged.size(), processing, upload);
    } catch (AudioSyncException e) {
      failSession(sessionId, e);
      throw e;
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  /** Process everything in {@code raw/} without touching the remote. No session is opened. */
  public ProcessingSummary processOnly() {
    return processPending();
  }

  /** Upload everything processed but not yet delivered. */
  public SyncSummary uploadOnly() {
    String sessionId = ledger.openSession(STAGING_LABEL);
    StructuredLogger.setSessionContext(sessionId, STAGING_LABEL);
    try {
      UploadReport upload = uploadPending(sessionId);
      finish(sessionId, upload);
      return new SyncSummary(sessionId, 0, ProcessingSummary.empty(), upload);
    } catch (AudioSyncException e) {
      failSession(sessionId, e);
      throw e;
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  public PipelineStatus status() {
    return new PipelineStatus(
        staging.usageReport(),
        ledger.statistics(),
        ledger.recentSessions(STATUS_SESSIONS),
        staging.listUnprocessed().size());
  }

  /** Drop expired archive files and ledger rows older than the ledger retention. */
  public CleanupResult cleanup() {
    ReclaimResult archive =
        staging.reclaimExpired(Duration.ofDays(stagingProperties.retentionDays()));
    PurgeResult purged = ledger.purgeOlderThan(Duration.ofDays(ledgerProperties.retentionDays()));
    LOGGER.info(
        "Cleanup finished: archiveFiles={}, archiveBytes={}, sessions={}, records={}",
        archive.filesDeleted(),
        archive.bytesReclaimed(),
        purged.sessionsDeleted(),
        purged.recordsDeleted());
    return new CleanupResult(archive, purged);
  }

  public int exportHistory(Path output, String sessionId) {
    return ledger.exportHistory(output, sessionId);
  }

  // ---------------------------------------------------------------------------------------------

  private ProcessingSummary processPending() {
    List<Path> unprocessed = staging.listUnprocessed();
    if (unprocessed.isEmpty()) {
      LOGGER.info("Nothing to process");
      return ProcessingSummary.empty();
    }
    LOGGER.info("Processing {} staged files", unprocessed.size());

    int processed = 0;
    int skipped = 0;
    int failed = 0;
    List<Path> promoted = new ArrayList<>();
    for (ProcessingResult result : processor.processAll(unprocessed)) {
      try {
        if (result.isProcessed()) {
          promoted.add(staging.promoteToProcessed(result.input(), result.output()));
          processed++;
        } else if (result.isSkipped()) {
          staging.archiveRaw(result.input());
          skipped++;
        } else {
          // raw file stays in place and is retried next run
          failed++;
        }
      } catch (IOException e) {
        LOGGER.error("Failed to move {} out of raw: {}", result.input(), e.getMessage(), e);
        deleteOutput(result.output());
        failed++;
      }
    }
    LOGGER.info("Processing done: processed={}, skipped={}, failed={}", processed, skipped, failed);
    return new ProcessingSummary(processed, skipped, failed, promoted);
  }

  private UploadReport uploadPending(String sessionId) {
    RemoteAccount account = remoteStore.getAbout();
    LOGGER.info("Connected to {} ({})", account.identity(), account.description());

    List<FileMeta> pending;
    if (ledgerProperties.enabled()) {
      pending = staging.listPendingUpload(ledger);
    } else {
      pending = new ArrayList<>();
      for (Path processed : staging.listProcessed()) {
        try {
          pending.add(FileMeta.of(processed));
        } catch (IOException e) {
          LOGGER.warn("Skipping unreadable processed file {}: {}", processed, e.getMessage());
        }
      }
    }
    LOGGER.info("{} processed files pending upload", pending.size());
    return scheduler.submitMetas(
        sessionId, pending, staging.processedDir(), remoteStore.rootFolderId());
  }

  private void finish(String sessionId, UploadReport upload) {
    ledger.updateSessionCounters(sessionId, upload.statistics().toCounters());
    if (upload.aborted()) {
      throw upload.abortCause();
    }
    ledger.closeSession(sessionId, true, null);
  }

  private void failSession(String sessionId, AudioSyncException cause) {
    LOGGER.error("Sync run failed: {}", cause.getMessage());
    try {
      ledger.closeSession(sessionId, false, cause.getMessage());
    } catch (StorageException e) {
      cause.addSuppressed(e);
    }
  }

  private static void deleteOutput(Path output) {
    if (output == null) {
      return;
    }
    try {
      Files.deleteIfExists(output);
    } catch (IOException e) {
      LOGGER.warn("Could not delete processed output {}: {}", output, e.getMessage());
    }
  }
}
