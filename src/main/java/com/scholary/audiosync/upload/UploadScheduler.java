package com.scholary.audiosync.upload;

import com.scholary.audiosync.exception.AudioSyncException;
import com.scholary.audiosync.exception.AuthenticationException;
import com.scholary.audiosync.exception.CapacityException;
import com.scholary.audiosync.exception.StorageException;
import com.scholary.audiosync.exception.TransientIoException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import com.scholary.audiosync.ledger.FileMeta;
import com.scholary.audiosync.ledger.FileSyncAttempt;
import com.scholary.audiosync.ledger.FileSyncRecord;
import com.scholary.audiosync.ledger.FileSyncStatus;
import com.scholary.audiosync.ledger.FingerprintLedger;
import com.scholary.audiosync.logging.StructuredLogger;
import com.scholary.audiosync.remote.RemoteObject;
import com.scholary.audiosync.remote.RemoteStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads a batch of files with bounded concurrency, skipping content that is already delivered.
 *
 * <p>A batch runs in two phases:
 *
 * <ol>
 *   <li>In the caller thread, each file is checked against the size limit, fingerprinted, run
 *       through the ledger's differential check and then its dedup check for the destination.
 *       Files that fail a check resolve immediately as SKIPPED.
 *   <li>The rest are handed to the upload pool. A task builds the remote folder chain, asks the
 *       store whether the object is already there and uploads it, retrying transient failures
 *       with exponential backoff and jitter.
 * </ol>
 *
 * <p>Authentication and ledger failures affect every file, so they cancel the batch: tasks already
 * transferring finish, queued tasks resolve as FAILED without touching the network, and the report
 * carries the cause. {@link #cancel()} has the same effect.
 *
 * <p>Every input ends with exactly one outcome, recorded in the ledger before the batch returns.
 */
public class UploadScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadScheduler.class);

  static final String CANCELLED_BEFORE_DISPATCH = "batch cancelled before dispatch";
  private static final int PROGRESS_EVERY = 10;

  private final RemoteStore remoteStore;
  private final FingerprintLedger ledger;
  private final UploadProperties properties;
  private final boolean useLedger;
  private final Executor executor;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);
  private final Set<Batch> activeBatches = ConcurrentHashMap.newKeySet();

  public UploadScheduler(
      RemoteStore remoteStore,
      FingerprintLedger ledger,
      UploadProperties properties,
      boolean useLedger,
      Executor executor) {
    this.remoteStore = remoteStore;
    this.ledger = ledger;
    this.properties = properties;
    this.useLedger = useLedger;
    this.executor = executor;
  }

  /**
   * Upload files from disk.
   *
   * @param sessionId session the attempts are recorded under
   * @param localPaths files to upload
   * @param localRoot root the remote folder structure mirrors; null uploads everything flat
   * @param destinationFolderId remote folder to upload into, also the dedup scope
   */
  public UploadReport submitBatch(
      String sessionId, List<Path> localPaths, Path localRoot, String destinationFolderId) {
    List<FileMeta> metas = new ArrayList<>(localPaths.size());
    Map<Integer, String> unreadable = new HashMap<>();
    for (Path path : localPaths) {
      try {
        metas.add(FileMeta.of(path));
      } catch (IOException e) {
        LOGGER.error("Cannot read {}: {}", path, e.getMessage());
        unreadable.put(metas.size(), "unreadable: " + e.getMessage());
        metas.add(new FileMeta(path, null, 0, null, null, false));
      }
    }
    return submit(sessionId, metas, unreadable, localRoot, destinationFolderId);
  }

  /**
   * Upload files described by precomputed metadata. Fingerprints already present are reused and
   * forced files bypass both ledger checks.
   */
  public UploadReport submitMetas(
      String sessionId, List<FileMeta> files, Path localRoot, String destinationFolderId) {
    return submit(sessionId, files, Map.of(), localRoot, destinationFolderId);
  }

  private UploadReport submit(
      String sessionId,
      List<FileMeta> files,
      Map<Integer, String> unreadable,
      Path localRoot,
      String destinationFolderId) {
    if (files.isEmpty()) {
      return UploadReport.empty(destinationFolderId);
    }

    Batch batch = new Batch(sessionId, destinationFolderId, localRoot, files.size());
    activeBatches.add(batch);
    try {
      LOGGER.info(
          "Starting upload batch: files={}, destination='{}', parallel={}",
          files.size(),
          destinationFolderId,
          properties.parallelUploads());

      List<Integer> toDispatch = screen(batch, files, unreadable);

      List<CompletableFuture<Void>> futures = new ArrayList<>(toDispatch.size());
      for (int index : toDispatch) {
        futures.add(CompletableFuture.runAsync(() -> runTask(batch, index), executor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

      List<UploadOutcome> outcomes = Arrays.asList(batch.outcomes);
      UploadStatistics statistics = UploadStatistics.from(outcomes);
      structuredLogger.logBatchProgress(
          outcomes.size(),
          outcomes.size(),
          statistics.uploadedFiles(),
          statistics.skippedFiles(),
          statistics.failedFiles());
      if (batch.abortCause.get() != null) {
        LOGGER.error("Upload batch aborted: {}", batch.abortCause.get().getMessage());
      }
      return new UploadReport(
          destinationFolderId,
          outcomes,
          statistics,
          batch.abortCause.get(),
          batch.cancelled.get());
    } finally {
      activeBatches.remove(batch);
    }
  }

  /** Stop all running batches. In-flight transfers finish; nothing new is started. */
  public void cancel() {
    LOGGER.warn("Cancelling {} active upload batch(es)", activeBatches.size());
    for (Batch batch : activeBatches) {
      batch.cancelled.set(true);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Phase 1: caller thread
  // ---------------------------------------------------------------------------------------------

  private List<Integer> screen(Batch batch, List<FileMeta> files, Map<Integer, String> unreadable) {
    List<Integer> candidates = new ArrayList<>();
    for (int i = 0; i < files.size(); i++) {
      FileMeta file = files.get(i);
      batch.files[i] = file;
      if (unreadable.containsKey(i)) {
        resolve(
            batch, i, UploadOutcome.failed(file.path(), null, 0, 0, unreadable.get(i)), null);
        continue;
      }
      if (batch.isStopped()) {
        resolve(batch, i, cancelledOutcome(file), null);
        continue;
      }
      try {
        checkCapacity(file);
        if (!file.hasFingerprint()) {
          file = file.withFingerprint(ContentFingerprint.of(file.path()));
          batch.files[i] = file;
        }
        candidates.add(i);
      } catch (CapacityException e) {
        LOGGER.warn("Skipping oversized file: {}", e.getMessage());
        resolve(
            batch,
            i,
            UploadOutcome.skipped(file.path(), null, null, file.size(), "too large"),
            e.getMessage());
      } catch (IOException e) {
        LOGGER.error("Cannot fingerprint {}: {}", file.path(), e.getMessage());
        resolve(
            batch,
            i,
            UploadOutcome.failed(
                file.path(), null, file.size(), 0, "unreadable: " + e.getMessage()),
            null);
      }
    }

    if (!useLedger || batch.isStopped()) {
      return settleStopped(batch, candidates);
    }

    List<Integer> toDispatch = new ArrayList<>();
    try {
      List<FileMeta> fingerprinted = new ArrayList<>(candidates.size());
      for (int index : candidates) {
        fingerprinted.add(batch.files[index]);
      }
      Set<Path> needed = new HashSet<>();
      for (FileMeta meta : ledger.selectFilesNeedingSync(fingerprinted)) {
        needed.add(meta.path());
      }

      for (int index : candidates) {
        FileMeta file = batch.files[index];
        if (batch.isStopped()) {
          resolve(batch, index, cancelledOutcome(file), null);
          continue;
        }
        if (!needed.contains(file.path())) {
          structuredLogger.logSyncSkipped(
              file.name(), file.fingerprint().shortForm(), "unchanged");
          resolve(
              batch,
              index,
              UploadOutcome.skipped(
                  file.path(), file.fingerprint(), null, file.size(), "unchanged"),
              "unchanged since last sync");
          continue;
        }
        if (!file.forceSync()) {
          Optional<FileSyncRecord> previous =
              ledger.isDuplicate(file.fingerprint(), batch.destinationFolderId);
          if (previous.isPresent()) {
            String reason = "duplicate of " + previous.get().name();
            structuredLogger.logSyncSkipped(file.name(), file.fingerprint().shortForm(), reason);
            resolve(
                batch,
                index,
                UploadOutcome.skipped(
                    file.path(),
                    file.fingerprint(),
                    previous.get().remoteId(),
                    file.size(),
                    reason),
                reason);
            continue;
          }
        }
        toDispatch.add(index);
      }
    } catch (StorageException e) {
      abort(batch, e);
      return settleStopped(batch, candidates);
    }
    return toDispatch;
  }

  /** After a stop in phase 1, resolve every still-open candidate and dispatch nothing. */
  private List<Integer> settleStopped(Batch batch, List<Integer> candidates) {
    if (!batch.isStopped()) {
      return candidates;
    }
    for (int index : candidates) {
      if (batch.outcomes[index] == null) {
        resolve(batch, index, cancelledOutcome(batch.files[index]), null);
      }
    }
    return List.of();
  }

  private void checkCapacity(FileMeta file) {
    if (file.size() > properties.maxFileSizeBytes()) {
      throw new CapacityException(file.path(), file.size(), properties.maxFileSizeBytes());
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Phase 2: upload pool
  // ---------------------------------------------------------------------------------------------

  private void runTask(Batch batch, int index) {
    FileMeta file = batch.files[index];
    if (batch.isStopped()) {
      resolve(batch, index, cancelledOutcome(file), null);
      return;
    }
    UploadOutcome outcome = transfer(batch, file);
    String error = outcome.isFailed() ? outcome.detail() : null;
    resolve(batch, index, outcome, error);
  }

  private UploadOutcome transfer(Batch batch, FileMeta file) {
    int maxAttempts = properties.retryAttempts();
    String fileName = file.name();
    AudioSyncException lastError = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (attempt > 1 && batch.isStopped()) {
        return UploadOutcome.failed(
            file.path(), file.fingerprint(), file.size(), attempt - 1, "batch cancelled");
      }
      try {
        String folderId = resolveFolder(batch, file.path());
        Optional<RemoteObject> existing =
            remoteStore.findExisting(fileName, folderId, file.fingerprint());
        if (existing.isPresent()) {
          structuredLogger.logSyncSkipped(
              fileName, file.fingerprint().shortForm(), "exists remotely");
          return new UploadOutcome(
              file.path(),
              FileSyncStatus.SKIPPED,
              file.fingerprint(),
              existing.get().id(),
              batch.destinationFolderId,
              file.size(),
              attempt,
              "exists remotely");
        }
        RemoteObject uploaded = remoteStore.upload(file.path(), folderId, file.fingerprint());
        return UploadOutcome.uploaded(
            file.path(),
            file.fingerprint(),
            uploaded.id(),
            batch.destinationFolderId,
            file.size(),
            attempt);

      } catch (TransientIoException e) {
        lastError = e;
        if (attempt < maxAttempts) {
          long backoffMs = backoffFor(attempt);
          structuredLogger.logUploadRetry(
              fileName,
              attempt,
              maxAttempts,
              e.getClass().getSimpleName(),
              e.getMessage(),
              backoffMs);
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return UploadOutcome.failed(
                file.path(), file.fingerprint(), file.size(), attempt, "interrupted");
          }
        }
      } catch (AuthenticationException | StorageException e) {
        abort(batch, e);
        structuredLogger.logUploadFailed(
            fileName, attempt, e.getClass().getSimpleName(), e.getMessage());
        return UploadOutcome.failed(
            file.path(), file.fingerprint(), file.size(), attempt, e.getMessage());
      } catch (AudioSyncException | IllegalArgumentException e) {
        structuredLogger.logUploadFailed(
            fileName, attempt, e.getClass().getSimpleName(), e.getMessage());
        return UploadOutcome.failed(
            file.path(), file.fingerprint(), file.size(), attempt, e.getMessage());
      }
    }

    String message = lastError != null ? lastError.getMessage() : "no attempts made";
    structuredLogger.logUploadFailed(
        fileName,
        maxAttempts,
        lastError != null ? lastError.getClass().getSimpleName() : "none",
        message);
    return UploadOutcome.failed(file.path(), file.fingerprint(), file.size(), maxAttempts, message);
  }

  /** Exponential backoff capped at the maximum, plus up to half of it again as jitter. */
  long backoffFor(int attempt) {
    long exponential = properties.initialBackoffMs() << Math.min(attempt - 1, 30);
    long capped = Math.min(properties.maxBackoffMs(), Math.max(exponential, 0));
    return capped + ThreadLocalRandom.current().nextLong(capped / 2 + 1);
  }

  /**
   * Find or create the remote folder chain that mirrors the file's directory below the local root.
   */
  private String resolveFolder(Batch batch, Path file) {
    String folderId = batch.destinationFolderId;
    if (!properties.preserveFolderStructure() || batch.localRoot == null) {
      return folderId;
    }
    Path root = batch.localRoot.toAbsolutePath().normalize();
    Path parent = file.toAbsolutePath().normalize().getParent();
    if (parent == null || !parent.startsWith(root) || parent.equals(root)) {
      return folderId;
    }
    StringBuilder relative = new StringBuilder();
    for (Path part : root.relativize(parent)) {
      relative.append(part).append('/');
      String parentId = folderId;
      folderId =
          batch.folderIds.computeIfAbsent(
              relative.toString(),
              key -> remoteStore.findOrCreateFolder(part.toString(), parentId));
    }
    return folderId;
  }

  // ---------------------------------------------------------------------------------------------
  // Resolution
  // ---------------------------------------------------------------------------------------------

  private void resolve(Batch batch, int index, UploadOutcome outcome, String ledgerNote) {
    if (useLedger && !(batch.abortCause.get() instanceof StorageException)) {
      record(batch, index, outcome, ledgerNote);
    }
    batch.outcomes[index] = outcome;

    if (outcome.isUploaded()) {
      batch.uploaded.incrementAndGet();
    } else if (outcome.isSkipped()) {
      batch.skipped.incrementAndGet();
    } else {
      batch.failed.incrementAndGet();
    }
    int done = batch.completed.incrementAndGet();
    if (done % PROGRESS_EVERY == 0 && done < batch.outcomes.length) {
      structuredLogger.logBatchProgress(
          done,
          batch.outcomes.length,
          batch.uploaded.get(),
          batch.skipped.get(),
          batch.failed.get());
    }
  }

  /**
   * Write the outcome to the ledger.
   *
   * <p>A remote object that already holds the same content is recorded as a success, so the
   * tracking entry learns about it and later runs skip the file without asking the remote.
   */
  private void record(Batch batch, int index, UploadOutcome outcome, String note) {
    FileMeta file = batch.files[index];
    if (outcome.fingerprint() != null && !file.hasFingerprint()) {
      file = file.withFingerprint(outcome.fingerprint());
    }
    FileSyncStatus status = outcome.status();
    if (outcome.isSkipped() && outcome.remoteFolderId() != null && file.hasFingerprint()) {
      status = FileSyncStatus.SUCCESS;
      note = null;
    }
    int retries = Math.max(0, outcome.attempts() - 1);
    try {
      ledger.recordAttempt(
          batch.sessionId,
          new FileSyncAttempt(file, outcome.remoteId(), outcome.remoteFolderId(), retries),
          status,
          note);
    } catch (StorageException e) {
      abort(batch, e);
    }
  }

  private void abort(Batch batch, RuntimeException cause) {
    if (batch.abortCause.compareAndSet(null, cause)) {
      LOGGER.error("Cancelling upload batch: {}", cause.getMessage());
    }
    batch.cancelled.set(true);
  }

  private static UploadOutcome cancelledOutcome(FileMeta file) {
    return UploadOutcome.failed(
        file.path(), file.fingerprint(), file.size(), 0, CANCELLED_BEFORE_DISPATCH);
  }

  /** Mutable state of one running batch. Outcome slots are written once each. */
  private static final class Batch {
    final String sessionId;
    final String destinationFolderId;
    final Path localRoot;
    final FileMeta[] files;
    final UploadOutcome[] outcomes;
    final Map<String, String> folderIds = new ConcurrentHashMap<>();
    final AtomicBoolean cancelled = new AtomicBoolean();
    final AtomicReference<RuntimeException> abortCause = new AtomicReference<>();
    final AtomicInteger completed = new AtomicInteger();
    final AtomicInteger uploaded = new AtomicInteger();
    final AtomicInteger skipped = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();

    Batch(String sessionId, String destinationFolderId, Path localRoot, int size) {
      this.sessionId = sessionId;
      this.destinationFolderId = destinationFolderId;
      this.localRoot = localRoot;
      this.files = new FileMeta[size];
      this.outcomes = new UploadOutcome[size];
    }

    boolean isStopped() {
      return cancelled.get();
    }
  }
}
