package com.scholary.audiosync.ledger;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every sync attempt plus the current path to fingerprint projection.
 *
 * <p>Two questions are answered from two tables: "what happened, ever" from the append-only
 * history, and "what is the current state of this path" from the tracking projection, which is
 * upserted on every successful attempt. Dedup and differential-sync decisions read only the
 * projection and the success records.
 *
 * <p>Implementations serialize writes. All failures of the backing store surface as {@link
 * com.scholary.audiosync.exception.StorageException}.
 */
public interface FingerprintLedger {

  /**
   * Start a new session in {@link SessionStatus#IN_PROGRESS}.
   *
   * @param sourceLabel where the files of this run come from (usually the mount path)
   * @return the generated session id
   */
  String openSession(String sourceLabel);

  /** Overwrite the running counters of a session that is still in progress. */
  void updateSessionCounters(String sessionId, SessionCounters counters);

  /**
   * Move a session to its terminal status and stamp its end time.
   *
   * <p>Closing a session that is already terminal is logged and otherwise ignored.
   */
  void closeSession(String sessionId, boolean success, String errorMessage);

  /**
   * Append one attempt to the history.
   *
   * <p>A {@link FileSyncStatus#SUCCESS} attempt must carry a fingerprint and also upserts the
   * tracking entry for its path in the same transaction. Re-applying a success with the same
   * session, path and fingerprint returns the existing record id and leaves the sync count alone.
   *
   * @return the id of the history record
   */
  long recordAttempt(
      String sessionId, FileSyncAttempt attempt, FileSyncStatus status, String errorMessage);

  /**
   * Most recent successful delivery of this content.
   *
   * @param fingerprint the content to look for
   * @param remoteFolderId restrict to deliveries into this folder, or null for any folder
   */
  Optional<FileSyncRecord> isDuplicate(ContentFingerprint fingerprint, String remoteFolderId);

  default Optional<FileSyncRecord> isDuplicate(ContentFingerprint fingerprint) {
    return isDuplicate(fingerprint, null);
  }

  /**
   * Filter candidates down to those that need syncing, preserving input order.
   *
   * <p>A candidate is kept when its path is not tracked, its fingerprint differs from the tracked
   * one, it is forced, or it has no fingerprint at all.
   */
  List<FileMeta> selectFilesNeedingSync(List<FileMeta> candidates);

  /** Aggregated statistics, served from a short-lived cache. */
  SyncStats statistics();

  /** Delete sessions and history older than the horizon, then reclaim file space. */
  PurgeResult purgeOlderThan(Duration horizon);

  Optional<SyncSession> findSession(String sessionId);

  /** Most recently started sessions first. */
  List<SyncSession> recentSessions(int limit);

  Optional<FileTrackingEntry> findTrackingEntry(String path);

  /** Content delivered successfully more than once, most delivered first. */
  List<DuplicateContent> duplicateContent();

  /**
   * Write history records as a JSON document.
   *
   * @param output file to write, parent directories are created
   * @param sessionId only export this session, or null for the most recent records
   * @return number of records written
   */
  int exportHistory(Path output, String sessionId);

  String getSetting(String key, String defaultValue);

  void putSetting(String key, String value);
}
