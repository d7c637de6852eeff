package com.scholary.audiosync.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audiosync.exception.StorageException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * SQLite-backed ledger.
 *
 * <p>Writes are serialized by a single lock and each runs inside one JDBC transaction, so the
 * history insert and the tracking upsert of a successful attempt land together or not at all.
 * Reads go straight to the data source and rely on its busy timeout instead of the lock.
 *
 * <p>Statistics scan the whole history, so they are kept in a Caffeine cache that expires after
 * {@link LedgerProperties#statsCacheTtl()} and is dropped on every write.
 */
public class JdbcFingerprintLedger implements FingerprintLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcFingerprintLedger.class);

  static final String SCHEMA_RESOURCE = "ledger/schema.sql";
  static final int EXPORT_LIMIT = 10_000;

  private static final DateTimeFormatter SESSION_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final String STATS_KEY = "stats";

  private static final String HISTORY_COLUMNS =
      "id, session_id, file_path, file_name, file_size, file_hash, remote_id, remote_folder_id,"
          + " sync_status, sync_time, error_message, retry_count";
  private static final String SESSION_COLUMNS =
      "session_id, source_path, start_time, end_time, status, total_files, synced_files,"
          + " failed_files, skipped_files, total_bytes, synced_bytes, error_message";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock();
  private final Cache<String, SyncStats> statsCache;

  public JdbcFingerprintLedger(
      JdbcTemplate jdbcTemplate,
      TransactionTemplate transactionTemplate,
      ObjectMapper objectMapper,
      LedgerProperties properties,
      Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.statsCache =
        Caffeine.newBuilder().expireAfterWrite(properties.statsCacheTtl()).maximumSize(1).build();

    initializeSchema();
    LOGGER.info(
        "Ledger ready: path={}, statsCacheTtl={}", properties.path(), properties.statsCacheTtl());
  }

  private void initializeSchema() {
    DataSource dataSource = jdbcTemplate.getDataSource();
    if (dataSource == null) {
      throw new StorageException("Ledger has no data source", null);
    }
    try {
      new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE)).execute(dataSource);
    } catch (DataAccessException | TransactionException e) {
      String message = String.format("Failed to initialize ledger schema: %s", e.getMessage());
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Sessions
  // ---------------------------------------------------------------------------------------------

  @Override
  public String openSession(String sourceLabel) {
    Instant now = clock.instant();
    String sessionId =
        "session_"
            + LocalDateTime.ofInstant(now, clock.getZone()).format(SESSION_ID_FORMAT)
            + "_"
            + UUID.randomUUID().toString().replace("-", "").substring(0, 8);

    write(
        "open session",
        () ->
            jdbcTemplate.update(
                "INSERT INTO sync_sessions (session_id, source_path, start_time, status)"
                    + " VALUES (?, ?, ?, ?)",
                sessionId,
                sourceLabel,
                now.toEpochMilli(),
                SessionStatus.IN_PROGRESS.dbValue()));

    LOGGER.info("Opened session: sessionId={}, source={}", sessionId, sourceLabel);
    return sessionId;
  }

  @Override
  public void updateSessionCounters(String sessionId, SessionCounters counters) {
    int updated =
        write(
            "update session counters",
            () ->
                jdbcTemplate.update(
                    "UPDATE sync_sessions SET total_files = ?, synced_files = ?, failed_files = ?,"
                        + " skipped_files = ?, total_bytes = ?, synced_bytes = ?"
                        + " WHERE session_id = ? AND status = ?",
                    counters.totalFiles(),
                    counters.syncedFiles(),
                    counters.failedFiles(),
                    counters.skippedFiles(),
                    counters.totalBytes(),
                    counters.syncedBytes(),
                    sessionId,
                    SessionStatus.IN_PROGRESS.dbValue()));
    if (updated == 0) {
      LOGGER.warn("Counters not updated, session is not in progress: sessionId={}", sessionId);
    }
  }

  @Override
  public void closeSession(String sessionId, boolean success, String errorMessage) {
    SessionStatus target = success ? SessionStatus.COMPLETED : SessionStatus.FAILED;
    int updated =
        write(
            "close session",
            () ->
                jdbcTemplate.update(
                    "UPDATE sync_sessions SET status = ?, end_time = ?, error_message = ?"
                        + " WHERE session_id = ? AND status = ?",
                    target.dbValue(),
                    clock.millis(),
                    errorMessage,
                    sessionId,
                    SessionStatus.IN_PROGRESS.dbValue()));

    if (updated == 0) {
      Optional<SyncSession> existing = findSession(sessionId);
      if (existing.isPresent()) {
        LOGGER.warn(
            "Session already closed, ignoring: sessionId={}, status={}, requested={}",
            sessionId,
            existing.get().status(),
            target);
      } else {
        LOGGER.warn("Cannot close unknown session: sessionId={}", sessionId);
      }
      return;
    }
    LOGGER.info("Closed session: sessionId={}, status={}", sessionId, target);
  }

  @Override
  public Optional<SyncSession> findSession(String sessionId) {
    return read(
        "find session",
        () ->
            jdbcTemplate
                .query(
                    "SELECT " + SESSION_COLUMNS + " FROM sync_sessions WHERE session_id = ?",
                    SESSION_MAPPER,
                    sessionId)
                .stream()
                .findFirst());
  }

  @Override
  public List<SyncSession> recentSessions(int limit) {
    return read(
        "list sessions",
        () ->
            jdbcTemplate.query(
                "SELECT "
                    + SESSION_COLUMNS
                    + " FROM sync_sessions ORDER BY start_time DESC, rowid DESC LIMIT ?",
                SESSION_MAPPER,
                limit));
  }

  // ---------------------------------------------------------------------------------------------
  // Attempts and tracking
  // ---------------------------------------------------------------------------------------------

  @Override
  public long recordAttempt(
      String sessionId, FileSyncAttempt attempt, FileSyncStatus status, String errorMessage) {
    FileMeta file = attempt.file();
    if (status == FileSyncStatus.SUCCESS && !file.hasFingerprint()) {
      throw new IllegalArgumentException(
          "A successful attempt must carry a fingerprint: " + file.pathKey());
    }
    String hash = file.hasFingerprint() ? file.fingerprint().hex() : null;

    return write(
        "record attempt",
        () -> {
          if (status == FileSyncStatus.SUCCESS) {
            List<Long> existing =
                jdbcTemplate.queryForList(
                    "SELECT id FROM file_sync_history WHERE session_id = ? AND file_path = ?"
                        + " AND file_hash = ? AND sync_status = ? ORDER BY id DESC LIMIT 1",
                    Long.class,
                    sessionId,
                    file.pathKey(),
                    hash,
                    FileSyncStatus.SUCCESS.dbValue());
            if (!existing.isEmpty()) {
              LOGGER.debug(
                  "Success already recorded: sessionId={}, path={}, recordId={}",
                  sessionId,
                  file.pathKey(),
                  existing.get(0));
              return existing.get(0);
            }
          }

          long now = clock.millis();
          jdbcTemplate.update(
              "INSERT INTO file_sync_history (session_id, file_path, file_name, file_size,"
                  + " file_hash, remote_id, remote_folder_id, sync_status, sync_time,"
                  + " error_message, retry_count) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
              sessionId,
              file.pathKey(),
              file.name(),
              file.size(),
              hash,
              attempt.remoteId(),
              attempt.remoteFolderId(),
              status.dbValue(),
              now,
              errorMessage,
              attempt.retryCount());
          Long recordId = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);

          if (status == FileSyncStatus.SUCCESS) {
            jdbcTemplate.update(
                "INSERT INTO file_tracking (file_path, file_name, file_size, file_hash,"
                    + " last_modified, last_synced, remote_id, sync_count)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, 1)"
                    + " ON CONFLICT(file_path) DO UPDATE SET"
                    + " file_name = excluded.file_name,"
                    + " file_size = excluded.file_size,"
                    + " file_hash = excluded.file_hash,"
                    + " last_modified = excluded.last_modified,"
                    + " last_synced = excluded.last_synced,"
                    + " remote_id = excluded.remote_id,"
                    + " sync_count = file_tracking.sync_count + 1",
                file.pathKey(),
                file.name(),
                file.size(),
                hash,
                file.lastModified() != null ? file.lastModified().toEpochMilli() : null,
                now,
                attempt.remoteId());
          }
          return recordId != null ? recordId : -1L;
        });
  }

  @Override
  public Optional<FileSyncRecord> isDuplicate(
      ContentFingerprint fingerprint, String remoteFolderId) {
    if (fingerprint == null) {
      return Optional.empty();
    }
    return read(
        "check duplicate",
        () -> {
          List<FileSyncRecord> matches;
          if (remoteFolderId != null) {
            matches =
                jdbcTemplate.query(
                    "SELECT "
                        + HISTORY_COLUMNS
                        + " FROM file_sync_history WHERE file_hash = ? AND sync_status = ?"
                        + " AND remote_folder_id = ? ORDER BY sync_time DESC, id DESC LIMIT 1",
                    RECORD_MAPPER,
                    fingerprint.hex(),
                    FileSyncStatus.SUCCESS.dbValue(),
                    remoteFolderId);
          } else {
            matches =
                jdbcTemplate.query(
                    "SELECT "
                        + HISTORY_COLUMNS
                        + " FROM file_sync_history WHERE file_hash = ? AND sync_status = ?"
                        + " ORDER BY sync_time DESC, id DESC LIMIT 1",
                    RECORD_MAPPER,
                    fingerprint.hex(),
                    FileSyncStatus.SUCCESS.dbValue());
          }
          return matches.stream().findFirst();
        });
  }

  @Override
  public List<FileMeta> selectFilesNeedingSync(List<FileMeta> candidates) {
    List<FileMeta> needed = new ArrayList<>();
    for (FileMeta candidate : candidates) {
      if (candidate.forceSync() || !candidate.hasFingerprint()) {
        needed.add(candidate);
        continue;
      }
      Optional<FileTrackingEntry> tracked = findTrackingEntry(candidate.pathKey());
      if (tracked.isEmpty() || !candidate.fingerprint().equals(tracked.get().fingerprint())) {
        needed.add(candidate);
      }
    }
    LOGGER.debug("Files needing sync: {}/{}", needed.size(), candidates.size());
    return needed;
  }

  @Override
  public Optional<FileTrackingEntry> findTrackingEntry(String path) {
    return read(
        "find tracking entry",
        () ->
            jdbcTemplate
                .query(
                    "SELECT file_path, file_name, file_size, file_hash, last_modified,"
                        + " last_synced, remote_id, sync_count FROM file_tracking"
                        + " WHERE file_path = ?",
                    TRACKING_MAPPER,
                    path)
                .stream()
                .findFirst());
  }

  @Override
  public List<DuplicateContent> duplicateContent() {
    return read(
        "find duplicate content",
        () -> {
          Map<String, List<String>> names = new LinkedHashMap<>();
          Map<String, long[]> totals = new LinkedHashMap<>();
          jdbcTemplate.query(
              "SELECT file_hash, file_name, file_size FROM file_sync_history"
                  + " WHERE sync_status = ? AND file_hash IN ("
                  + "   SELECT file_hash FROM file_sync_history WHERE sync_status = ?"
                  + "   GROUP BY file_hash HAVING COUNT(*) > 1)"
                  + " ORDER BY file_hash, sync_time",
              rs -> {
                String hash = rs.getString("file_hash");
                String name = rs.getString("file_name");
                List<String> seen = names.computeIfAbsent(hash, k -> new ArrayList<>());
                if (!seen.contains(name)) {
                  seen.add(name);
                }
                long[] counts = totals.computeIfAbsent(hash, k -> new long[2]);
                counts[0]++;
                counts[1] += rs.getLong("file_size");
              },
              FileSyncStatus.SUCCESS.dbValue(),
              FileSyncStatus.SUCCESS.dbValue());

          List<DuplicateContent> duplicates = new ArrayList<>();
          totals.forEach(
              (hash, counts) ->
                  duplicates.add(
                      new DuplicateContent(
                          new ContentFingerprint(hash),
                          (int) counts[0],
                          names.get(hash),
                          counts[1])));
          duplicates.sort(Comparator.comparingInt(DuplicateContent::deliveries).reversed());
          return duplicates;
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Statistics, maintenance, export
  // ---------------------------------------------------------------------------------------------

  @Override
  public SyncStats statistics() {
    return statsCache.get(STATS_KEY, key -> read("compute statistics", this::computeStatistics));
  }

  private SyncStats computeStatistics() {
    String success = FileSyncStatus.SUCCESS.dbValue();
    Instant now = clock.instant();
    long startOfToday =
        LocalDate.ofInstant(now, clock.getZone())
            .atStartOfDay(clock.getZone())
            .toInstant()
            .toEpochMilli();
    long weekAgo = now.minus(Duration.ofDays(7)).toEpochMilli();

    long totalSessions = count("SELECT COUNT(*) FROM sync_sessions");
    long successfulFiles =
        count("SELECT COUNT(*) FROM file_sync_history WHERE sync_status = ?", success);
    long bytesSynced =
        count(
            "SELECT COALESCE(SUM(file_size), 0) FROM file_sync_history WHERE sync_status = ?",
            success);
    long uniqueFingerprints =
        count(
            "SELECT COUNT(DISTINCT file_hash) FROM file_sync_history WHERE sync_status = ?",
            success);
    long filesToday =
        count(
            "SELECT COUNT(*) FROM file_sync_history WHERE sync_status = ? AND sync_time >= ?",
            success,
            startOfToday);
    long bytesToday =
        count(
            "SELECT COALESCE(SUM(file_size), 0) FROM file_sync_history"
                + " WHERE sync_status = ? AND sync_time >= ?",
            success,
            startOfToday);
    long failuresLast7Days =
        count(
            "SELECT COUNT(*) FROM file_sync_history WHERE sync_status = ? AND sync_time >= ?",
            FileSyncStatus.FAILED.dbValue(),
            weekAgo);

    Map<String, long[]> byExtension = new LinkedHashMap<>();
    jdbcTemplate.query(
        "SELECT file_name, file_size FROM file_sync_history WHERE sync_status = ?",
        rs -> {
          long[] totals =
              byExtension.computeIfAbsent(extensionOf(rs.getString("file_name")), k -> new long[2]);
          totals[0]++;
          totals[1] += rs.getLong("file_size");
        },
        success);
    List<SyncStats.ExtensionTotal> extensions = new ArrayList<>();
    byExtension.forEach(
        (ext, totals) -> extensions.add(new SyncStats.ExtensionTotal(ext, totals[0], totals[1])));
    extensions.sort(Comparator.comparingLong(SyncStats.ExtensionTotal::count).reversed());

    return new SyncStats(
        totalSessions,
        successfulFiles,
        bytesSynced,
        uniqueFingerprints,
        filesToday,
        bytesToday,
        failuresLast7Days,
        extensions,
        now);
  }

  @Override
  public PurgeResult purgeOlderThan(Duration horizon) {
    long cutoff = clock.instant().minus(horizon).toEpochMilli();
    writeLock.lock();
    try {
      PurgeResult result =
          inTransaction(
              "purge ledger",
              () -> {
                int sessions =
                    jdbcTemplate.update("DELETE FROM sync_sessions WHERE start_time < ?", cutoff);
                int records =
                    jdbcTemplate.update(
                        "DELETE FROM file_sync_history WHERE sync_time < ?", cutoff);
                return new PurgeResult(sessions, records);
              });
      try {
        // VACUUM cannot run inside a transaction
        jdbcTemplate.execute("VACUUM");
      } catch (DataAccessException | TransactionException e) {
        String message = String.format("Failed to vacuum ledger: %s", e.getMessage());
        LOGGER.error(message, e);
        throw new StorageException(message, e);
      }
      statsCache.invalidateAll();
      LOGGER.info(
          "Purged ledger: horizon={}, sessionsDeleted={}, recordsDeleted={}",
          horizon,
          result.sessionsDeleted(),
          result.recordsDeleted());
      return result;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public int exportHistory(Path output, String sessionId) {
    List<FileSyncRecord> records =
        read(
            "export history",
            () ->
                sessionId != null
                    ? jdbcTemplate.query(
                        "SELECT "
                            + HISTORY_COLUMNS
                            + " FROM file_sync_history WHERE session_id = ? ORDER BY sync_time, id",
                        RECORD_MAPPER,
                        sessionId)
                    : jdbcTemplate.query(
                        "SELECT "
                            + HISTORY_COLUMNS
                            + " FROM file_sync_history ORDER BY sync_time DESC, id DESC LIMIT ?",
                        RECORD_MAPPER,
                        EXPORT_LIMIT));

    HistoryExport export = new HistoryExport(clock.instant(), sessionId, records.size(), records);
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), export);
    } catch (IOException e) {
      String message = String.format("Failed to export history to %s", output);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
    LOGGER.info("Exported {} history records to {}", records.size(), output);
    return records.size();
  }

  /** Shape of the exported JSON document. */
  public record HistoryExport(
      Instant exportedAt, String sessionId, int recordCount, List<FileSyncRecord> records) {}

  // ---------------------------------------------------------------------------------------------
  // Settings
  // ---------------------------------------------------------------------------------------------

  @Override
  public String getSetting(String key, String defaultValue) {
    List<String> values =
        read(
            "read setting",
            () ->
                jdbcTemplate.queryForList(
                    "SELECT value FROM sync_settings WHERE key = ?", String.class, key));
    return values.isEmpty() || values.get(0) == null ? defaultValue : values.get(0);
  }

  @Override
  public void putSetting(String key, String value) {
    write(
        "write setting",
        () ->
            jdbcTemplate.update(
                "INSERT INTO sync_settings (key, value, updated_at) VALUES (?, ?, ?)"
                    + " ON CONFLICT(key) DO UPDATE SET value = excluded.value,"
                    + " updated_at = excluded.updated_at",
                key,
                value,
                clock.millis()));
  }

  // ---------------------------------------------------------------------------------------------
  // Plumbing
  // ---------------------------------------------------------------------------------------------

  private <T> T write(String operation, Supplier<T> work) {
    writeLock.lock();
    try {
      T result = inTransaction(operation, work);
      statsCache.invalidateAll();
      return result;
    } finally {
      writeLock.unlock();
    }
  }

  private <T> T inTransaction(String operation, Supplier<T> work) {
    try {
      return transactionTemplate.execute(status -> work.get());
    } catch (DataAccessException | TransactionException e) {
      String message = String.format("Ledger operation failed: %s", operation);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  private <T> T read(String operation, Supplier<T> work) {
    try {
      return work.get();
    } catch (DataAccessException | TransactionException e) {
      String message = String.format("Ledger operation failed: %s", operation);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  private long count(String sql, Object... args) {
    Long value = jdbcTemplate.queryForObject(sql, Long.class, args);
    return value != null ? value : 0L;
  }

  static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
    long millis = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
  }

  private static final RowMapper<SyncSession> SESSION_MAPPER =
      (rs, rowNum) ->
          new SyncSession(
              rs.getString("session_id"),
              rs.getString("source_path"),
              instantOrNull(rs, "start_time"),
              instantOrNull(rs, "end_time"),
              SessionStatus.fromDb(rs.getString("status")),
              new SessionCounters(
                  rs.getInt("total_files"),
                  rs.getInt("synced_files"),
                  rs.getInt("failed_files"),
                  rs.getInt("skipped_files"),
                  rs.getLong("total_bytes"),
                  rs.getLong("synced_bytes")),
              rs.getString("error_message"));

  private static final RowMapper<FileSyncRecord> RECORD_MAPPER =
      (rs, rowNum) ->
          new FileSyncRecord(
              rs.getLong("id"),
              rs.getString("session_id"),
              rs.getString("file_path"),
              rs.getString("file_name"),
              rs.getLong("file_size"),
              ContentFingerprint.fromHex(rs.getString("file_hash")),
              rs.getString("remote_id"),
              rs.getString("remote_folder_id"),
              FileSyncStatus.fromDb(rs.getString("sync_status")),
              instantOrNull(rs, "sync_time"),
              rs.getString("error_message"),
              rs.getInt("retry_count"));

  private static final RowMapper<FileTrackingEntry> TRACKING_MAPPER =
      (rs, rowNum) ->
          new FileTrackingEntry(
              rs.getString("file_path"),
              rs.getString("file_name"),
              rs.getLong("file_size"),
              ContentFingerprint.fromHex(rs.getString("file_hash")),
              instantOrNull(rs, "last_modified"),
              instantOrNull(rs, "last_synced"),
              rs.getString("remote_id"),
              rs.getInt("sync_count"));
}
