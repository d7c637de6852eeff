package com.scholary.audiosync.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosync.exception.StorageException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import com.scholary.audiosync.support.LedgerFixtures;
import com.scholary.audiosync.support.MutableClock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.datasource.DelegatingDataSource;

class JdbcFingerprintLedgerTest {

  private static final String FOLDER = "audio-sync/";

  @TempDir Path tempDir;

  private MutableClock clock;
  private JdbcFingerprintLedger ledger;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    ledger = LedgerFixtures.open(tempDir, clock);
  }

  @Test
  void openSession_shouldCreateInProgressSession() {
    String sessionId = ledger.openSession("/Volumes/AUDIO_USB");

    assertThat(sessionId).matches("session_20240501_100000_[0-9a-f]{8}");
    SyncSession session = ledger.findSession(sessionId).orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.IN_PROGRESS);
    assertThat(session.sourcePath()).isEqualTo("/Volumes/AUDIO_USB");
    assertThat(session.startTime()).isEqualTo(clock.instant());
    assertThat(session.endTime()).isNull();
    assertThat(session.counters()).isEqualTo(SessionCounters.empty());
  }

  @Test
  void closeSession_shouldNotReopenOrChangeTerminalSession() {
    String sessionId = ledger.openSession("usb");
    clock.advance(Duration.ofMinutes(3));
    ledger.closeSession(sessionId, false, "credentials rejected");

    ledger.closeSession(sessionId, true, null);
    ledger.updateSessionCounters(sessionId, new SessionCounters(9, 9, 0, 0, 90, 90));

    SyncSession session = ledger.findSession(sessionId).orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.FAILED);
    assertThat(session.errorMessage()).isEqualTo("credentials rejected");
    assertThat(session.endTime()).isEqualTo(Instant.parse("2024-05-01T10:03:00Z"));
    assertThat(session.counters()).isEqualTo(SessionCounters.empty());
  }

  @Test
  void updateSessionCounters_shouldStoreLatestSnapshot() {
    String sessionId = ledger.openSession("usb");

    ledger.updateSessionCounters(sessionId, new SessionCounters(4, 1, 0, 0, 400, 100));
    ledger.updateSessionCounters(sessionId, new SessionCounters(4, 2, 1, 1, 400, 200));
    ledger.closeSession(sessionId, true, null);

    SyncSession session = ledger.findSession(sessionId).orElseThrow();
    assertThat(session.status()).isEqualTo(SessionStatus.COMPLETED);
    assertThat(session.counters()).isEqualTo(new SessionCounters(4, 2, 1, 1, 400, 200));
  }

  @Test
  void recordAttempt_shouldTrackSuccessAndCountEverySession() {
    FileMeta file = file("processed/20240501/memo.mp3", "content-a");

    String first = ledger.openSession("usb");
    ledger.recordAttempt(
        first,
        new FileSyncAttempt(file, "audio-sync/memo.mp3", FOLDER, 0),
        FileSyncStatus.SUCCESS,
        null);
    String second = ledger.openSession("usb");
    ledger.recordAttempt(
        second,
        new FileSyncAttempt(file, "audio-sync/memo.mp3", FOLDER, 2),
        FileSyncStatus.SUCCESS,
        null);

    FileTrackingEntry entry = ledger.findTrackingEntry(file.pathKey()).orElseThrow();
    assertThat(entry.fingerprint()).isEqualTo(file.fingerprint());
    assertThat(entry.syncCount()).isEqualTo(2);
    assertThat(entry.remoteId()).isEqualTo("audio-sync/memo.mp3");
    assertThat(entry.lastSynced()).isEqualTo(clock.instant());
  }

  @Test
  void recordAttempt_shouldBeIdempotentForSameSuccessInSameSession() {
    FileMeta file = file("processed/memo.mp3", "content-a");
    String sessionId = ledger.openSession("usb");

    long firstId = succeed(sessionId, file, FOLDER);
    long secondId = succeed(sessionId, file, FOLDER);

    assertThat(secondId).isEqualTo(firstId);
    assertThat(ledger.findTrackingEntry(file.pathKey()).orElseThrow().syncCount()).isEqualTo(1);
    assertThat(ledger.statistics().successfulFiles()).isEqualTo(1);
  }

  @Test
  void recordAttempt_shouldRejectSuccessWithoutFingerprint() {
    FileMeta file = new FileMeta(tempDir.resolve("memo.mp3"), null, 10, null, null, false);
    String sessionId = ledger.openSession("usb");

    assertThatThrownBy(
            () ->
                ledger.recordAttempt(
                    sessionId, FileSyncAttempt.of(file), FileSyncStatus.SUCCESS, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("fingerprint");
  }

  @Test
  void recordAttempt_shouldNotTrackFailuresOrSkips() {
    FileMeta failed = file("processed/a.mp3", "a");
    FileMeta skipped = file("processed/b.mp3", "b");
    String sessionId = ledger.openSession("usb");

    fail(sessionId, failed, FileSyncStatus.FAILED, "timeout");
    fail(sessionId, skipped, FileSyncStatus.SKIPPED, "too large");

    assertThat(ledger.findTrackingEntry(failed.pathKey())).isEmpty();
    assertThat(ledger.findTrackingEntry(skipped.pathKey())).isEmpty();
    assertThat(ledger.isDuplicate(failed.fingerprint())).isEmpty();
    assertThat(ledger.selectFilesNeedingSync(List.of(failed, skipped)))
        .containsExactly(failed, skipped);
  }

  @Test
  void isDuplicate_shouldOnlyMatchSuccessesInSameFolder() {
    FileMeta file = file("processed/memo.mp3", "shared content");
    String sessionId = ledger.openSession("usb");
    ledger.recordAttempt(
        sessionId,
        new FileSyncAttempt(file, "audio-sync/memo.mp3", FOLDER, 0),
        FileSyncStatus.SUCCESS,
        null);

    Optional<FileSyncRecord> sameFolder = ledger.isDuplicate(file.fingerprint(), FOLDER);
    assertThat(sameFolder).isPresent();
    assertThat(sameFolder.get().name()).isEqualTo("memo.mp3");
    assertThat(sameFolder.get().status()).isEqualTo(FileSyncStatus.SUCCESS);

    assertThat(ledger.isDuplicate(file.fingerprint(), "other-root/")).isEmpty();
    assertThat(ledger.isDuplicate(file.fingerprint())).isPresent();
    assertThat(ledger.isDuplicate(fingerprint("never delivered"), FOLDER)).isEmpty();
  }

  @Test
  void selectFilesNeedingSync_shouldKeepNewChangedAndForcedFiles() {
    FileMeta unchanged = file("processed/unchanged.mp3", "v1");
    FileMeta modified = file("processed/modified.mp3", "v1");
    FileMeta forced = file("processed/forced.mp3", "v1");
    String sessionId = ledger.openSession("usb");
    for (FileMeta meta : List.of(unchanged, modified, forced)) {
      succeed(sessionId, meta, FOLDER);
    }

    FileMeta modifiedNow = modified.withFingerprint(fingerprint("v2"));
    FileMeta fresh = file("processed/fresh.mp3", "new");
    FileMeta unhashed =
        new FileMeta(tempDir.resolve("processed/unhashed.mp3"), null, 1, null, null, false);

    List<FileMeta> needed =
        ledger.selectFilesNeedingSync(
            List.of(unchanged, modifiedNow, forced.forced(), fresh, unhashed));

    assertThat(needed).containsExactly(modifiedNow, forced.forced(), fresh, unhashed);
  }

  @Test
  void statistics_shouldAggregateHistoryAndRefreshAfterWrites() {
    String sessionId = ledger.openSession("usb");
    succeed(sessionId, file("p/a.mp3", "a", 100), FOLDER);
    succeed(sessionId, file("p/b.MP3", "b", 300), FOLDER);
    succeed(sessionId, file("p/c.wav", "c", 50), FOLDER);
    fail(sessionId, file("p/d.mp3", "d", 70), FileSyncStatus.FAILED, "boom");

    SyncStats stats = ledger.statistics();
    assertThat(stats.totalSessions()).isEqualTo(1);
    assertThat(stats.successfulFiles()).isEqualTo(3);
    assertThat(stats.bytesSynced()).isEqualTo(450);
    assertThat(stats.uniqueFingerprints()).isEqualTo(3);
    assertThat(stats.filesToday()).isEqualTo(3);
    assertThat(stats.bytesToday()).isEqualTo(450);
    assertThat(stats.failuresLast7Days()).isEqualTo(1);
    assertThat(stats.byExtension())
        .containsExactly(
            new SyncStats.ExtensionTotal(".mp3", 2, 400),
            new SyncStats.ExtensionTotal(".wav", 1, 50));

    succeed(sessionId, file("p/e.mp3", "e", 1), FOLDER);
    assertThat(ledger.statistics().successfulFiles()).isEqualTo(4);
  }

  @Test
  void purgeOlderThan_shouldDeleteOnlyRowsPastHorizon() {
    String oldSession = ledger.openSession("usb");
    succeed(oldSession, file("p/old.mp3", "old"), FOLDER);
    ledger.closeSession(oldSession, true, null);

    clock.advance(Duration.ofDays(100));
    String recentSession = ledger.openSession("usb");
    succeed(recentSession, file("p/new.mp3", "new"), FOLDER);

    PurgeResult result = ledger.purgeOlderThan(Duration.ofDays(90));

    assertThat(result).isEqualTo(new PurgeResult(1, 1));
    assertThat(ledger.findSession(oldSession)).isEmpty();
    assertThat(ledger.findSession(recentSession)).isPresent();
    assertThat(ledger.isDuplicate(fingerprint("old"), FOLDER)).isEmpty();
    assertThat(ledger.isDuplicate(fingerprint("new"), FOLDER)).isPresent();
  }

  @Test
  void recentSessions_shouldListNewestFirst() {
    String first = ledger.openSession("one");
    clock.advance(Duration.ofSeconds(1));
    String second = ledger.openSession("two");
    clock.advance(Duration.ofSeconds(1));
    String third = ledger.openSession("three");

    assertThat(ledger.recentSessions(2))
        .extracting(SyncSession::sessionId)
        .containsExactly(third, second);
    assertThat(ledger.recentSessions(10)).extracting(SyncSession::sessionId).endsWith(first);
  }

  @Test
  void duplicateContent_shouldGroupRepeatedDeliveries() {
    String sessionId = ledger.openSession("usb");
    succeed(sessionId, file("p/a.mp3", "same", 10), FOLDER);
    succeed(sessionId, file("q/a-copy.mp3", "same", 10), "other/");
    succeed(sessionId, file("p/b.mp3", "unique", 10), FOLDER);

    List<DuplicateContent> duplicates = ledger.duplicateContent();

    assertThat(duplicates).hasSize(1);
    assertThat(duplicates.get(0).fingerprint()).isEqualTo(fingerprint("same"));
    assertThat(duplicates.get(0).deliveries()).isEqualTo(2);
    assertThat(duplicates.get(0).fileNames()).containsExactlyInAnyOrder("a.mp3", "a-copy.mp3");
    assertThat(duplicates.get(0).totalBytes()).isEqualTo(20);
  }

  @Test
  void exportHistory_shouldWriteSessionRecordsAsJson() throws Exception {
    String exported = ledger.openSession("usb");
    succeed(exported, file("p/a.mp3", "a"), FOLDER);
    fail(exported, file("p/b.mp3", "b"), FileSyncStatus.FAILED, "timeout");
    String other = ledger.openSession("usb");
    succeed(other, file("p/c.mp3", "c"), FOLDER);

    Path output = tempDir.resolve("exports/history.json");
    int count = ledger.exportHistory(output, exported);

    assertThat(count).isEqualTo(2);
    JsonNode json = new ObjectMapper().readTree(output.toFile());
    assertThat(json.get("sessionId").asText()).isEqualTo(exported);
    assertThat(json.get("recordCount").asInt()).isEqualTo(2);
    assertThat(json.get("records")).hasSize(2);
    assertThat(json.get("records").get(0).get("fingerprint").asText())
        .isEqualTo(fingerprint("a").hex());
    assertThat(json.get("records").get(1).get("error").asText()).isEqualTo("timeout");

    assertThat(ledger.exportHistory(tempDir.resolve("all.json"), null)).isEqualTo(3);
  }

  @Test
  void settings_shouldUpsertAndFallBackToDefault() {
    assertThat(ledger.getSetting("last_volume", "none")).isEqualTo("none");

    ledger.putSetting("last_volume", "AUDIO_USB");
    ledger.putSetting("last_volume", "AUDIO_USB_2");

    assertThat(ledger.getSetting("last_volume", "none")).isEqualTo("AUDIO_USB_2");
  }

  @Test
  void reopen_shouldKeepExistingLedgerContent() {
    FileMeta file = file("p/a.mp3", "a");
    String sessionId = ledger.openSession("usb");
    succeed(sessionId, file, FOLDER);

    JdbcFingerprintLedger reopened = LedgerFixtures.open(tempDir, clock);

    assertThat(reopened.findSession(sessionId)).isPresent();
    assertThat(reopened.isDuplicate(file.fingerprint(), FOLDER)).isPresent();
  }

  private long succeed(String sessionId, FileMeta file, String folderId) {
    return ledger.recordAttempt(
        sessionId, FileSyncAttempt.of(file, folderId), FileSyncStatus.SUCCESS, null);
  }

  @Test
  void recordAttempt_shouldCountConcurrentSuccessesOnSamePath() throws Exception {
    int sessions = 12;
    FileMeta file = file("processed/shared.mp3", "shared");
    List<String> sessionIds = new ArrayList<>();
    for (int i = 0; i < sessions; i++) {
      sessionIds.add(ledger.openSession("usb-" + i));
    }

    ExecutorService pool = Executors.newFixedThreadPool(6);
    try {
      List<Callable<Long>> tasks = new ArrayList<>();
      for (String sessionId : sessionIds) {
        tasks.add(() -> succeed(sessionId, file, FOLDER));
      }
      for (Future<Long> result : pool.invokeAll(tasks)) {
        result.get();
      }
    } finally {
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(ledger.findTrackingEntry(file.pathKey()).orElseThrow().syncCount())
        .isEqualTo(sessions);
    assertThat(ledger.statistics().successfulFiles()).isEqualTo(sessions);
  }

  @Test
  void selectFilesNeedingSync_shouldReturnSameSetWhenCalledTwice() {
    FileMeta synced = file("processed/synced.mp3", "v1");
    String sessionId = ledger.openSession("usb");
    succeed(sessionId, synced, FOLDER);
    List<FileMeta> candidates =
        List.of(
            synced,
            file("processed/fresh.mp3", "new"),
            file("processed/synced.mp3", "v2"),
            file("processed/forced.mp3", "v1").forced());

    List<FileMeta> first = ledger.selectFilesNeedingSync(candidates);
    List<FileMeta> second = ledger.selectFilesNeedingSync(candidates);

    assertThat(new HashSet<>(second)).isEqualTo(new HashSet<>(first));
    assertThat(first).hasSize(3).doesNotContain(synced);
  }

  @Test
  void openSession_shouldFailWithStorageExceptionWhenConnectionUnavailable() {
    FailingDataSource dataSource = new FailingDataSource(LedgerFixtures.dataSource(tempDir));
    JdbcFingerprintLedger failingLedger = LedgerFixtures.open(tempDir, clock, dataSource);
    String sessionId = failingLedger.openSession("usb");

    dataSource.failing.set(true);

    assertThatThrownBy(() -> failingLedger.openSession("usb"))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("open session");
    assertThatThrownBy(
            () ->
                failingLedger.recordAttempt(
                    sessionId,
                    FileSyncAttempt.of(file("processed/a.mp3", "a"), FOLDER),
                    FileSyncStatus.SUCCESS,
                    null))
        .isInstanceOf(StorageException.class);
    assertThatThrownBy(() -> failingLedger.findSession(sessionId))
        .isInstanceOf(StorageException.class);

    dataSource.failing.set(false);
    assertThat(failingLedger.findSession(sessionId)).isPresent();
  }

  @Test
  void putSetting_shouldOverwriteAndReturnDefaultWhenMissing() {
    assertThat(ledger.getSetting("last_device", "none")).isEqualTo("none");

    ledger.putSetting("last_device", "AUDIO_USB");
    ledger.putSetting("last_device", "AUDIO_USB_2");

    assertThat(ledger.getSetting("last_device", "none")).isEqualTo("AUDIO_USB_2");
  }

  private void fail(String sessionId, FileMeta file, FileSyncStatus status, String error) {
    ledger.recordAttempt(sessionId, FileSyncAttempt.of(file), status, error);
  }

  private FileMeta file(String relative, String content) {
    return file(relative, content, content.length());
  }

  private FileMeta file(String relative, String content, long size) {
    return new FileMeta(
        tempDir.resolve(relative), null, size, clock.instant(), fingerprint(content), false);
  }

  private static ContentFingerprint fingerprint(String content) {
    return ContentFingerprint.of(content.getBytes(StandardCharsets.UTF_8));
  }

  /** Hands out connections until told to fail. */
  private static final class FailingDataSource extends DelegatingDataSource {
    final AtomicBoolean failing = new AtomicBoolean();

    FailingDataSource(DataSource target) {
      super(target);
    }

    @Override
    public Connection getConnection() throws SQLException {
      if (failing.get()) {
        throw new SQLException("database is locked");
      }
      return super.getConnection();
    }
  }
}
