package com.scholary.audiosync.staging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import com.scholary.audiosync.ledger.FileMeta;
import com.scholary.audiosync.ledger.FileSyncAttempt;
import com.scholary.audiosync.ledger.FileSyncStatus;
import com.scholary.audiosync.ledger.JdbcFingerprintLedger;
import com.scholary.audiosync.support.LedgerFixtures;
import com.scholary.audiosync.support.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagingLifecycleTest {

  private static final List<String> AUDIO = List.of("*.mp3", "*.wav", "*.m4a");

  @TempDir Path tempDir;

  private MutableClock clock;
  private Path source;
  private StagingLifecycle staging;

  @BeforeEach
  void setUp() throws IOException {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    source = Files.createDirectories(tempDir.resolve("usb"));
    staging = new StagingLifecycle(properties(true, false), clock);
  }

  @Test
  void listFiles_shouldMatchCaseInsensitivelyAndSkipSystemAndHiddenFiles() throws IOException {
    write(source.resolve("b.MP3"), "b");
    write(source.resolve("a.wav"), "a");
    write(source.resolve("notes.txt"), "n");
    write(source.resolve(".hidden.mp3"), "h");
    write(source.resolve("day1/c.m4a"), "c");
    write(source.resolve(".Trashes/deleted.mp3"), "t");
    write(source.resolve("System Volume Information/x.wav"), "x");

    List<Path> found = staging.listFiles(source, AUDIO);

    assertThat(found)
        .containsExactly(
            source.resolve("a.wav"), source.resolve("b.MP3"), source.resolve("day1/c.m4a"));
  }

  @Test
  void listFiles_shouldReturnEmptyForMissingRoot() {
    assertThat(staging.listFiles(tempDir.resolve("not-mounted"), AUDIO)).isEmpty();
  }

  @Test
  void stageFromSource_shouldCopyIntoDatedRawFolderPreservingStructure() throws IOException {
    write(source.resolve("memo.mp3"), "memo content");
    write(source.resolve("2024/lecture.wav"), "lecture content");

    List<Path> staged = staging.stageFromSource(source, AUDIO);

    Path day = staging.rawDir().resolve("20240501");
    assertThat(staged).containsExactly(day.resolve("2024/lecture.wav"), day.resolve("memo.mp3"));
    assertThat(Files.readString(day.resolve("memo.mp3"))).isEqualTo("memo content");
    assertThat(Files.readString(day.resolve("2024/lecture.wav"))).isEqualTo("lecture content");
    assertThat(source.resolve("memo.mp3")).exists();
    try (var entries = Files.list(day)) {
      assertThat(entries.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".part"));
    }
  }

  @Test
  void stageFromSource_shouldTreatSameSizeDestinationAsStaged() throws IOException {
    write(source.resolve("memo.mp3"), "original");
    staging.stageFromSource(source, AUDIO);
    Path staged = staging.rawDir().resolve("20240501/memo.mp3");
    // same size, different bytes: the size check alone decides
    Files.writeString(staged, "ORIGINAL");

    List<Path> again = staging.stageFromSource(source, AUDIO);

    assertThat(again).containsExactly(staged);
    assertThat(Files.readString(staged)).isEqualTo("ORIGINAL");
  }

  @Test
  void stageFromSource_shouldRecopyWhenSizeDiffers() throws IOException {
    write(source.resolve("memo.mp3"), "original");
    Path staged = staging.rawDir().resolve("20240501/memo.mp3");
    write(staged, "partial");

    staging.stageFromSource(source, AUDIO);

    assertThat(Files.readString(staged)).isEqualTo("original");
  }

  @Test
  void stageFromSource_shouldReturnEmptyForMissingSource() {
    assertThat(staging.stageFromSource(tempDir.resolve("gone"), AUDIO)).isEmpty();
  }

  @Test
  void verifyCopy_shouldDeleteDestinationOnMismatch() throws IOException {
    Path original = write(tempDir.resolve("a.mp3"), "abc");
    Path goodCopy = write(tempDir.resolve("b.mp3"), "abc");
    Path badCopy = write(tempDir.resolve("c.mp3"), "abd");

    assertThat(staging.verifyCopy(original, goodCopy)).isTrue();
    assertThat(goodCopy).exists();
    assertThat(staging.verifyCopy(original, badCopy)).isFalse();
    assertThat(badCopy).doesNotExist();
  }

  @Test
  void promoteToProcessed_shouldPlaceOutputAndArchiveRaw() throws IOException {
    Path raw = write(staging.rawDir().resolve("20240501/day1/memo.wav"), "raw audio");
    Path output = write(tempDir.resolve("scratch/memo_processed.mp3"), "encoded");

    Path promoted = staging.promoteToProcessed(raw, output);

    assertThat(promoted).isEqualTo(staging.processedDir().resolve("20240501/day1/memo.mp3"));
    assertThat(Files.readString(promoted)).isEqualTo("encoded");
    assertThat(raw).doesNotExist();
    assertThat(output).doesNotExist();
    assertThat(Files.readString(staging.archiveDir().resolve("20240501/day1/memo.wav")))
        .isEqualTo("raw audio");
    assertThat(promoted.resolveSibling("memo.mp3.promoting")).doesNotExist();
  }

  @Test
  void promoteToProcessed_shouldRollBackWhenArchivingFails() throws IOException {
    Path raw = write(staging.rawDir().resolve("20240501/memo.wav"), "raw audio");
    Path output = write(tempDir.resolve("scratch/memo_processed.mp3"), "encoded");
    // a non-empty directory where the archived file should go
    write(staging.archiveDir().resolve("20240501/memo.wav/blocker"), "x");

    assertThatThrownBy(() -> staging.promoteToProcessed(raw, output))
        .isInstanceOf(IOException.class);

    assertThat(Files.readString(raw)).isEqualTo("raw audio");
    assertThat(Files.readString(output)).isEqualTo("encoded");
    assertThat(staging.processedDir().resolve("20240501/memo.mp3")).doesNotExist();
    assertThat(staging.processedDir().resolve("20240501/memo.mp3.promoting")).doesNotExist();
  }

  @Test
  void listProcessed_shouldCompletePromotionInterruptedAfterArchiving() throws IOException {
    Path raw = write(staging.rawDir().resolve("20240501/memo.wav"), "raw audio");
    Path output = write(tempDir.resolve("scratch/memo_processed.mp3"), "encoded");
    Path finalPath = staging.processedDir().resolve("20240501/memo.mp3");
    // a non-empty directory where the processed file should go
    Path blocker = write(finalPath.resolve("blocker"), "x");

    assertThatThrownBy(() -> staging.promoteToProcessed(raw, output))
        .isInstanceOf(IOException.class);
    Path pending = finalPath.resolveSibling("memo.mp3.promoting");
    assertThat(raw).doesNotExist();
    assertThat(pending).hasContent("encoded");

    Files.delete(blocker);
    Files.delete(finalPath);

    assertThat(staging.listProcessed()).containsExactly(finalPath);
    assertThat(finalPath).hasContent("encoded");
    assertThat(pending).doesNotExist();
  }

  @Test
  void promoteToProcessed_shouldRejectFilesOutsideRaw() throws IOException {
    Path stray = write(tempDir.resolve("stray.wav"), "x");
    Path output = write(tempDir.resolve("out.mp3"), "y");

    assertThatThrownBy(() -> staging.promoteToProcessed(stray, output))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void archiveRaw_shouldMoveFileOutOfRaw() throws IOException {
    Path raw = write(staging.rawDir().resolve("20240501/silence.wav"), "quiet");

    Path archived = staging.archiveRaw(raw);

    assertThat(archived).isEqualTo(staging.archiveDir().resolve("20240501/silence.wav"));
    assertThat(raw).doesNotExist();
    assertThat(staging.listUnprocessed()).isEmpty();
  }

  @Test
  void listUnprocessed_shouldSkipFilesWithProcessedCounterpart() throws IOException {
    Path done = write(staging.rawDir().resolve("20240501/done.wav"), "a");
    Path pending = write(staging.rawDir().resolve("20240501/pending.wav"), "b");
    write(staging.processedDir().resolve("20240501/done.mp3"), "encoded");

    assertThat(staging.listUnprocessed()).containsExactly(pending).doesNotContain(done);
  }

  @Test
  void reclaimExpired_shouldOnlyDeleteOldArchiveFiles() throws IOException {
    Instant old = clock.instant().minus(Duration.ofDays(40));
    Path expired = write(staging.archiveDir().resolve("20240320/old.wav"), "12345");
    Path recent = write(staging.archiveDir().resolve("20240430/new.wav"), "678");
    Path oldRaw = write(staging.rawDir().resolve("20240320/unprocessed.wav"), "raw");
    Path oldProcessed = write(staging.processedDir().resolve("20240320/out.mp3"), "mp3");
    for (Path file : List.of(expired, oldRaw, oldProcessed)) {
      Files.setLastModifiedTime(file, FileTime.from(old));
    }
    Files.setLastModifiedTime(recent, FileTime.from(clock.instant().minus(Duration.ofDays(1))));

    ReclaimResult result = staging.reclaimExpired(Duration.ofDays(30));

    assertThat(result).isEqualTo(new ReclaimResult(1, 5));
    assertThat(expired).doesNotExist();
    assertThat(expired.getParent()).doesNotExist();
    assertThat(recent).exists();
    assertThat(oldRaw).exists();
    assertThat(oldProcessed).exists();
    assertThat(staging.archiveDir()).exists();
  }

  @Test
  void usageReport_shouldSumEachArea() throws IOException {
    write(staging.rawDir().resolve("a.wav"), "1234");
    write(staging.processedDir().resolve("a.mp3"), "12");
    write(staging.archiveDir().resolve("b.wav"), "123456");

    StorageUsage usage = staging.usageReport();

    assertThat(usage.rawBytes()).isEqualTo(4);
    assertThat(usage.processedBytes()).isEqualTo(2);
    assertThat(usage.archiveBytes()).isEqualTo(6);
    assertThat(usage.totalBytes()).isEqualTo(12);
    assertThat(usage.diskTotalBytes()).isPositive();
    assertThat(usage.maxStorageBytes()).isEqualTo(1024L * 1024 * 1024);
  }

  @Test
  void listPendingUpload_shouldLeaveOutFilesLedgerHasSeen() throws IOException {
    JdbcFingerprintLedger ledger = LedgerFixtures.open(tempDir, clock);
    Path synced = write(staging.processedDir().resolve("20240501/synced.mp3"), "synced");
    Path fresh = write(staging.processedDir().resolve("20240501/fresh.mp3"), "fresh");
    String sessionId = ledger.openSession("test");
    ledger.recordAttempt(
        sessionId,
        FileSyncAttempt.of(FileMeta.fingerprinted(synced), "root/"),
        FileSyncStatus.SUCCESS,
        null);

    List<FileMeta> pending = staging.listPendingUpload(ledger);

    assertThat(pending).extracting(FileMeta::path).containsExactly(fresh);
    assertThat(pending.get(0).fingerprint()).isEqualTo(ContentFingerprint.of(fresh));
  }

  private StagingProperties properties(boolean verifyCopy, boolean autoCleanup) {
    return new StagingProperties(
        tempDir.resolve("staging").toString(),
        "",
        List.of("*.mp3", "*.wav", "*.m4a"),
        List.of(".Trashes", "System Volume Information"),
        30,
        autoCleanup,
        verifyCopy,
        64,
        1.0);
  }

  private static Path write(Path file, String content) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content);
  }
}
