package com.scholary.audiosync.staging;

import com.scholary.audiosync.exception.IntegrityException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import com.scholary.audiosync.ledger.FileMeta;
import com.scholary.audiosync.ledger.FingerprintLedger;
import com.scholary.audiosync.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the local staging directories and every move between them.
 *
 * <p>A staged file goes through three areas under the base directory:
 *
 * <ol>
 *   <li>{@code raw/<yyyyMMdd>/<relative path>}: a verified copy of the file on the source media
 *   <li>{@code processed/<yyyyMMdd>/<relative path>.mp3}: the trimmed output
 *   <li>{@code archive/<yyyyMMdd>/<relative path>}: the raw original, kept for the retention window
 * </ol>
 *
 * <p>Every transition is ordered so that the raw original is always resolvable from either {@code
 * raw/} or {@code archive/}. Only {@code archive/} is ever cleaned by retention.
 */
public class StagingLifecycle {

  private static final Logger LOGGER = LoggerFactory.getLogger(StagingLifecycle.class);

  static final String RAW = "raw";
  static final String PROCESSED = "processed";
  static final String ARCHIVE = "archive";
  static final String PROCESSED_EXTENSION = ".mp3";

  private static final String PART_SUFFIX = ".part";
  private static final String PROMOTING_SUFFIX = ".promoting";
  private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

  private final StagingProperties properties;
  private final Clock clock;
  private final Path baseDir;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public StagingLifecycle(StagingProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
    this.baseDir = properties.basePath();
    LOGGER.info("Staging area: baseDir={}", baseDir);
  }

  public Path rawDir() {
    return baseDir.resolve(RAW);
  }

  public Path processedDir() {
    return baseDir.resolve(PROCESSED);
  }

  public Path archiveDir() {
    return baseDir.resolve(ARCHIVE);
  }

  /** Scratch directory for intermediate files such as freshly encoded output. */
  public Path tempDir() {
    return properties.tempPath();
  }

  // ---------------------------------------------------------------------------------------------
  // Discovery and staging
  // ---------------------------------------------------------------------------------------------

  /**
   * Find files under {@code root} matching any of the glob patterns.
   *
   * <p>Matching is case-insensitive. A pattern containing {@code /} is matched against the path
   * relative to {@code root}; any other pattern only against the file name. Hidden files and the
   * configured system folders are skipped. A missing root yields an empty list.
   *
   * @return matching regular files, sorted by path
   */
  public List<Path> listFiles(Path root, List<String> patterns) {
    if (!Files.isDirectory(root)) {
      LOGGER.warn("Source directory does not exist: {}", root);
      return List.of();
    }

    List<PathMatcher> nameMatchers = new ArrayList<>();
    List<PathMatcher> relativeMatchers = new ArrayList<>();
    for (String pattern : patterns) {
      PathMatcher matcher =
          FileSystems.getDefault().getPathMatcher("glob:" + pattern.toLowerCase(Locale.ROOT));
      if (pattern.contains("/")) {
        relativeMatchers.add(matcher);
      } else {
        nameMatchers.add(matcher);
      }
    }
    Set<String> excluded = Set.copyOf(properties.excludeFolders());

    List<Path> found = new ArrayList<>();
    try {
      Files.walkFileTree(
          root,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (!dir.equals(root) && excluded.contains(dir.getFileName().toString())) {
                LOGGER.debug("Skipping excluded folder: {}", dir);
                return FileVisitResult.SKIP_SUBTREE;
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              String name = file.getFileName().toString();
              if (!attrs.isRegularFile() || name.startsWith(".")) {
                return FileVisitResult.CONTINUE;
              }
              Path lowerName = Path.of(name.toLowerCase(Locale.ROOT));
              Path lowerRelative =
                  Path.of(
                      root.relativize(file)
                          .toString()
                          .replace('\\', '/')
                          .toLowerCase(Locale.ROOT));
              boolean matches =
                  nameMatchers.stream().anyMatch(m -> m.matches(lowerName))
                      || relativeMatchers.stream().anyMatch(m -> m.matches(lowerRelative));
              if (matches) {
                found.add(file);
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              LOGGER.warn("Cannot read {}: {}", file, exc.getMessage());
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      LOGGER.error("Failed to scan {}", root, e);
      return List.of();
    }

    Collections.sort(found);
    LOGGER.info("Found {} matching files under {}", found.size(), root);
    return found;
  }

  /**
   * Copy matching files from the source media into today's raw folder.
   *
   * <p>A destination that already exists with the same size counts as staged. Files that fail to
   * copy or verify are logged and left out of the result; they never abort the rest.
   *
   * @return staged raw paths, including ones staged by an earlier run
   */
  public List<Path> stageFromSource(Path sourceRoot, List<String> patterns) {
    List<Path> sources = listFiles(sourceRoot, patterns);
    if (sources.isEmpty()) {
      return List.of();
    }

    Path dayDir = rawDir().resolve(LocalDate.now(clock).format(DAY_FORMAT));
    List<Path> staged = new ArrayList<>();
    for (Path source : sources) {
      Path destination = dayDir.resolve(sourceRoot.relativize(source).toString());
      try {
        staged.add(stageOne(source, destination));
      } catch (IntegrityException e) {
        LOGGER.error(
            "Copy verification failed, file not staged: source={}, destination={}",
            e.getSource(),
            e.getDestination());
      } catch (IOException e) {
        LOGGER.error("Failed to stage {}: {}", source, e.getMessage(), e);
      }
    }
    LOGGER.info("Staged {}/{} files from {}", staged.size(), sources.size(), sourceRoot);

    if (properties.autoCleanup()) {
      reclaimExpired(Duration.ofDays(properties.retentionDays()));
    }
    return staged;
  }

  private Path stageOne(Path source, Path destination) throws IOException {
    long size = Files.size(source);
    if (Files.exists(destination) && Files.size(destination) == size) {
      structuredLogger.logFileStaged(source.toString(), destination.toString(), size, true);
      return destination;
    }

    Files.createDirectories(destination.getParent());
    Path part = destination.resolveSibling(destination.getFileName() + PART_SUFFIX);
    try {
      copyBuffered(source, part);
      if (properties.verifyCopy() && !verifyCopy(source, part)) {
        throw new IntegrityException(source, destination);
      }
      FileMoves.moveIntoPlace(part, destination);
    } finally {
      Files.deleteIfExists(part);
    }

    structuredLogger.logFileStaged(source.toString(), destination.toString(), size, false);
    return destination;
  }

  private void copyBuffered(Path source, Path target) throws IOException {
    byte[] buffer = new byte[properties.copyBufferKb() * 1024];
    try (InputStream in = Files.newInputStream(source);
        OutputStream out = Files.newOutputStream(target)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        out.write(buffer, 0, read);
      }
    }
  }

  /**
   * Compare the content of a copy with its source.
   *
   * <p>On mismatch the destination is deleted, so a bad copy never lingers in staging.
   *
   * @return true if both files have the same fingerprint
   */
  public boolean verifyCopy(Path source, Path destination) throws IOException {
    ContentFingerprint expected = ContentFingerprint.of(source);
    ContentFingerprint actual = ContentFingerprint.of(destination);
    if (expected.equals(actual)) {
      return true;
    }
    LOGGER.warn(
        "Fingerprint mismatch: source={} ({}), copy={} ({})",
        source,
        expected.shortForm(),
        destination,
        actual.shortForm());
    Files.deleteIfExists(destination);
    return false;
  }

  // ---------------------------------------------------------------------------------------------
  // Transitions
  // ---------------------------------------------------------------------------------------------

  /**
   * Place processed output into the processed tree and archive its raw original.
   *
   * <p>The output is first moved next to its final location under a temporary name, then the raw
   * file is moved to the archive, and only then is the output renamed into place. If archiving
   * fails the output is put back and the raw file stays where it was.
   *
   * @param rawPath a file under {@code raw/}
   * @param processedOutput the encoded output, anywhere on disk
   * @return the final processed path, always with a {@code .mp3} extension
   */
  public Path promoteToProcessed(Path rawPath, Path processedOutput) throws IOException {
    Path relative = relativeToRaw(rawPath);
    Path finalPath = FileMoves.withExtension(processedDir().resolve(relative), PROCESSED_EXTENSION);
    Path promoting = finalPath.resolveSibling(finalPath.getFileName() + PROMOTING_SUFFIX);
    Path archived = archiveDir().resolve(relative);

    Files.createDirectories(finalPath.getParent());
    Files.move(processedOutput, promoting, StandardCopyOption.REPLACE_EXISTING);

    try {
      FileMoves.moveIntoPlace(rawPath, archived);
    } catch (IOException e) {
      LOGGER.error("Failed to archive {}, rolling back promotion", rawPath, e);
      Files.move(promoting, processedOutput, StandardCopyOption.REPLACE_EXISTING);
      throw e;
    }

    try {
      FileMoves.moveIntoPlace(promoting, finalPath);
    } catch (IOException e) {
      LOGGER.error(
          "Raw archived but output left at {}; it is moved into place on the next listing",
          promoting,
          e);
      throw e;
    }
    LOGGER.info("Promoted {} -> {} (raw archived to {})", rawPath, finalPath, archived);
    return finalPath;
  }

  /**
   * Archive a raw file that produced no output, so it is not picked up again.
   *
   * @return the archived path
   */
  public Path archiveRaw(Path rawPath) throws IOException {
    Path archived = archiveDir().resolve(relativeToRaw(rawPath));
    FileMoves.moveIntoPlace(rawPath, archived);
    LOGGER.info("Archived without output: {} -> {}", rawPath, archived);
    return archived;
  }

  private Path relativeToRaw(Path rawPath) {
    Path normalized = rawPath.toAbsolutePath().normalize();
    if (!normalized.startsWith(rawDir())) {
      throw new IllegalArgumentException("Not a staged raw file: " + rawPath);
    }
    return rawDir().relativize(normalized);
  }

  // ---------------------------------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------------------------------

  /** Raw audio files that have no processed counterpart yet. */
  public List<Path> listUnprocessed() {
    List<Path> unprocessed = new ArrayList<>();
    for (Path raw : listFiles(rawDir(), properties.patterns())) {
      Path counterpart =
          FileMoves.withExtension(
              processedDir().resolve(rawDir().relativize(raw)), PROCESSED_EXTENSION);
      if (!Files.exists(counterpart)) {
        unprocessed.add(raw);
      }
    }
    return unprocessed;
  }

  /** Every finished file in the processed tree, after completing interrupted promotions. */
  public List<Path> listProcessed() {
    completePendingPromotions();
    return listFiles(processedDir(), List.of("*" + PROCESSED_EXTENSION));
  }

  /**
   * Rename outputs left under their temporary name by a promotion whose last step failed. Their
   * raw originals are already archived, so nothing else would ever pick them up.
   */
  int completePendingPromotions() {
    int completed = 0;
    for (Path pending :
        listFiles(processedDir(), List.of("*" + PROCESSED_EXTENSION + PROMOTING_SUFFIX))) {
      String name = pending.getFileName().toString();
      Path finalPath =
          pending.resolveSibling(name.substring(0, name.length() - PROMOTING_SUFFIX.length()));
      try {
        FileMoves.moveIntoPlace(pending, finalPath);
        LOGGER.warn("Completed interrupted promotion: {} -> {}", pending, finalPath);
        completed++;
      } catch (IOException e) {
        LOGGER.error("Cannot complete promotion of {}, recover it by hand", pending, e);
      }
    }
    return completed;
  }

  /**
   * Processed files the ledger has not recorded with their current content.
   *
   * <p>Files that cannot be hashed are returned without a fingerprint, so the ledger keeps them.
   */
  public List<FileMeta> listPendingUpload(FingerprintLedger ledger) {
    List<FileMeta> candidates = new ArrayList<>();
    for (Path processed : listProcessed()) {
      try {
        FileMeta meta = FileMeta.of(processed);
        try {
          meta = meta.withFingerprint(ContentFingerprint.of(processed));
        } catch (IOException e) {
          LOGGER.warn("Cannot fingerprint {}: {}", processed, e.getMessage());
        }
        candidates.add(meta);
      } catch (IOException e) {
        LOGGER.warn("Skipping unreadable processed file {}: {}", processed, e.getMessage());
      }
    }
    return ledger.selectFilesNeedingSync(candidates);
  }

  // ---------------------------------------------------------------------------------------------
  // Retention and usage
  // ---------------------------------------------------------------------------------------------

  /**
   * Delete archived files older than the retention window and prune emptied directories.
   *
   * <p>Age is the file's modification time. Nothing outside {@code archive/} is touched.
   */
  public ReclaimResult reclaimExpired(Duration retention) {
    Path archive = archiveDir();
    if (!Files.isDirectory(archive)) {
      return ReclaimResult.none();
    }
    Instant cutoff = clock.instant().minus(retention);
    int[] deleted = {0};
    long[] bytes = {0};

    try {
      Files.walkFileTree(
          archive,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.isRegularFile() && attrs.lastModifiedTime().toInstant().isBefore(cutoff)) {
                try {
                  Files.delete(file);
                  deleted[0]++;
                  bytes[0] += attrs.size();
                } catch (IOException e) {
                  LOGGER.warn("Cannot delete expired archive file {}: {}", file, e.getMessage());
                }
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
              if (!dir.equals(archive)) {
                try (Stream<Path> entries = Files.list(dir)) {
                  if (entries.findAny().isEmpty()) {
                    Files.delete(dir);
                  }
                } catch (IOException e) {
                  LOGGER.debug("Cannot prune {}: {}", dir, e.getMessage());
                }
              }
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      LOGGER.error("Archive cleanup failed", e);
    }

    if (deleted[0] > 0) {
      LOGGER.info(
          "Reclaimed {} archived files ({} bytes) older than {}", deleted[0], bytes[0], retention);
    }
    return new ReclaimResult(deleted[0], bytes[0]);
  }

  /** Bytes held in each area and free space on the staging disk. */
  public StorageUsage usageReport() {
    long free = 0;
    long total = 0;
    try {
      Path existing = baseDir;
      while (existing != null && !Files.exists(existing)) {
        existing = existing.getParent();
      }
      if (existing != null) {
        FileStore store = Files.getFileStore(existing);
        free = store.getUsableSpace();
        total = store.getTotalSpace();
      }
    } catch (IOException e) {
      LOGGER.warn("Cannot read disk space for {}: {}", baseDir, e.getMessage());
    }
    return new StorageUsage(
        directorySize(rawDir()),
        directorySize(processedDir()),
        directorySize(archiveDir()),
        free,
        total,
        properties.maxStorageBytes());
  }

  private long directorySize(Path dir) {
    if (!Files.isDirectory(dir)) {
      return 0;
    }
    try (Stream<Path> files = Files.walk(dir)) {
      return files
          .filter(Files::isRegularFile)
          .collect(Collectors.summingLong(StagingLifecycle::sizeOrZero));
    } catch (IOException e) {
      LOGGER.warn("Cannot measure {}: {}", dir, e.getMessage());
      return 0;
    }
  }

  private static long sizeOrZero(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      // removed while walking
      LOGGER.debug("Cannot size {}: {}", file, e.getMessage());
      return 0;
    }
  }
}
