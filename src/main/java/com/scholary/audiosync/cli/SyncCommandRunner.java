package com.scholary.audiosync.cli;

import com.scholary.audiosync.exception.AudioSyncException;
import com.scholary.audiosync.ledger.SyncSession;
import com.scholary.audiosync.ledger.SyncStats;
import com.scholary.audiosync.monitor.MonitorProperties;
import com.scholary.audiosync.monitor.MountEvent;
import com.scholary.audiosync.monitor.MountWatcher;
import com.scholary.audiosync.pipeline.CleanupResult;
import com.scholary.audiosync.pipeline.PipelineStatus;
import com.scholary.audiosync.pipeline.ProcessingSummary;
import com.scholary.audiosync.pipeline.SyncPipeline;
import com.scholary.audiosync.pipeline.SyncSummary;
import com.scholary.audiosync.staging.StorageUsage;
import com.scholary.audiosync.upload.UploadStatistics;
import jakarta.annotation.PreDestroy;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code --command=run|process|upload|status|cleanup|monitor|export [--source=<dir>]
 * [--config=<file.json>] [--output=<file>] [--session=<id>]}. The command defaults to {@code run}.
 *
 * <p>Per-file failures are reported in the summary and do not change the exit code. Run-level
 * errors (ledger unavailable, rejected credentials) and invalid arguments exit with 1.
 */
@Component
@ConditionalOnProperty(name = "audiosync.cli.enabled", havingValue = "true", matchIfMissing = true)
public class SyncCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncCommandRunner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  private final SyncPipeline pipeline;
  private final MountWatcher mountWatcher;
  private final MonitorProperties monitorProperties;
  private final PrintStream out;
  private final CountDownLatch shutdown = new CountDownLatch(1);
  private volatile int exitCode = EXIT_OK;

  @Autowired
  public SyncCommandRunner(
      SyncPipeline pipeline, MountWatcher mountWatcher, MonitorProperties monitorProperties) {
    this(pipeline, mountWatcher, monitorProperties, System.out);
  }

  SyncCommandRunner(
      SyncPipeline pipeline,
      MountWatcher mountWatcher,
      MonitorProperties monitorProperties,
      PrintStream out) {
    this.pipeline = pipeline;
    this.mountWatcher = mountWatcher;
    this.monitorProperties = monitorProperties;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    String command = option(args, "command", "run").toLowerCase(Locale.ROOT);
    try {
      switch (command) {
        case "run":
          printSync(pipeline.runFull(sourceOption(args)));
          break;
        case "process":
          printProcessing(pipeline.processOnly());
          break;
        case "upload":
          printSync(pipeline.uploadOnly());
          break;
        case "status":
          printStatus(pipeline.status());
          break;
        case "cleanup":
          printCleanup(pipeline.cleanup());
          break;
        case "monitor":
          monitor();
          break;
        case "export":
          export(args);
          break;
        default:
          throw new IllegalArgumentException("Unknown command: " + command);
      }
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid arguments: {}", e.getMessage());
      out.println("Error: " + e.getMessage());
      exitCode = EXIT_FAILURE;
    } catch (AudioSyncException e) {
      LOGGER.error("Command '{}' failed: {}", command, e.getMessage(), e);
      out.println("Error: " + e.getMessage());
      exitCode = EXIT_FAILURE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  /** Releases a running monitor when the application context closes. */
  @PreDestroy
  public void stop() {
    shutdown.countDown();
  }

  // ---------------------------------------------------------------------------------------------

  private void monitor() {
    out.println("Watching " + monitorProperties.mountsRootPath() + " for volumes");
    mountWatcher.watch(monitorProperties::matchesLabel, this::onMountEvent);
    try {
      shutdown.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.info("Monitor interrupted");
    } finally {
      mountWatcher.close();
    }
  }

  void onMountEvent(MountEvent event) {
    if (event.type() != MountEvent.Type.MOUNTED) {
      out.println("Volume removed: " + event.path());
      return;
    }
    out.println("Volume mounted: " + event.path());
    try {
      printSync(pipeline.runFull(event.path()));
    } catch (AudioSyncException e) {
      // keep watching; the next mount gets a fresh session
      LOGGER.error("Sync of {} failed: {}", event.path(), e.getMessage(), e);
      out.println("Error: " + e.getMessage());
    }
  }

  private void export(ApplicationArguments args) {
    String output = option(args, "output", null);
    if (output == null || output.isBlank()) {
      throw new IllegalArgumentException("export requires --output=<file>");
    }
    String session = option(args, "session", null);
    int count = pipeline.exportHistory(Paths.get(output), session);
    out.printf("Exported %d records to %s%n", count, output);
  }

  private static Path sourceOption(ApplicationArguments args) {
    String source = option(args, "source", null);
    if (source == null || source.isBlank()) {
      return null;
    }
    Path path = Paths.get(source);
    if (!Files.isDirectory(path)) {
      throw new IllegalArgumentException("Source is not a directory: " + source);
    }
    return path;
  }

  private static String option(ApplicationArguments args, String name, String defaultValue) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return defaultValue;
    }
    return values.get(values.size() - 1);
  }

  private void printSync(SyncSummary summary) {
    out.println("Session:   " + summary.sessionId());
    out.println("Staged:    " + summary.stagedFiles());
    printProcessing(summary.processing());
    UploadStatistics stats = summary.upload().statistics();
    out.printf(
        "Uploaded:  %d (%s), skipped %d, failed %d of %d%n",
        stats.uploadedFiles(),
        humanBytes(stats.uploadedBytes()),
        stats.skippedFiles(),
        stats.failedFiles(),
        stats.totalFiles());
  }

  private void printProcessing(ProcessingSummary processing) {
    out.printf(
        "Processed: %d, skipped %d, failed %d%n",
        processing.processed(), processing.skipped(), processing.failed());
  }

  private void printStatus(PipelineStatus status) {
    StorageUsage storage = status.storage();
    out.printf(
        "Storage:   raw %s, processed %s, archive %s (%.1f%% of allowance), disk free %s%n",
        humanBytes(storage.rawBytes()),
        humanBytes(storage.processedBytes()),
        humanBytes(storage.archiveBytes()),
        storage.usagePercent(),
        humanBytes(storage.diskFreeBytes()));
    out.println("Pending:   " + status.unprocessedFiles() + " unprocessed files");

    SyncStats stats = status.stats();
    out.printf(
        "Synced:    %d files (%s) in %d sessions, %d unique%n",
        stats.successfulFiles(),
        humanBytes(stats.bytesSynced()),
        stats.totalSessions(),
        stats.uniqueFingerprints());
    out.printf(
        "Today:     %d files (%s); failures in last 7 days: %d%n",
        stats.filesToday(), humanBytes(stats.bytesToday()), stats.failuresLast7Days());
    for (SyncStats.ExtensionTotal total : stats.byExtension()) {
      out.printf(
          "  %-8s %d files (%s)%n",
          total.extension(), total.count(), humanBytes(total.totalBytes()));
    }

    if (!status.recentSessions().isEmpty()) {
      out.println("Recent sessions:");
      for (SyncSession session : status.recentSessions()) {
        out.printf(
            "  %s %-11s %s synced=%d failed=%d skipped=%d%n",
            session.sessionId(),
            session.status(),
            session.sourcePath(),
            session.counters().syncedFiles(),
            session.counters().failedFiles(),
            session.counters().skippedFiles());
      }
    }
  }

  private void printCleanup(CleanupResult result) {
    out.printf(
        "Archive:   removed %d files (%s)%n",
        result.archive().filesDeleted(), humanBytes(result.archive().bytesReclaimed()));
    out.printf(
        "Ledger:    removed %d sessions, %d records%n",
        result.ledger().sessionsDeleted(), result.ledger().recordsDeleted());
  }

  static String humanBytes(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    String[] units = {"KB", "MB", "GB", "TB"};
    double value = bytes;
    int unit = -1;
    while (value >= 1024 && unit < units.length - 1) {
      value /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
  }
}
