package com.scholary.audiosync.monitor;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a mounts root such as {@code /media/<user>} or {@code /Volumes} by listing it at a
 * fixed interval.
 *
 * <p>A new directory is reported as mounted only after it has been visible for the settle delay,
 * so the pipeline does not start on a volume the OS is still mounting. A directory that vanishes
 * before settling is forgotten without an event.
 */
public class PollingMountWatcher implements MountWatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(PollingMountWatcher.class);

  private final Path mountsRoot;
  private final Duration pollInterval;
  private final Duration settleDelay;
  private final Clock clock;

  private final Map<Path, Instant> pending = new HashMap<>();
  private final Set<Path> mounted = new HashSet<>();
  private ScheduledExecutorService scheduler;
  private Predicate<Path> filter = path -> true;
  private Consumer<MountEvent> listener = event -> {};

  public PollingMountWatcher(
      Path mountsRoot, Duration pollInterval, Duration settleDelay, Clock clock) {
    this.mountsRoot = mountsRoot;
    this.pollInterval = pollInterval;
    this.settleDelay = settleDelay;
    this.clock = clock;
  }

  @Override
  public synchronized void watch(Predicate<Path> filter, Consumer<MountEvent> listener) {
    if (scheduler != null) {
      throw new IllegalStateException("Watcher already started");
    }
    this.filter = filter;
    this.listener = listener;
    // volumes present at start are treated as already handled
    mounted.addAll(listVolumes());
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "mount-watcher");
              thread.setDaemon(true);
              return thread;
            });
    scheduler.scheduleWithFixedDelay(
        this::pollSafely, pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
    LOGGER.info(
        "Watching {} every {}ms ({} volumes already present)",
        mountsRoot,
        pollInterval.toMillis(),
        mounted.size());
  }

  /** Compare the current listing with the previous one and emit events for the differences. */
  synchronized void pollOnce() {
    Set<Path> current = listVolumes();
    Instant now = clock.instant();

    Iterator<Path> gone = mounted.iterator();
    while (gone.hasNext()) {
      Path volume = gone.next();
      if (!current.contains(volume)) {
        gone.remove();
        LOGGER.info("Volume removed: {}", volume);
        listener.accept(MountEvent.unmounted(volume));
      }
    }
    pending.keySet().retainAll(current);

    for (Path volume : current) {
      if (mounted.contains(volume)) {
        continue;
      }
      Instant firstSeen = pending.computeIfAbsent(volume, v -> now);
      if (Duration.between(firstSeen, now).compareTo(settleDelay) >= 0) {
        pending.remove(volume);
        mounted.add(volume);
        LOGGER.info("Volume mounted: {}", volume);
        listener.accept(MountEvent.mounted(volume));
      }
    }
  }

  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
      LOGGER.info("Stopped watching {}", mountsRoot);
    }
  }

  private void pollSafely() {
    try {
      pollOnce();
    } catch (RuntimeException e) {
      // an exception would cancel the scheduled task
      LOGGER.error("Mount poll failed: {}", e.getMessage(), e);
    }
  }

  private Set<Path> listVolumes() {
    Set<Path> volumes = new TreeSet<>();
    if (!Files.isDirectory(mountsRoot)) {
      return volumes;
    }
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(mountsRoot)) {
      for (Path entry : entries) {
        if (Files.isDirectory(entry) && filter.test(entry)) {
          volumes.add(entry);
        }
      }
    } catch (IOException e) {
      LOGGER.warn("Cannot list {}: {}", mountsRoot, e.getMessage());
    }
    return volumes;
  }
}
