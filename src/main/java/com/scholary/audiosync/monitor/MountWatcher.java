package com.scholary.audiosync.monitor;

import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Notifies a listener when removable volumes come and go.
 *
 * <p>Only volumes accepted by the filter are reported. Listener calls happen on the watcher's own
 * thread, one at a time.
 */
public interface MountWatcher extends AutoCloseable {

  void watch(Predicate<Path> filter, Consumer<MountEvent> listener);

  /** Stop watching. Volumes already reported stay reported. */
  @Override
  void close();
}
