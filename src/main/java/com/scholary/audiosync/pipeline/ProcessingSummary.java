package com.scholary.audiosync.pipeline;

import java.nio.file.Path;
import java.util.List;

/** What the processing stage did with the raw files it found. */
public record ProcessingSummary(int processed, int skipped, int failed, List<Path> promoted) {

  public ProcessingSummary {
    promoted = List.copyOf(promoted);
  }

  public static ProcessingSummary empty() {
    return new ProcessingSummary(0, 0, 0, List.of());
  }
}
