package com.scholary.audiosync.trim;

import java.util.List;

/** Trimmed, normalized mono audio plus what was kept of the original. */
public record TrimResult(
    AudioTimeline audio, List<TimeSpan> keptSpans, long originalMs, long trimmedMs, double gainDb) {

  public TrimResult {
    keptSpans = List.copyOf(keptSpans);
  }

  public long removedMs() {
    return originalMs - trimmedMs;
  }
}
