package com.scholary.audiosync.trim;

import java.util.List;

/** How much of a recording is above the silence threshold. */
public record VoiceActivity(
    long totalMs, long voiceMs, long silenceMs, double voiceRatioPercent, List<TimeSpan> segments) {

  public VoiceActivity {
    segments = List.copyOf(segments);
  }
}
