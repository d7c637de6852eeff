package com.scholary.audiosync.audio;

import java.nio.file.Path;

/**
 * Outcome of processing one staged file.
 *
 * <p>{@code output} is set only for {@link Outcome#PROCESSED}.
 */
public record ProcessingResult(
    Path input, Path output, Outcome outcome, long originalMs, long trimmedMs, String detail) {

  public enum Outcome {
    PROCESSED,
    /** Silent from start to end. */
    NO_AUDIO,
    LOW_VOICE_ACTIVITY,
    FAILED
  }

  public static ProcessingResult processed(
      Path input, Path output, long originalMs, long trimmedMs) {
    return new ProcessingResult(input, output, Outcome.PROCESSED, originalMs, trimmedMs, null);
  }

  public static ProcessingResult skipped(
      Path input, Outcome outcome, long originalMs, String detail) {
    return new ProcessingResult(input, null, outcome, originalMs, 0, detail);
  }

  public static ProcessingResult failed(Path input, String detail) {
    return new ProcessingResult(input, null, Outcome.FAILED, 0, 0, detail);
  }

  public boolean isProcessed() {
    return outcome == Outcome.PROCESSED;
  }

  /** True for outcomes that leave nothing to upload but are not errors. */
  public boolean isSkipped() {
    return outcome == Outcome.NO_AUDIO || outcome == Outcome.LOW_VOICE_ACTIVITY;
  }
}
