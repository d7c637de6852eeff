package com.scholary.audiosync.trim;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds silent and non-silent spans on a millisecond grid.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Slide a window of {@code minSilenceMs} over the audio in 1 ms steps
 *   <li>A window whose RMS level is at or below the threshold is silent
 *   <li>Silent window starts that overlap or abut merge into one maximal silent span
 *   <li>The non-silent spans are the complement within {@code [0, length)}
 * </ol>
 *
 * <p>Per-millisecond energy is accumulated once into a prefix sum, so each window costs O(1).
 */
public class SilenceDetector {

  private final double thresholdDb;
  private final long minSilenceMs;
  private final double thresholdLinear;

  public SilenceDetector(double thresholdDb, long minSilenceMs) {
    if (minSilenceMs <= 0) {
      throw new IllegalArgumentException("minSilenceMs must be positive");
    }
    this.thresholdDb = thresholdDb;
    this.minSilenceMs = minSilenceMs;
    this.thresholdLinear = Pcm.dbToLinear(thresholdDb);
  }

  public double thresholdDb() {
    return thresholdDb;
  }

  /**
   * Detect maximal silent spans.
   *
   * @param samples mono samples
   * @param sampleRate samples per second
   * @return silent spans in order; empty if the audio is shorter than one window
   */
  public List<TimeSpan> detectSilence(float[] samples, int sampleRate) {
    long lengthMs = Math.round(samples.length * 1000.0 / sampleRate);
    if (lengthMs < minSilenceMs) {
      return List.of();
    }

    double[] energy = energyPrefix(samples, sampleRate, lengthMs);
    long lastStart = lengthMs - minSilenceMs;

    List<TimeSpan> silent = new ArrayList<>();
    long rangeStart = -1;
    long previous = -1;
    for (long start = 0; start <= lastStart; start++) {
      if (!isSilentWindow(energy, start, samples.length, sampleRate)) {
        continue;
      }
      if (rangeStart < 0) {
        rangeStart = start;
      } else if (start != previous + 1 && start > previous + minSilenceMs) {
        silent.add(new TimeSpan(rangeStart, previous + minSilenceMs));
        rangeStart = start;
      }
      previous = start;
    }
    if (rangeStart >= 0) {
      silent.add(new TimeSpan(rangeStart, previous + minSilenceMs));
    }
    return silent;
  }

  /**
   * Detect non-silent spans: the complement of {@link #detectSilence}.
   *
   * <p>Audio without any silent window is one span covering everything. Audio that is silent
   * from start to end has no spans at all.
   */
  public List<TimeSpan> detectNonSilent(float[] samples, int sampleRate) {
    long lengthMs = Math.round(samples.length * 1000.0 / sampleRate);
    List<TimeSpan> silent = detectSilence(samples, sampleRate);
    if (silent.isEmpty()) {
      return List.of(new TimeSpan(0, lengthMs));
    }
    TimeSpan first = silent.get(0);
    if (first.startMs() == 0 && first.endMs() == lengthMs) {
      return List.of();
    }

    List<TimeSpan> nonSilent = new ArrayList<>();
    long previousEnd = 0;
    for (TimeSpan span : silent) {
      if (span.startMs() > previousEnd) {
        nonSilent.add(new TimeSpan(previousEnd, span.startMs()));
      }
      previousEnd = span.endMs();
    }
    if (previousEnd < lengthMs) {
      nonSilent.add(new TimeSpan(previousEnd, lengthMs));
    }
    return nonSilent;
  }

  private boolean isSilentWindow(double[] energy, long startMs, int length, int sampleRate) {
    long endMs = startMs + minSilenceMs;
    int count =
        Pcm.msToIndex(endMs, sampleRate, length) - Pcm.msToIndex(startMs, sampleRate, length);
    if (count <= 0) {
      return true;
    }
    double sum = Math.max(0.0, energy[(int) endMs] - energy[(int) startMs]);
    return Math.sqrt(sum / count) <= thresholdLinear;
  }

  private static double[] energyPrefix(float[] samples, int sampleRate, long lengthMs) {
    double[] prefix = new double[(int) lengthMs + 1];
    for (int ms = 0; ms < lengthMs; ms++) {
      int from = Pcm.msToIndex(ms, sampleRate, samples.length);
      int to = Pcm.msToIndex(ms + 1L, sampleRate, samples.length);
      double sum = 0;
      for (int i = from; i < to; i++) {
        sum += (double) samples[i] * samples[i];
      }
      prefix[ms + 1] = prefix[ms] + sum;
    }
    return prefix;
  }
}
