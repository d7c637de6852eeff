package com.scholary.audiosync.trim;

import com.scholary.audiosync.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts long silences out of a recording and normalizes what remains.
 *
 * <p>Steps:
 *
 * <ol>
 *   <li>Downmix to mono and resample to the target rate
 *   <li>Detect non-silent spans with {@link SilenceDetector}
 *   <li>Widen each span by the margin so speech onsets are not clipped
 *   <li>Merge widened spans that overlap or touch, then concatenate them
 *   <li>Apply one uniform gain so the result sits at the target loudness
 * </ol>
 *
 * <p>Stateless; safe to share between processing threads.
 */
public class SilenceTrimmer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SilenceTrimmer.class);

  private final TrimmerProperties properties;
  private final SilenceDetector detector;

  public SilenceTrimmer(TrimmerProperties properties) {
    this.properties = properties;
    this.detector =
        new SilenceDetector(properties.silenceThresholdDb(), properties.minSilenceMs());
  }

  /**
   * Trim a decoded recording.
   *
   * @param timeline decoded audio, any channel count and sample rate
   * @return the trimmed audio, or empty if the recording is silent throughout
   * @throws InvalidInputException if the timeline is null or shorter than a millisecond
   */
  public Optional<TrimResult> trim(AudioTimeline timeline) {
    float[] mono = prepare(timeline);
    int rate = properties.targetSampleRate();
    long lengthMs = Math.round(mono.length * 1000.0 / rate);

    List<TimeSpan> nonSilent = detector.detectNonSilent(mono, rate);
    if (nonSilent.isEmpty()) {
      LOGGER.info("No audio above {} dBFS in {}ms", properties.silenceThresholdDb(), lengthMs);
      return Optional.empty();
    }

    List<TimeSpan> kept = expandAndMerge(nonSilent, properties.marginMs(), lengthMs);
    float[] joined = concatenate(mono, rate, kept);

    double level = Pcm.dbfs(Pcm.rms(joined));
    double gainDb = Double.isInfinite(level) ? 0.0 : properties.targetLoudnessDb() - level;
    applyGain(joined, gainDb);

    long trimmedMs = Math.round(joined.length * 1000.0 / rate);
    LOGGER.debug(
        "Trimmed {}ms -> {}ms in {} spans, gain={} dB", lengthMs, trimmedMs, kept.size(), gainDb);
    return Optional.of(
        new TrimResult(AudioTimeline.mono(joined, rate), kept, lengthMs, trimmedMs, gainDb));
  }

  /**
   * Measure voice activity without trimming.
   *
   * <p>Voice time is the total length of the non-silent spans, before any margin is applied.
   */
  public VoiceActivity analyzeVoiceActivity(AudioTimeline timeline) {
    float[] mono = prepare(timeline);
    int rate = properties.targetSampleRate();
    long totalMs = Math.round(mono.length * 1000.0 / rate);

    List<TimeSpan> segments = detector.detectNonSilent(mono, rate);
    long voiceMs = segments.stream().mapToLong(TimeSpan::durationMs).sum();
    double ratio = totalMs > 0 ? voiceMs * 100.0 / totalMs : 0.0;
    return new VoiceActivity(totalMs, voiceMs, totalMs - voiceMs, ratio, segments);
  }

  /**
   * Widen spans by a margin and merge the ones that overlap or touch.
   *
   * @param spans spans in any order
   * @param marginMs how far to widen each side
   * @param lengthMs timeline length; widened spans are clamped to it
   * @return disjoint spans in chronological order
   */
  public static List<TimeSpan> expandAndMerge(List<TimeSpan> spans, long marginMs, long lengthMs) {
    List<TimeSpan> expanded = new ArrayList<>(spans.size());
    for (TimeSpan span : spans) {
      expanded.add(span.expand(marginMs, lengthMs));
    }
    expanded.sort(Comparator.comparingLong(TimeSpan::startMs));

    List<TimeSpan> merged = new ArrayList<>();
    for (TimeSpan span : expanded) {
      if (!merged.isEmpty() && merged.get(merged.size() - 1).touches(span)) {
        merged.set(merged.size() - 1, merged.get(merged.size() - 1).union(span));
      } else {
        merged.add(span);
      }
    }
    return merged;
  }

  private float[] prepare(AudioTimeline timeline) {
    if (timeline == null) {
      throw new InvalidInputException("no audio timeline");
    }
    if (timeline.isEmpty()) {
      throw new InvalidInputException("audio timeline has no samples");
    }
    float[] mono = Pcm.downmix(timeline);
    float[] resampled = Pcm.resample(mono, timeline.sampleRate(), properties.targetSampleRate());
    if (Math.round(resampled.length * 1000.0 / properties.targetSampleRate()) == 0) {
      throw new InvalidInputException(
          String.format("audio shorter than 1ms: %d samples", resampled.length));
    }
    return resampled;
  }

  private static float[] concatenate(float[] samples, int rate, List<TimeSpan> spans) {
    int total = 0;
    int[][] ranges = new int[spans.size()][];
    for (int i = 0; i < spans.size(); i++) {
      int from = Pcm.msToIndex(spans.get(i).startMs(), rate, samples.length);
      int to = Pcm.msToIndex(spans.get(i).endMs(), rate, samples.length);
      ranges[i] = new int[] {from, to};
      total += to - from;
    }
    float[] out = new float[total];
    int offset = 0;
    for (int[] range : ranges) {
      int length = range[1] - range[0];
      System.arraycopy(samples, range[0], out, offset, length);
      offset += length;
    }
    return out;
  }

  private static void applyGain(float[] samples, double gainDb) {
    if (gainDb == 0.0) {
      return;
    }
    float factor = (float) Pcm.dbToLinear(gainDb);
    for (int i = 0; i < samples.length; i++) {
      samples[i] = Math.max(-1f, Math.min(1f, samples[i] * factor));
    }
  }
}
