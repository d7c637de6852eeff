package com.scholary.audiosync.trim;

/** Sample-level helpers for float PCM. */
public final class Pcm {

  private Pcm() {}

  /** Average all channels into one. A mono timeline is returned as is. */
  public static float[] downmix(AudioTimeline timeline) {
    if (timeline.channelCount() == 1) {
      return timeline.channels()[0];
    }
    int frames = timeline.frameCount();
    int channels = timeline.channelCount();
    float[] mono = new float[frames];
    for (int i = 0; i < frames; i++) {
      double sum = 0;
      for (float[] channel : timeline.channels()) {
        sum += channel[i];
      }
      mono[i] = (float) (sum / channels);
    }
    return mono;
  }

  /**
   * Linear-interpolation resampling.
   *
   * <p>Good enough for speech going to a lossy encoder; no anti-aliasing filter is applied.
   */
  public static float[] resample(float[] samples, int fromRate, int toRate) {
    if (fromRate == toRate || samples.length == 0) {
      return samples;
    }
    int outLength = (int) Math.round((double) samples.length * toRate / fromRate);
    float[] out = new float[outLength];
    double step = (double) fromRate / toRate;
    int last = samples.length - 1;
    for (int i = 0; i < outLength; i++) {
      double position = i * step;
      int index = (int) position;
      if (index >= last) {
        out[i] = samples[last];
        continue;
      }
      double fraction = position - index;
      out[i] = (float) (samples[index] + (samples[index + 1] - samples[index]) * fraction);
    }
    return out;
  }

  /** Root mean square of {@code samples[from, to)}; zero for an empty range. */
  public static double rms(float[] samples, int from, int to) {
    if (to <= from) {
      return 0.0;
    }
    double sum = 0;
    for (int i = from; i < to; i++) {
      sum += (double) samples[i] * samples[i];
    }
    return Math.sqrt(sum / (to - from));
  }

  public static double rms(float[] samples) {
    return rms(samples, 0, samples.length);
  }

  /** Level relative to full scale. Digital silence is negative infinity. */
  public static double dbfs(double rms) {
    return rms <= 0 ? Double.NEGATIVE_INFINITY : 20 * Math.log10(rms);
  }

  public static double dbToLinear(double db) {
    return Math.pow(10, db / 20);
  }

  /** Sample index of a millisecond offset, clamped to the array. */
  public static int msToIndex(long ms, int sampleRate, int length) {
    long index = ms * sampleRate / 1000;
    return (int) Math.min(Math.max(index, 0), length);
  }
}
