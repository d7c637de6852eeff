package com.scholary.audiosync.trim;

/**
 * Decoded audio: one float array per channel, samples in [-1, 1].
 *
 * <p>All channels have the same length. The arrays are shared, not copied, so callers must not
 * mutate a timeline after handing it over.
 */
public record AudioTimeline(float[][] channels, int sampleRate) {

  public AudioTimeline {
    if (channels == null || channels.length == 0) {
      throw new IllegalArgumentException("Timeline needs at least one channel");
    }
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive");
    }
    int frames = channels[0].length;
    for (float[] channel : channels) {
      if (channel.length != frames) {
        throw new IllegalArgumentException("All channels must have the same length");
      }
    }
  }

  public static AudioTimeline mono(float[] samples, int sampleRate) {
    return new AudioTimeline(new float[][] {samples}, sampleRate);
  }

  public int channelCount() {
    return channels.length;
  }

  public int frameCount() {
    return channels[0].length;
  }

  /** Length in whole milliseconds, rounded to nearest. */
  public long durationMs() {
    return Math.round(frameCount() * 1000.0 / sampleRate);
  }

  public boolean isEmpty() {
    return frameCount() == 0;
  }
}
