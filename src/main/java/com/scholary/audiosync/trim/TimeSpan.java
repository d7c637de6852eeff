package com.scholary.audiosync.trim;

/**
 * Half-open interval {@code [startMs, endMs)} on an audio timeline.
 *
 * <p>Used for silent and non-silent segments. All times are whole milliseconds.
 */
public record TimeSpan(long startMs, long endMs) {

  public TimeSpan {
    if (startMs < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endMs < startMs) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public long durationMs() {
    return endMs - startMs;
  }

  /**
   * Check if this span overlaps or shares a boundary with another.
   *
   * @param other the other span
   * @return true if the two can be merged without a gap
   */
  public boolean touches(TimeSpan other) {
    return this.startMs <= other.endMs && other.startMs <= this.endMs;
  }

  /** Smallest span covering both. */
  public TimeSpan union(TimeSpan other) {
    return new TimeSpan(Math.min(startMs, other.startMs), Math.max(endMs, other.endMs));
  }

  /** Widen by {@code marginMs} on both sides, clamped to {@code [0, lengthMs]}. */
  public TimeSpan expand(long marginMs, long lengthMs) {
    return new TimeSpan(Math.max(0, startMs - marginMs), Math.min(lengthMs, endMs + marginMs));
  }
}
