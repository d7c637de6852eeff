package com.scholary.audiosync.trim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeSpanTest {

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimeSpan(-1, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimeSpan(10, 5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be >= start time");
  }

  @Test
  void durationMs_shouldCalculateCorrectly() {
    assertThat(new TimeSpan(1000, 2500).durationMs()).isEqualTo(1500);
    assertThat(new TimeSpan(7, 7).durationMs()).isZero();
  }

  @Test
  void touches_shouldAcceptOverlappingAndAbuttingSpans() {
    TimeSpan span = new TimeSpan(100, 200);

    assertThat(span.touches(new TimeSpan(150, 300))).isTrue();
    assertThat(span.touches(new TimeSpan(200, 300))).isTrue();
    assertThat(new TimeSpan(200, 300).touches(span)).isTrue();
    assertThat(span.touches(new TimeSpan(201, 300))).isFalse();
  }

  @Test
  void union_shouldCoverBothSpans() {
    assertThat(new TimeSpan(100, 200).union(new TimeSpan(150, 400)))
        .isEqualTo(new TimeSpan(100, 400));
  }

  @Test
  void expand_shouldClampToTimeline() {
    assertThat(new TimeSpan(50, 950).expand(100, 1000)).isEqualTo(new TimeSpan(0, 1000));
    assertThat(new TimeSpan(300, 600).expand(100, 1000)).isEqualTo(new TimeSpan(200, 700));
  }
}
