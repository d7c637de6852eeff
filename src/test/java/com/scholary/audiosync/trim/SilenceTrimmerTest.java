package com.scholary.audiosync.trim;

import static com.scholary.audiosync.support.Signals.concat;
import static com.scholary.audiosync.support.Signals.silence;
import static com.scholary.audiosync.support.Signals.tone;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.audiosync.exception.InvalidInputException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SilenceTrimmerTest {

  private static final int RATE = 16000;

  private final TrimmerProperties properties =
      new TrimmerProperties(-40, 2000, 100, RATE, "64k", -20, 5, 1);
  private final SilenceTrimmer trimmer = new SilenceTrimmer(properties);

  @Test
  void trim_shouldCutLongSilenceAndKeepMargins() {
    float[] samples = concat(tone(RATE, 1000, 0.8f), silence(RATE, 5000), tone(RATE, 1000, 0.8f));

    TrimResult result = trimmer.trim(AudioTimeline.mono(samples, RATE)).orElseThrow();

    assertThat(result.keptSpans())
        .containsExactly(new TimeSpan(0, 1100), new TimeSpan(5900, 7000));
    assertThat(result.originalMs()).isEqualTo(7000);
    assertThat(result.trimmedMs()).isEqualTo(2200);
    assertThat(result.audio().sampleRate()).isEqualTo(RATE);
    assertThat(result.audio().frameCount()).isEqualTo(2200 * RATE / 1000);
  }

  @Test
  void trim_shouldNormalizeToTargetLoudness() {
    float[] samples = concat(tone(RATE, 1000, 0.8f), silence(RATE, 5000), tone(RATE, 1000, 0.8f));

    TrimResult result = trimmer.trim(AudioTimeline.mono(samples, RATE)).orElseThrow();

    double level = Pcm.dbfs(Pcm.rms(result.audio().channels()[0]));
    assertThat(level).isCloseTo(-20.0, within(0.05));
    assertThat(result.gainDb()).isNegative();
  }

  @Test
  void trim_shouldClipBoostedSamplesToFullScale() {
    TrimmerProperties loud = new TrimmerProperties(-60, 2000, 100, RATE, "64k", 6, 0, 1);
    float[] samples = tone(RATE, 3000, 0.9f);

    TrimResult result =
        new SilenceTrimmer(loud).trim(AudioTimeline.mono(samples, RATE)).orElseThrow();

    for (float sample : result.audio().channels()[0]) {
      assertThat(sample).isBetween(-1f, 1f);
    }
  }

  @Test
  void trim_shouldReturnEmptyForSilentRecording() {
    Optional<TrimResult> result = trimmer.trim(AudioTimeline.mono(silence(RATE, 5000), RATE));

    assertThat(result).isEmpty();
  }

  @Test
  void trim_shouldRejectMissingOrEmptyAudio() {
    assertThatThrownBy(() -> trimmer.trim(null)).isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(() -> trimmer.trim(AudioTimeline.mono(new float[0], RATE)))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void trim_shouldRejectAudioShorterThanOneMillisecond() {
    AudioTimeline blip = AudioTimeline.mono(new float[] {0.5f, -0.5f, 0.5f, -0.5f}, RATE);

    assertThatThrownBy(() -> trimmer.trim(blip))
        .isInstanceOf(InvalidInputException.class)
        .hasMessageContaining("shorter than 1ms");
    assertThatThrownBy(() -> trimmer.analyzeVoiceActivity(blip))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void trim_shouldDownmixAndResampleToTarget() {
    float[] left = tone(44100, 2000, 0.5f);
    float[] right = tone(44100, 2000, 0.5f);

    TrimResult result =
        trimmer.trim(new AudioTimeline(new float[][] {left, right}, 44100)).orElseThrow();

    assertThat(result.audio().channelCount()).isEqualTo(1);
    assertThat(result.audio().sampleRate()).isEqualTo(RATE);
    assertThat(result.trimmedMs()).isEqualTo(2000);
  }

  @Test
  void expandAndMerge_shouldMergeSpansThatMeetAfterWidening() {
    List<TimeSpan> merged =
        SilenceTrimmer.expandAndMerge(
            List.of(new TimeSpan(2150, 3000), new TimeSpan(1000, 2000), new TimeSpan(5000, 5950)),
            100,
            6000);

    assertThat(merged).containsExactly(new TimeSpan(900, 3100), new TimeSpan(4900, 6000));
  }

  @Test
  void expandAndMerge_shouldMergeSpansThatOnlyTouch() {
    List<TimeSpan> merged =
        SilenceTrimmer.expandAndMerge(
            List.of(new TimeSpan(0, 1000), new TimeSpan(1200, 2000)), 100, 2000);

    assertThat(merged).containsExactly(new TimeSpan(0, 2000));
  }

  @Test
  void analyzeVoiceActivity_shouldMeasureVoiceRatio() {
    float[] samples = concat(tone(RATE, 1000, 0.8f), silence(RATE, 3000));

    VoiceActivity activity = trimmer.analyzeVoiceActivity(AudioTimeline.mono(samples, RATE));

    assertThat(activity.totalMs()).isEqualTo(4000);
    assertThat(activity.voiceMs()).isEqualTo(1000);
    assertThat(activity.silenceMs()).isEqualTo(3000);
    assertThat(activity.voiceRatioPercent()).isCloseTo(25.0, within(0.001));
    assertThat(activity.segments()).containsExactly(new TimeSpan(0, 1000));
  }
}
