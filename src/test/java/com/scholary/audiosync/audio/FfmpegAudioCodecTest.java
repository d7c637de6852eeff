package com.scholary.audiosync.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiosync.exception.AudioCodecException;
import com.scholary.audiosync.trim.AudioTimeline;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioCodecTest {

  @TempDir Path tempDir;

  private final FfmpegAudioCodec missingBinaries =
      new FfmpegAudioCodec(
          new CodecProperties("/nonexistent/bin/ffmpeg", "/nonexistent/bin/ffprobe", 5));

  @Test
  void parseKeyValues_shouldReadProbeOutput() {
    Map<String, String> values =
        FfmpegAudioCodec.parseKeyValues(
            List.of("sample_rate=44100", "channels=2", "", "garbage", " tag = value "));

    assertThat(values)
        .containsEntry("sample_rate", "44100")
        .containsEntry("channels", "2")
        .containsEntry("tag", "value")
        .hasSize(3);
  }

  @Test
  void parseKeyValues_shouldIgnoreLinesWithoutKey() {
    assertThat(FfmpegAudioCodec.parseKeyValues(List.of("=1", "no separator"))).isEmpty();
  }

  @Test
  void decode_shouldFailWhenProbeCannotRun() {
    assertThatThrownBy(() -> missingBinaries.decode(tempDir.resolve("memo.mp3")))
        .isInstanceOf(AudioCodecException.class)
        .hasMessageContaining("Failed to probe");
  }

  @Test
  void encodeMp3_shouldFailWhenEncoderCannotRun() {
    AudioTimeline timeline = AudioTimeline.mono(new float[] {0.1f, -0.1f}, 16000);

    assertThatThrownBy(
            () -> missingBinaries.encodeMp3(timeline, tempDir.resolve("out.mp3"), "64k"))
        .isInstanceOf(AudioCodecException.class)
        .hasMessageContaining("Failed to encode");
  }
}
