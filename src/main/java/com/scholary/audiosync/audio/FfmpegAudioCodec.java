package com.scholary.audiosync.audio;

import com.scholary.audiosync.exception.AudioCodecException;
import com.scholary.audiosync.trim.AudioTimeline;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AudioCodec} backed by the ffmpeg and ffprobe command line tools.
 *
 * <p>PCM crosses the process boundary as raw 32-bit little-endian floats in temporary files, so
 * neither side can block on a full pipe and every run is bounded by the configured timeout.
 */
public class FfmpegAudioCodec implements AudioCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioCodec.class);

  private static final int STDERR_TAIL_CHARS = 2000;
  private static final int IO_BUFFER_FLOATS = 16 * 1024;

  private final CodecProperties properties;

  public FfmpegAudioCodec(CodecProperties properties) {
    this.properties = properties;
  }

  @Override
  public AudioTimeline decode(Path input) {
    LOGGER.debug("Decoding {}", input);
    Map<String, String> stream = probe(input);
    int sampleRate = parseIntOrFail(stream.get("sample_rate"), "sample_rate", input);
    int channels = parseIntOrFail(stream.get("channels"), "channels", input);

    Path raw = null;
    try {
      raw = Files.createTempFile("decode-", ".f32");
      run(
          List.of(
              properties.ffmpegPath(),
              "-v",
              "error",
              "-y",
              "-i",
              input.toString(),
              "-vn",
              "-f",
              "f32le",
              "-acodec",
              "pcm_f32le",
              "-ac",
              String.valueOf(channels),
              "-ar",
              String.valueOf(sampleRate),
              raw.toString()),
          null,
          "decode " + input.getFileName());
      return readInterleaved(raw, channels, sampleRate);
    } catch (IOException e) {
      String message = String.format("Failed to decode %s: %s", input, e.getMessage());
      LOGGER.error(message, e);
      throw new AudioCodecException(message, e);
    } finally {
      deleteQuietly(raw);
    }
  }

  @Override
  public void encodeMp3(AudioTimeline timeline, Path output, String bitrate) {
    LOGGER.debug(
        "Encoding {} frames at {} Hz to {} ({})",
        timeline.frameCount(),
        timeline.sampleRate(),
        output,
        bitrate);
    Path raw = null;
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      raw = Files.createTempFile("encode-", ".f32");
      writeInterleaved(timeline, raw);
      run(
          List.of(
              properties.ffmpegPath(),
              "-v",
              "error",
              "-y",
              "-f",
              "f32le",
              "-ar",
              String.valueOf(timeline.sampleRate()),
              "-ac",
              String.valueOf(timeline.channelCount()),
              "-i",
              raw.toString(),
              "-codec:a",
              "libmp3lame",
              "-b:a",
              bitrate,
              output.toString()),
          null,
          "encode " + output.getFileName());
    } catch (IOException e) {
      String message = String.format("Failed to encode %s: %s", output, e.getMessage());
      LOGGER.error(message, e);
      throw new AudioCodecException(message, e);
    } finally {
      deleteQuietly(raw);
    }
  }

  /**
   * Read channel count and sample rate of the first audio stream.
   *
   * <p>ffprobe prints one {@code key=value} line per requested entry.
   */
  Map<String, String> probe(Path input) {
    Path out = null;
    try {
      out = Files.createTempFile("probe-", ".txt");
      run(
          List.of(
              properties.ffprobePath(),
              "-v",
              "error",
              "-select_streams",
              "a:0",
              "-show_entries",
              "stream=sample_rate,channels",
              "-of",
              "default=noprint_wrappers=1",
              input.toString()),
          out,
          "probe " + input.getFileName());
      return parseKeyValues(Files.readAllLines(out));
    } catch (IOException e) {
      String message = String.format("Failed to probe %s: %s", input, e.getMessage());
      LOGGER.error(message, e);
      throw new AudioCodecException(message, e);
    } finally {
      deleteQuietly(out);
    }
  }

  static Map<String, String> parseKeyValues(List<String> lines) {
    Map<String, String> values = new HashMap<>();
    for (String line : lines) {
      int eq = line.indexOf('=');
      if (eq > 0) {
        values.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
      }
    }
    return values;
  }

  private void run(List<String> command, Path stdout, String action) throws IOException {
    Path stderr = Files.createTempFile("ffmpeg-", ".log");
    try {
      ProcessBuilder builder = new ProcessBuilder(command).redirectError(stderr.toFile());
      if (stdout != null) {
        builder.redirectOutput(stdout.toFile());
      } else {
        builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
      }
      LOGGER.debug("Executing: {}", String.join(" ", command));

      Process process = builder.start();
      boolean finished;
      try {
        finished = process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new AudioCodecException("Interrupted during " + action, e);
      }
      if (!finished) {
        process.destroyForcibly();
        String message =
            String.format("Timed out after %ds: %s", properties.timeoutSeconds(), action);
        LOGGER.error(message);
        throw new AudioCodecException(message);
      }
      if (process.exitValue() != 0) {
        String message =
            String.format(
                "%s failed with exit code %d: %s",
                action, process.exitValue(), tail(Files.readString(stderr)));
        LOGGER.error(message);
        throw new AudioCodecException(message);
      }
    } finally {
      deleteQuietly(stderr);
    }
  }

  private static AudioTimeline readInterleaved(Path raw, int channels, int sampleRate)
      throws IOException {
    byte[] bytes = Files.readAllBytes(raw);
    int frames = bytes.length / (Float.BYTES * channels);
    float[][] data = new float[channels][frames];
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    for (int frame = 0; frame < frames; frame++) {
      for (int channel = 0; channel < channels; channel++) {
        data[channel][frame] = buffer.getFloat();
      }
    }
    return new AudioTimeline(data, sampleRate);
  }

  private static void writeInterleaved(AudioTimeline timeline, Path raw) throws IOException {
    float[][] channels = timeline.channels();
    ByteBuffer buffer =
        ByteBuffer.allocate(IO_BUFFER_FLOATS * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    try (OutputStream out = Files.newOutputStream(raw)) {
      for (int frame = 0; frame < timeline.frameCount(); frame++) {
        for (float[] channel : channels) {
          if (!buffer.hasRemaining()) {
            out.write(buffer.array(), 0, buffer.position());
            buffer.clear();
          }
          buffer.putFloat(channel[frame]);
        }
      }
      out.write(buffer.array(), 0, buffer.position());
    }
  }

  private static int parseIntOrFail(String value, String key, Path input) {
    if (value == null) {
      throw new AudioCodecException(String.format("No %s reported for %s", key, input));
    }
    try {
      int parsed = Integer.parseInt(value);
      if (parsed <= 0) {
        throw new AudioCodecException(String.format("Invalid %s=%s for %s", key, value, input));
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new AudioCodecException(String.format("Invalid %s=%s for %s", key, value, input), e);
    }
  }

  private static String tail(String text) {
    String trimmed = text.strip();
    return trimmed.length() <= STDERR_TAIL_CHARS
        ? trimmed
        : trimmed.substring(trimmed.length() - STDERR_TAIL_CHARS);
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.debug("Could not delete temp file {}: {}", file, e.getMessage());
    }
  }
}
