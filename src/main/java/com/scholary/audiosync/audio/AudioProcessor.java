package com.scholary.audiosync.audio;

import com.scholary.audiosync.exception.AudioCodecException;
import com.scholary.audiosync.exception.InvalidInputException;
import com.scholary.audiosync.logging.StructuredLogger;
import com.scholary.audiosync.trim.AudioTimeline;
import com.scholary.audiosync.trim.SilenceTrimmer;
import com.scholary.audiosync.trim.TrimResult;
import com.scholary.audiosync.trim.TrimmerProperties;
import com.scholary.audiosync.trim.VoiceActivity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a staged file, trims it and encodes the result as MP3 in the temp directory.
 *
 * <p>Files that turn out silent, or whose voice ratio is below the configured minimum, are
 * reported as skipped rather than failed. Output is named {@code
 * <stem>_processed_<yyyyMMdd_HHmmss>_<unique>.mp3} and is left for the staging lifecycle to
 * promote.
 */
public class AudioProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioProcessor.class);

  private static final DateTimeFormatter OUTPUT_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final AudioCodec codec;
  private final SilenceTrimmer trimmer;
  private final TrimmerProperties properties;
  private final Path tempDir;
  private final Clock clock;
  private final Executor executor;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * @param executor pool for {@link #processAll}; null processes files one after another
   */
  public AudioProcessor(
      AudioCodec codec,
      SilenceTrimmer trimmer,
      TrimmerProperties properties,
      Path tempDir,
      Clock clock,
      Executor executor) {
    this.codec = codec;
    this.trimmer = trimmer;
    this.properties = properties;
    this.tempDir = tempDir;
    this.clock = clock;
    this.executor = executor;
  }

  /**
   * Process one file. Never throws for per-file problems; they come back as {@link
   * ProcessingResult.Outcome#FAILED}.
   */
  public ProcessingResult process(Path input) {
    String name = input.getFileName().toString();
    try {
      AudioTimeline timeline = codec.decode(input);

      if (properties.minVoiceRatioPercent() > 0) {
        VoiceActivity activity = trimmer.analyzeVoiceActivity(timeline);
        if (activity.voiceRatioPercent() < properties.minVoiceRatioPercent()) {
          String detail =
              String.format(
                  "voice ratio %.1f%% below %.1f%%",
                  activity.voiceRatioPercent(), properties.minVoiceRatioPercent());
          structuredLogger.logFileProcessed(name, "low_voice_activity", activity.totalMs(), 0);
          return ProcessingResult.skipped(
              input, ProcessingResult.Outcome.LOW_VOICE_ACTIVITY, activity.totalMs(), detail);
        }
      }

      Optional<TrimResult> trimmed = trimmer.trim(timeline);
      if (trimmed.isEmpty()) {
        long durationMs = timeline.durationMs();
        structuredLogger.logFileProcessed(name, "no_audio", durationMs, 0);
        return ProcessingResult.skipped(
            input, ProcessingResult.Outcome.NO_AUDIO, durationMs, "no audio above threshold");
      }

      TrimResult result = trimmed.get();
      Path output = outputPathFor(input);
      codec.encodeMp3(result.audio(), output, properties.targetBitrate());
      structuredLogger.logFileProcessed(
          name, "processed", result.originalMs(), result.trimmedMs());
      return ProcessingResult.processed(input, output, result.originalMs(), result.trimmedMs());

    } catch (AudioCodecException | InvalidInputException e) {
      LOGGER.error("Failed to process {}: {}", input, e.getMessage());
      return ProcessingResult.failed(input, e.getMessage());
    } catch (IOException e) {
      LOGGER.error("Failed to prepare output for {}", input, e);
      return ProcessingResult.failed(input, e.getMessage());
    }
  }

  /**
   * Process several files, in parallel when an executor was given.
   *
   * @return one result per input, in input order
   */
  public List<ProcessingResult> processAll(List<Path> inputs) {
    if (executor == null || inputs.size() <= 1) {
      List<ProcessingResult> results = new ArrayList<>(inputs.size());
      for (Path input : inputs) {
        results.add(process(input));
      }
      return results;
    }

    List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>(inputs.size());
    for (Path input : inputs) {
      futures.add(CompletableFuture.supplyAsync(() -> process(input), executor));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    List<ProcessingResult> results = new ArrayList<>(inputs.size());
    for (CompletableFuture<ProcessingResult> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  private Path outputPathFor(Path input) throws IOException {
    Files.createDirectories(tempDir);
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String stamp = LocalDateTime.now(clock).format(OUTPUT_STAMP);
    // the same stem can come from several date folders
    return Files.createTempFile(tempDir, stem + "_processed_" + stamp + "_", ".mp3");
  }
}
