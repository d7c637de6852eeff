package com.scholary.audiosync.audio;

import com.scholary.audiosync.trim.AudioTimeline;
import java.nio.file.Path;

/**
 * Turns audio files into PCM timelines and back.
 *
 * <p>Byte-level codec work is delegated; the rest of the system only sees {@link AudioTimeline}.
 */
public interface AudioCodec {

  /**
   * Decode a file at its native channel count and sample rate.
   *
   * @throws com.scholary.audiosync.exception.AudioCodecException if the file cannot be decoded
   */
  AudioTimeline decode(Path input);

  /**
   * Encode a timeline as MP3.
   *
   * @param timeline audio to encode
   * @param output file to write, replaced if present
   * @param bitrate encoder bitrate such as {@code 64k}
   * @throws com.scholary.audiosync.exception.AudioCodecException if encoding fails
   */
  void encodeMp3(AudioTimeline timeline, Path output, String bitrate);
}
