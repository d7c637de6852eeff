package com.scholary.audiosync.exception;

/** Thrown when the external codec cannot decode or encode a file, or does not finish in time. */
public class AudioCodecException extends AudioSyncException {

  public AudioCodecException(String message) {
    super(message);
  }

  public AudioCodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
