package com.scholary.audiosync.exception;

/**
 * Base exception for all audio-sync errors.
 *
 * <p>Every domain exception extends this class so the pipeline and the command runner can tell our
 * own failures apart from programming errors.
 */
public class AudioSyncException extends RuntimeException {

  public AudioSyncException(String message) {
    super(message);
  }

  public AudioSyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
