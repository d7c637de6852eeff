package com.scholary.audiosync.exception;

/** Thrown when an audio timeline is degenerate: missing, empty or with an invalid sample rate. */
public class InvalidInputException extends AudioSyncException {

  private final String reason;

  public InvalidInputException(String reason) {
    super("Invalid audio input: " + reason);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }
}
