package com.scholary.audiosync.exception;

/**
 * The remote store rejected our credentials.
 *
 * <p>Fatal for the whole run: there is no point uploading the remaining files.
 */
public class AuthenticationException extends AudioSyncException {

  public AuthenticationException(String message) {
    super(message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
