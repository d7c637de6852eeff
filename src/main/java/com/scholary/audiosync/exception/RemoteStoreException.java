package com.scholary.audiosync.exception;

/**
 * A remote store failure that retrying will not fix, such as a rejected request or a missing
 * bucket.
 *
 * <p>It fails the current file only. Credential problems are reported as {@link
 * AuthenticationException} instead.
 */
public class RemoteStoreException extends AudioSyncException {

  public RemoteStoreException(String message) {
    super(message);
  }

  public RemoteStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
