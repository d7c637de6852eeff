package com.scholary.audiosync.exception;

/**
 * A failure that is expected to go away on its own: network blips, throttling, lock or call
 * timeouts.
 *
 * <p>The upload scheduler retries operations that fail with this exception; everything else fails
 * the file immediately.
 */
public class TransientIoException extends AudioSyncException {

  public TransientIoException(String message) {
    super(message);
  }

  public TransientIoException(String message, Throwable cause) {
    super(message, cause);
  }
}
