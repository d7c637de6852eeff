package com.scholary.audiosync.exception;

/**
 * The sync ledger could not be read or written.
 *
 * <p>Fatal for the whole run, since dedup and audit decisions cannot be made without it.
 */
public class StorageException extends AudioSyncException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
