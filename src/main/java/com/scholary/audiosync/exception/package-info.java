/**
 * Exception hierarchy for the sync pipeline.
 *
 * <p>All exceptions are unchecked and extend {@link
 * com.scholary.audiosync.exception.AudioSyncException}. They split into two groups:
 *
 * <ul>
 *   <li>Per-file failures that never abort a batch: {@link
 *       com.scholary.audiosync.exception.TransientIoException} (retried), {@link
 *       com.scholary.audiosync.exception.IntegrityException}, {@link
 *       com.scholary.audiosync.exception.CapacityException}, {@link
 *       com.scholary.audiosync.exception.InvalidInputException}, {@link
 *       com.scholary.audiosync.exception.AudioCodecException} and {@link
 *       com.scholary.audiosync.exception.RemoteStoreException}
 *   <li>Run-level failures that abort the remaining batch and fail the session: {@link
 *       com.scholary.audiosync.exception.AuthenticationException} and {@link
 *       com.scholary.audiosync.exception.StorageException}
 * </ul>
 *
 * <p>A duplicate skip is not an exception; it is a normal upload outcome.
 */
package com.scholary.audiosync.exception;
