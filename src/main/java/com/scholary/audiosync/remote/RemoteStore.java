package com.scholary.audiosync.remote;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A remote destination organised as folders of named objects.
 *
 * <p>Folder and object ids are opaque strings chosen by the implementation. Failures are reported
 * with the exception hierarchy: {@link com.scholary.audiosync.exception.TransientIoException} for
 * anything worth retrying, {@link com.scholary.audiosync.exception.AuthenticationException} when
 * credentials are rejected and {@link com.scholary.audiosync.exception.RemoteStoreException} for
 * everything else.
 *
 * <p>Implementations must be safe for concurrent use by the upload workers.
 */
public interface RemoteStore extends AutoCloseable {

  /** Id of the folder all uploads go under. */
  String rootFolderId();

  /**
   * Find a child folder by name, creating it if missing. Calling it twice returns the same id.
   *
   * @return the folder id
   */
  String findOrCreateFolder(String name, String parentId);

  /**
   * Look for an object that already holds this file.
   *
   * @param fingerprint content of the local file; when given, an object with the same name but
   *     different content does not count
   */
  Optional<RemoteObject> findExisting(String name, String parentId, ContentFingerprint fingerprint);

  /**
   * Upload a file into a folder under its own file name, replacing any object of that name.
   *
   * @param fingerprint stored with the object so later runs can recognise it; may be null
   */
  RemoteObject upload(Path localPath, String parentId, ContentFingerprint fingerprint);

  default RemoteObject upload(Path localPath, String parentId) {
    return upload(localPath, parentId, null);
  }

  /** Check connectivity and credentials. */
  RemoteAccount getAbout();

  @Override
  default void close() {}
}
