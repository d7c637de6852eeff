package com.scholary.audiosync.remote;

import com.scholary.audiosync.exception.AuthenticationException;
import com.scholary.audiosync.exception.TransientIoException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import com.scholary.audiosync.staging.FileMoves;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory-backed store for development and tests.
 *
 * <p>Ids are paths relative to the base directory, using the same prefix convention as the S3
 * store. Uploads are written to a temp file next to the target and renamed into place. Existing
 * objects are recognised by hashing them, so no metadata needs to be kept.
 */
public class LocalFsRemoteStore implements RemoteStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFsRemoteStore.class);

  private final Path basePath;
  private final String rootFolderId;

  public LocalFsRemoteStore(Path basePath, String rootFolder) {
    this.basePath = basePath.toAbsolutePath().normalize();
    this.rootFolderId = FolderKeys.root(rootFolder);
    LOGGER.info("Local remote store: basePath={}, root='{}'", this.basePath, rootFolderId);
  }

  @Override
  public String rootFolderId() {
    return rootFolderId;
  }

  @Override
  public String findOrCreateFolder(String name, String parentId) {
    String folderId = FolderKeys.child(parentId, name);
    try {
      Files.createDirectories(resolve(folderId));
      return folderId;
    } catch (IOException e) {
      throw new TransientIoException("Cannot create folder " + folderId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<RemoteObject> findExisting(
      String name, String parentId, ContentFingerprint fingerprint) {
    String id = FolderKeys.objectKey(parentId, name);
    Path target = resolve(id);
    if (!Files.isRegularFile(target)) {
      return Optional.empty();
    }
    try {
      ContentFingerprint stored = ContentFingerprint.of(target);
      if (fingerprint != null && !stored.equals(fingerprint)) {
        return Optional.empty();
      }
      return Optional.of(new RemoteObject(id, name, Files.size(target), stored));
    } catch (IOException e) {
      throw new TransientIoException("Cannot read " + target + ": " + e.getMessage(), e);
    }
  }

  @Override
  public RemoteObject upload(Path localPath, String parentId, ContentFingerprint fingerprint) {
    String name = localPath.getFileName().toString();
    String id = FolderKeys.objectKey(parentId, name);
    Path target = resolve(id);
    Path temp = target.resolveSibling("." + target.getFileName() + ".uploading");
    try {
      Files.createDirectories(target.getParent());
      Files.copy(localPath, temp, StandardCopyOption.REPLACE_EXISTING);
      FileMoves.moveIntoPlace(temp, target);
      long size = Files.size(target);
      LOGGER.info("Stored {} as {} ({} bytes)", localPath, id, size);
      return new RemoteObject(id, name, size, fingerprint);
    } catch (IOException e) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw new TransientIoException("Cannot store " + localPath + ": " + e.getMessage(), e);
    }
  }

  @Override
  public RemoteAccount getAbout() {
    try {
      Files.createDirectories(basePath);
    } catch (IOException e) {
      throw new AuthenticationException("Cannot create remote directory " + basePath, e);
    }
    if (!Files.isWritable(basePath)) {
      throw new AuthenticationException("Remote directory is not writable: " + basePath);
    }
    return new RemoteAccount("file://" + basePath + "/" + rootFolderId, "local directory");
  }

  private Path resolve(String id) {
    Path resolved = basePath.resolve(id).normalize();
    if (!resolved.startsWith(basePath)) {
      throw new IllegalArgumentException("Id escapes the store: " + id);
    }
    return resolved;
  }
}
