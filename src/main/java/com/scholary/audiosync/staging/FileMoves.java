package com.scholary.audiosync.staging;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** File moves shared by staging and the local remote store. */
public final class FileMoves {

  private FileMoves() {}

  /**
   * Rename {@code source} onto {@code target}, atomically where the file system allows it.
   *
   * <p>Falls back to a replacing move when the two paths are on different file stores.
   */
  public static void moveIntoPlace(Path source, Path target) throws IOException {
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Replace the extension of the last path element, or append one if it has none. */
  public static Path withExtension(Path path, String extension) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    return path.resolveSibling(stem + extension);
  }
}
