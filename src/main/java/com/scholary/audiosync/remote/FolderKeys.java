package com.scholary.audiosync.remote;

/**
 * Folder ids shared by the key-based stores: a folder is a key prefix ending in {@code /}, and
 * the bucket or directory root is the empty prefix.
 */
final class FolderKeys {

  private FolderKeys() {}

  /** Normalize a configured root folder such as {@code /audio//2024} to {@code audio/2024/}. */
  static String root(String rootFolder) {
    if (rootFolder == null) {
      return "";
    }
    StringBuilder prefix = new StringBuilder();
    for (String part : rootFolder.split("/")) {
      if (!part.isBlank()) {
        prefix.append(sanitize(part)).append('/');
      }
    }
    return prefix.toString();
  }

  static String child(String parentId, String name) {
    return parentId + sanitize(name) + "/";
  }

  static String objectKey(String parentId, String name) {
    return parentId + sanitize(name);
  }

  /** Folder and file names may not contain separators or be dot segments. */
  static String sanitize(String name) {
    String cleaned = name.replace('/', '_').replace('\\', '_').strip();
    if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
      throw new IllegalArgumentException("Invalid remote name: '" + name + "'");
    }
    return cleaned;
  }
}
