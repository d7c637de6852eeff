package com.scholary.audiosync.config;

import java.nio.file.Path;

/** Resolves user-facing path settings, expanding a leading {@code ~} to the home directory. */
public final class PathExpander {

  private PathExpander() {}

  public static Path expand(String path) {
    if (path.equals("~")) {
      return Path.of(System.getProperty("user.home"));
    }
    if (path.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), path.substring(2));
    }
    return Path.of(path);
  }
}
