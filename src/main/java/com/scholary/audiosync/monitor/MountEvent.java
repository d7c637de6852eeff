package com.scholary.audiosync.monitor;

import java.nio.file.Path;

/** A volume appearing under or disappearing from the mounts root. */
public record MountEvent(Type type, Path path) {

  public enum Type {
    MOUNTED,
    UNMOUNTED
  }

  public static MountEvent mounted(Path path) {
    return new MountEvent(Type.MOUNTED, path);
  }

  public static MountEvent unmounted(Path path) {
    return new MountEvent(Type.UNMOUNTED, path);
  }
}
