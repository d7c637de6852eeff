package com.scholary.audiosync.staging;

import com.scholary.audiosync.config.PathExpander;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for local staging.
 *
 * <p>These map to the "audiosync.staging.*" keys in application.yml. A leading {@code ~} in {@code
 * baseDir} or {@code tempDir} is expanded to the user's home directory. A blank {@code tempDir}
 * means {@code <baseDir>/temp}.
 */
@ConfigurationProperties(prefix = "audiosync.staging")
@Validated
public record StagingProperties(
    @NotBlank String baseDir,
    String tempDir,
    @NotEmpty List<String> patterns,
    List<String> excludeFolders,
    @Positive int retentionDays,
    boolean autoCleanup,
    boolean verifyCopy,
    @Positive int copyBufferKb,
    @Positive double maxStorageGb) {

  public StagingProperties {
    excludeFolders = excludeFolders != null ? List.copyOf(excludeFolders) : List.of();
    patterns = patterns != null ? List.copyOf(patterns) : List.of();
  }

  public Path basePath() {
    return PathExpander.expand(baseDir).toAbsolutePath().normalize();
  }

  public Path tempPath() {
    return tempDir == null || tempDir.isBlank()
        ? basePath().resolve("temp")
        : PathExpander.expand(tempDir).toAbsolutePath().normalize();
  }

  public long maxStorageBytes() {
    return (long) (maxStorageGb * 1024 * 1024 * 1024);
  }
}
