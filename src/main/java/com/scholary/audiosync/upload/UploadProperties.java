package com.scholary.audiosync.upload;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for uploads ("audiosync.upload.*").
 *
 * <p>{@code retryAttempts} counts every try, the first one included.
 */
@ConfigurationProperties(prefix = "audiosync.upload")
@Validated
public record UploadProperties(
    @Positive int parallelUploads,
    @Positive int retryAttempts,
    @Positive long maxFileSizeMb,
    boolean preserveFolderStructure,
    @Positive long initialBackoffMs,
    @Positive long maxBackoffMs) {

  public long maxFileSizeBytes() {
    return maxFileSizeMb * 1024 * 1024;
  }
}
