package com.scholary.audiosync.remote;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the upload destination.
 *
 * <p>These map to the "audiosync.remote.*" keys in application.yml. {@code type} selects the
 * implementation; only the matching nested block needs to be filled in.
 */
@ConfigurationProperties(prefix = "audiosync.remote")
@Validated
public record RemoteStoreProperties(
    @NotBlank String type,
    String rootFolder,
    @Positive int chunkSizeMb,
    @Positive int apiTimeoutSeconds,
    @Valid S3 s3,
    @Valid Local local) {

  public static final String TYPE_S3 = "s3";
  public static final String TYPE_LOCAL = "local";

  /** Connection settings for S3 or an S3-compatible service such as MinIO. */
  public record S3(
      String endpoint,
      String accessKey,
      String secretKey,
      String bucket,
      String region,
      boolean pathStyleAccess) {}

  /** A directory standing in for the remote, for development. */
  public record Local(String path) {}
}
