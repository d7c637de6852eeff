package com.scholary.audiosync.remote;

import com.scholary.audiosync.exception.AuthenticationException;
import com.scholary.audiosync.exception.RemoteStoreException;
import com.scholary.audiosync.exception.TransientIoException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

/**
 * S3/MinIO implementation of RemoteStore.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO.
 * S3 has no real folders, so a folder is a key prefix ending in {@code /} with a zero-byte marker
 * object under that exact key. Creating a folder twice just finds the marker.
 *
 * <p>Files up to one chunk go up in a single PUT; bigger files use a multipart upload with
 * {@code chunkSizeMb} parts (never less than the 5 MB S3 minimum). The content fingerprint is
 * stored as user metadata so {@link #findExisting} can tell a changed file from the same one.
 *
 * <p>Every API call is bounded by {@code apiTimeoutSeconds}. SDK errors are mapped onto the
 * exception hierarchy: 401/403 become {@link AuthenticationException}, 408/429/5xx and client-side
 * IO or timeouts become {@link TransientIoException}, the rest {@link RemoteStoreException}.
 */
public class S3RemoteStore implements RemoteStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3RemoteStore.class);

  static final String FINGERPRINT_METADATA = "content-sha256";
  private static final String AUDIO_CONTENT_TYPE = "audio/mpeg";
  private static final String FOLDER_CONTENT_TYPE = "application/x-directory";
  private static final long MIN_PART_BYTES = 5L * 1024 * 1024;

  private final S3Client s3Client;
  private final String bucket;
  private final String rootFolderId;
  private final long partBytes;
  private final String endpointDescription;

  public S3RemoteStore(RemoteStoreProperties properties) {
    this(
        buildClient(properties),
        properties.s3().bucket(),
        properties.rootFolder(),
        properties.chunkSizeMb(),
        describe(properties.s3()));
  }

  public S3RemoteStore(
      S3Client s3Client,
      String bucket,
      String rootFolder,
      int chunkSizeMb,
      String endpointDescription) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("S3 bucket must be configured");
    }
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.rootFolderId = FolderKeys.root(rootFolder);
    this.partBytes = Math.max(MIN_PART_BYTES, chunkSizeMb * 1024L * 1024L);
    this.endpointDescription = endpointDescription;
    LOGGER.info(
        "S3 remote store ready: bucket={}, root='{}', partBytes={}",
        bucket,
        rootFolderId,
        partBytes);
  }

  private static S3Client buildClient(RemoteStoreProperties properties) {
    RemoteStoreProperties.S3 s3 = properties.s3();
    if (s3 == null) {
      throw new IllegalArgumentException("audiosync.remote.s3 must be configured for type s3");
    }
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        s3.endpoint(),
        s3.bucket(),
        s3.pathStyleAccess());

    AwsCredentialsProvider credentialsProvider =
        isBlank(s3.accessKey())
            ? DefaultCredentialsProvider.create()
            : StaticCredentialsProvider.create(
                AwsBasicCredentials.create(s3.accessKey(), s3.secretKey()));

    Region region = isBlank(s3.region()) ? Region.US_EAST_1 : Region.of(s3.region());

    Duration timeout = Duration.ofSeconds(properties.apiTimeoutSeconds());
    S3ClientBuilder builder =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .forcePathStyle(s3.pathStyleAccess()) // Required for MinIO
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(timeout)
                    .apiCallAttemptTimeout(timeout)
                    .build());
    if (!isBlank(s3.endpoint())) {
      builder.endpointOverride(URI.create(s3.endpoint()));
    }
    return builder.build();
  }

  @Override
  public String rootFolderId() {
    return rootFolderId;
  }

  @Override
  public String findOrCreateFolder(String name, String parentId) {
    String prefix = FolderKeys.child(parentId, name);
    try {
      if (head(prefix).isPresent()) {
        return prefix;
      }
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(prefix)
              .contentType(FOLDER_CONTENT_TYPE)
              .contentLength(0L)
              .build(),
          RequestBody.empty());
      LOGGER.info("Created folder: bucket={}, prefix={}", bucket, prefix);
      return prefix;
    } catch (RuntimeException e) {
      throw mapFailure("create folder " + prefix, e);
    }
  }

  @Override
  public Optional<RemoteObject> findExisting(
      String name, String parentId, ContentFingerprint fingerprint) {
    String key = FolderKeys.objectKey(parentId, name);
    Optional<HeadObjectResponse> head;
    try {
      head = head(key);
    } catch (RuntimeException e) {
      throw mapFailure("look up " + key, e);
    }
    if (head.isEmpty()) {
      return Optional.empty();
    }

    HeadObjectResponse response = head.get();
    ContentFingerprint stored = storedFingerprint(response.metadata());
    if (fingerprint != null && stored != null && !stored.equals(fingerprint)) {
      LOGGER.debug("Remote object differs: key={}, remote={}", key, stored.shortForm());
      return Optional.empty();
    }
    return Optional.of(new RemoteObject(key, name, response.contentLength(), stored));
  }

  @Override
  public RemoteObject upload(Path localPath, String parentId, ContentFingerprint fingerprint) {
    String name = localPath.getFileName().toString();
    String key = FolderKeys.objectKey(parentId, name);
    Map<String, String> metadata =
        fingerprint != null ? Map.of(FINGERPRINT_METADATA, fingerprint.hex()) : Map.of();

    long size;
    try {
      size = Files.size(localPath);
    } catch (IOException e) {
      throw new TransientIoException("Cannot read " + localPath + ": " + e.getMessage(), e);
    }

    LOGGER.debug("Uploading object: bucket={}, key={}, size={}", bucket, key, size);
    try {
      if (size <= partBytes) {
        s3Client.putObject(
            PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(AUDIO_CONTENT_TYPE)
                .contentLength(size)
                .metadata(metadata)
                .build(),
            RequestBody.fromFile(localPath));
      } else {
        uploadMultipart(localPath, key, size, metadata);
      }
    } catch (RuntimeException e) {
      throw mapFailure("upload " + key, e);
    }

    LOGGER.info("Successfully uploaded object: bucket={}, key={}, size={}", bucket, key, size);
    return new RemoteObject(key, name, size, fingerprint);
  }

  private void uploadMultipart(
      Path localPath, String key, long size, Map<String, String> metadata) {
    String uploadId =
        s3Client
            .createMultipartUpload(
                CreateMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(AUDIO_CONTENT_TYPE)
                    .metadata(metadata)
                    .build())
            .uploadId();

    try (InputStream in = Files.newInputStream(localPath)) {
      List<CompletedPart> parts = new ArrayList<>();
      byte[] buffer = new byte[(int) partBytes];
      int partNumber = 1;
      long sent = 0;
      while (sent < size) {
        int length = in.readNBytes(buffer, 0, buffer.length);
        if (length == 0) {
          break;
        }
        UploadPartResponse response =
            s3Client.uploadPart(
                UploadPartRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .uploadId(uploadId)
                    .partNumber(partNumber)
                    .contentLength((long) length)
                    .build(),
                RequestBody.fromBytes(length == buffer.length ? buffer : copyOf(buffer, length)));
        parts.add(CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build());
        LOGGER.debug("Uploaded part {} of {} ({} bytes)", partNumber, key, length);
        sent += length;
        partNumber++;
      }

      s3Client.completeMultipartUpload(
          CompleteMultipartUploadRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
              .build());
    } catch (IOException e) {
      abortQuietly(key, uploadId);
      throw new UncheckedIOException(e);
    } catch (RuntimeException e) {
      abortQuietly(key, uploadId);
      throw e;
    }
  }

  private void abortQuietly(String key, String uploadId) {
    try {
      s3Client.abortMultipartUpload(
          AbortMultipartUploadRequest.builder().bucket(bucket).key(key).uploadId(uploadId).build());
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to abort multipart upload: key={}, uploadId={}", key, uploadId, e);
    }
  }

  @Override
  public RemoteAccount getAbout() {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      return new RemoteAccount("s3://" + bucket + "/" + rootFolderId, endpointDescription);
    } catch (RuntimeException e) {
      throw mapFailure("check bucket " + bucket, e);
    }
  }

  private Optional<HeadObjectResponse> head(String key) {
    try {
      return Optional.of(
          s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build()));
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw e;
    }
  }

  private static ContentFingerprint storedFingerprint(Map<String, String> metadata) {
    String value = metadata != null ? metadata.get(FINGERPRINT_METADATA) : null;
    if (value == null) {
      return null;
    }
    try {
      return ContentFingerprint.fromHex(value);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Ignoring malformed fingerprint metadata: {}", value);
      return null;
    }
  }

  /** Translate an SDK failure into the exception the upload scheduler acts on. */
  RuntimeException mapFailure(String action, RuntimeException e) {
    if (e instanceof S3Exception) {
      int status = ((S3Exception) e).statusCode();
      String message =
          String.format("Failed to %s: bucket=%s, statusCode=%d", action, bucket, status);
      if (status == 401 || status == 403) {
        LOGGER.error(message, e);
        return new AuthenticationException(message, e);
      }
      if (status == 408 || status == 429 || status >= 500) {
        LOGGER.warn("{}: {}", message, e.getMessage());
        return new TransientIoException(message, e);
      }
      LOGGER.error(message, e);
      return new RemoteStoreException(message, e);
    }
    if (e instanceof SdkClientException || e instanceof UncheckedIOException) {
      String message = String.format("Failed to %s: %s", action, e.getMessage());
      LOGGER.warn(message);
      return new TransientIoException(message, e);
    }
    String message = String.format("Unexpected error during %s: bucket=%s", action, bucket);
    LOGGER.error(message, e);
    return new RemoteStoreException(message, e);
  }

  /**
   * Clean up resources when the store is no longer needed.
   *
   * <p>This should be called when the application shuts down to release connections and threads.
   */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }

  private static byte[] copyOf(byte[] buffer, int length) {
    byte[] copy = new byte[length];
    System.arraycopy(buffer, 0, copy, 0, length);
    return copy;
  }

  private static String describe(RemoteStoreProperties.S3 s3) {
    return isBlank(s3.endpoint()) ? "aws:" + s3.region() : s3.endpoint();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
