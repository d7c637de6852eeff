package com.scholary.audiosync.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.audiosync.exception.AuthenticationException;
import com.scholary.audiosync.exception.RemoteStoreException;
import com.scholary.audiosync.exception.TransientIoException;
import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class S3RemoteStoreTest {

  @Mock private S3Client s3Client;

  private S3RemoteStore store;

  @BeforeEach
  void setUp() {
    store = new S3RemoteStore(s3Client, "voice-bucket", "audio-sync", 8, "http://minio:9000");
  }

  private static S3Exception s3Error(int status) {
    return (S3Exception)
        S3Exception.builder().statusCode(status).message("status " + status).build();
  }

  @Test
  void constructor_shouldRequireBucket() {
    assertThatThrownBy(() -> new S3RemoteStore(s3Client, " ", "audio-sync", 8, "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void mapFailure_shouldTreatRejectedCredentialsAsAuthentication() {
    assertThat(store.mapFailure("upload a", s3Error(403)))
        .isInstanceOf(AuthenticationException.class)
        .hasMessageContaining("statusCode=403");
    assertThat(store.mapFailure("upload a", s3Error(401)))
        .isInstanceOf(AuthenticationException.class);
  }

  @Test
  void mapFailure_shouldTreatThrottlingAndServerErrorsAsTransient() {
    assertThat(store.mapFailure("upload a", s3Error(503))).isInstanceOf(TransientIoException.class);
    assertThat(store.mapFailure("upload a", s3Error(429))).isInstanceOf(TransientIoException.class);
    assertThat(store.mapFailure("upload a", s3Error(408))).isInstanceOf(TransientIoException.class);
  }

  @Test
  void mapFailure_shouldTreatClientSideErrorsAsTransient() {
    RuntimeException mapped =
        store.mapFailure("upload a", SdkClientException.create("connection reset"));

    assertThat(mapped).isInstanceOf(TransientIoException.class).hasMessageContaining("reset");
  }

  @Test
  void mapFailure_shouldTreatOtherErrorsAsPermanent() {
    assertThat(store.mapFailure("upload a", s3Error(400))).isInstanceOf(RemoteStoreException.class);
    assertThat(store.mapFailure("upload a", new IllegalStateException("boom")))
        .isInstanceOf(RemoteStoreException.class);
  }

  @Test
  void findOrCreateFolder_shouldReuseExistingMarker() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenReturn(HeadObjectResponse.builder().contentLength(0L).build());

    String folder = store.findOrCreateFolder("2024-05-01", store.rootFolderId());

    assertThat(folder).isEqualTo("audio-sync/2024-05-01/");
    verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void findOrCreateFolder_shouldWriteMarkerWhenMissing() {
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().statusCode(404).build());

    String folder = store.findOrCreateFolder("2024-05-01", store.rootFolderId());

    assertThat(folder).isEqualTo("audio-sync/2024-05-01/");
    verify(s3Client).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void findExisting_shouldCompareStoredFingerprint() {
    ContentFingerprint local = ContentFingerprint.of("voice".getBytes(StandardCharsets.UTF_8));
    ContentFingerprint other = ContentFingerprint.of("other".getBytes(StandardCharsets.UTF_8));
    when(s3Client.headObject(any(HeadObjectRequest.class)))
        .thenReturn(
            HeadObjectResponse.builder()
                .contentLength(5L)
                .metadata(Map.of(S3RemoteStore.FINGERPRINT_METADATA, local.hex()))
                .build());

    Optional<RemoteObject> same = store.findExisting("memo.mp3", store.rootFolderId(), local);
    Optional<RemoteObject> changed = store.findExisting("memo.mp3", store.rootFolderId(), other);

    assertThat(same).isPresent();
    assertThat(same.get().id()).isEqualTo("audio-sync/memo.mp3");
    assertThat(same.get().fingerprint()).isEqualTo(local);
    assertThat(changed).isEmpty();
  }

  @Test
  void findExisting_shouldMapAccessDenied() {
    when(s3Client.headObject(any(HeadObjectRequest.class))).thenThrow(s3Error(403));

    assertThatThrownBy(() -> store.findExisting("memo.mp3", store.rootFolderId(), null))
        .isInstanceOf(AuthenticationException.class);
  }

  @Test
  void getAbout_shouldDescribeBucketAndEndpoint() {
    RemoteAccount account = store.getAbout();

    assertThat(account.identity()).isEqualTo("s3://voice-bucket/audio-sync/");
    assertThat(account.description()).isEqualTo("http://minio:9000");
    verify(s3Client).headBucket(any(HeadBucketRequest.class));
  }
}
