package com.scholary.audiosync.config;

import com.scholary.audiosync.audio.AudioCodec;
import com.scholary.audiosync.audio.AudioProcessor;
import com.scholary.audiosync.audio.CodecProperties;
import com.scholary.audiosync.audio.FfmpegAudioCodec;
import com.scholary.audiosync.ledger.FingerprintLedger;
import com.scholary.audiosync.ledger.LedgerProperties;
import com.scholary.audiosync.pipeline.SyncPipeline;
import com.scholary.audiosync.remote.RemoteStore;
import com.scholary.audiosync.staging.StagingLifecycle;
import com.scholary.audiosync.staging.StagingProperties;
import com.scholary.audiosync.trim.SilenceTrimmer;
import com.scholary.audiosync.trim.TrimmerProperties;
import com.scholary.audiosync.upload.UploadProperties;
import com.scholary.audiosync.upload.UploadScheduler;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the pipeline stages from their properties.
 *
 * <p>The stages are plain classes so tests can build them directly; this is the only place that
 * knows how they fit together.
 */
@Configuration
@EnableConfigurationProperties({
  StagingProperties.class,
  TrimmerProperties.class,
  CodecProperties.class,
  UploadProperties.class
})
public class SyncConfig {

  @Bean
  public StagingLifecycle stagingLifecycle(StagingProperties properties, Clock clock) {
    return new StagingLifecycle(properties, clock);
  }

  @Bean
  public AudioCodec audioCodec(CodecProperties properties) {
    return new FfmpegAudioCodec(properties);
  }

  @Bean
  public SilenceTrimmer silenceTrimmer(TrimmerProperties properties) {
    return new SilenceTrimmer(properties);
  }

  @Bean
  public AudioProcessor audioProcessor(
      AudioCodec codec,
      SilenceTrimmer trimmer,
      TrimmerProperties properties,
      StagingLifecycle staging,
      Clock clock,
      @Qualifier("processingExecutor") ThreadPoolTaskExecutor processingExecutor) {
    return new AudioProcessor(
        codec,
        trimmer,
        properties,
        staging.tempDir(),
        clock,
        properties.processingThreads() > 1 ? processingExecutor : null);
  }

  @Bean
  public UploadScheduler uploadScheduler(
      RemoteStore remoteStore,
      FingerprintLedger ledger,
      UploadProperties properties,
      LedgerProperties ledgerProperties,
      @Qualifier("uploadExecutor") ThreadPoolTaskExecutor uploadExecutor) {
    return new UploadScheduler(
        remoteStore, ledger, properties, ledgerProperties.enabled(), uploadExecutor);
  }

  @Bean
  public SyncPipeline syncPipeline(
      StagingLifecycle staging,
      AudioProcessor processor,
      UploadScheduler scheduler,
      FingerprintLedger ledger,
      RemoteStore remoteStore,
      StagingProperties stagingProperties,
      LedgerProperties ledgerProperties) {
    return new SyncPipeline(
        staging, processor, scheduler, ledger, remoteStore, stagingProperties, ledgerProperties);
  }
}
