package com.scholary.audiosync.config;

import com.scholary.audiosync.remote.LocalFsRemoteStore;
import com.scholary.audiosync.remote.RemoteStore;
import com.scholary.audiosync.remote.RemoteStoreProperties;
import com.scholary.audiosync.remote.S3RemoteStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the upload destination.
 *
 * <p>Picks the RemoteStore implementation from {@code audiosync.remote.type}. Spring closes the
 * store on shutdown.
 */
@Configuration
@EnableConfigurationProperties(RemoteStoreProperties.class)
public class RemoteStoreConfig {

  @Bean(destroyMethod = "close")
  public RemoteStore remoteStore(RemoteStoreProperties properties) {
    switch (properties.type()) {
      case RemoteStoreProperties.TYPE_S3:
        return new S3RemoteStore(properties);
      case RemoteStoreProperties.TYPE_LOCAL:
        if (properties.local() == null
            || properties.local().path() == null
            || properties.local().path().isBlank()) {
          throw new IllegalArgumentException(
              "audiosync.remote.local.path must be set for type local");
        }
        return new LocalFsRemoteStore(
            PathExpander.expand(properties.local().path()), properties.rootFolder());
      default:
        throw new IllegalArgumentException(
            "Unknown audiosync.remote.type '" + properties.type() + "', expected s3 or local");
    }
  }
}
