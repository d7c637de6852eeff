package com.scholary.audiosync.config;

import com.scholary.audiosync.monitor.MonitorProperties;
import com.scholary.audiosync.monitor.MountWatcher;
import com.scholary.audiosync.monitor.PollingMountWatcher;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for mount watching. The watcher only starts polling when the monitor runs. */
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {

  @Bean(destroyMethod = "close")
  public MountWatcher mountWatcher(MonitorProperties properties, Clock clock) {
    return new PollingMountWatcher(
        properties.mountsRootPath(), properties.pollInterval(), properties.settleDelay(), clock);
  }
}
