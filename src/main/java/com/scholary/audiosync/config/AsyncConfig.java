package com.scholary.audiosync.config;

import com.scholary.audiosync.trim.TrimmerProperties;
import com.scholary.audiosync.upload.UploadProperties;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the worker pools.
 *
 * <p>Uploads run on a fixed pool of {@code parallelUploads} threads; processing gets its own pool
 * of {@code processingThreads}. Both copy the caller's MDC onto the worker so log lines keep the
 * session id.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "uploadExecutor")
  public ThreadPoolTaskExecutor uploadExecutor(UploadProperties properties) {
    return fixedPool(properties.parallelUploads(), "upload-");
  }

  @Bean(name = "processingExecutor")
  public ThreadPoolTaskExecutor processingExecutor(TrimmerProperties properties) {
    return fixedPool(properties.processingThreads(), "process-");
  }

  private static ThreadPoolTaskExecutor fixedPool(int threads, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix(prefix);
    executor.setTaskDecorator(mdcPropagating());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  static TaskDecorator mdcPropagating() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
