package io.mylab.lab.labplatform.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor for audit and security log writes. A full queue rejects the task; the caller
 * logs and drops the entry instead of blocking the request thread.
 */
@Configuration
@EnableConfigurationProperties({AuditProperties.class, AccessControlProperties.class})
public class AuditExecutorConfig {

  @Bean(name = "auditExecutor")
  public ThreadPoolTaskExecutor auditExecutor(AuditProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("audit-writer-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }
}
