package io.mylab.lab.labplatform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the background audit writer.
 *
 * @param queueCapacity pending writes held before new entries are dropped
 * @param workerThreads threads draining the queue
 */
@ConfigurationProperties(prefix = "audit")
public record AuditProperties(int queueCapacity, int workerThreads) {

  public AuditProperties {
    if (queueCapacity <= 0) {
      queueCapacity = 1000;
    }
    if (workerThreads <= 0) {
      workerThreads = 2;
    }
  }
}
