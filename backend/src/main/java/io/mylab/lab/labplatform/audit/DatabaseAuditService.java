package io.mylab.lab.labplatform.audit;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed {@link AuditService}. Writes are handed to the bounded {@code auditExecutor} and
 * run in their own transaction on a worker thread.
 *
 * <p>When the queue is full the entry is dropped with a warning. A failed write is logged and not
 * retried. Neither case reaches the caller.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditLogRepository auditLogRepository;
  private final SecurityLogRepository securityLogRepository;
  private final TaskExecutor auditExecutor;

  public DatabaseAuditService(
      AuditLogRepository auditLogRepository,
      SecurityLogRepository securityLogRepository,
      @Qualifier("auditExecutor") TaskExecutor auditExecutor) {
    this.auditLogRepository = auditLogRepository;
    this.securityLogRepository = securityLogRepository;
    this.auditExecutor = auditExecutor;
  }

  @Override
  public void log(AuditRecord record) {
    submit(
        "audit " + record.action().value() + " " + record.objectType() + "/" + record.objectId(),
        () -> {
          auditLogRepository.save(new AuditLogEntry(record));
          log.debug(
              "Recorded audit entry: action={}, object={}/{}, actor={}",
              record.action().value(),
              record.objectType(),
              record.objectId(),
              record.actorId());
        });
  }

  @Override
  public void logSecurityEvent(SecurityEventRecord record) {
    submit(
        "security " + record.eventType().value(),
        () -> {
          securityLogRepository.save(new SecurityLogEntry(record));
          log.debug(
              "Recorded security event: type={}, severity={}, user={}",
              record.eventType().value(),
              record.severity().value(),
              record.userId());
        });
  }

  private void submit(String description, Runnable write) {
    try {
      auditExecutor.execute(
          () -> {
            try {
              write.run();
            } catch (RuntimeException e) {
              log.warn("Failed to write {}: {}", description, e.getMessage(), e);
            }
          });
    } catch (TaskRejectedException e) {
      log.warn("Audit queue full, dropping {}", description);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditLogEntry> findObjectHistory(String objectType, UUID objectId) {
    return auditLogRepository.findByObjectTypeAndObjectIdOrderByCreatedAtDesc(objectType, objectId);
  }

  @Override
  @Transactional(readOnly = true)
  public Page<SecurityLogEntry> findSecurityEvents(
      UUID workspaceId, SecurityEventType eventType, SecuritySeverity severity, Pageable pageable) {
    return securityLogRepository.findByFilter(
        workspaceId,
        eventType != null ? eventType.value() : null,
        severity != null ? severity.value() : null,
        pageable);
  }
}
