package io.mylab.lab.labplatform.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Audit and security log facade. Writes are best effort: they never throw and never block the
 * caller on storage.
 */
public interface AuditService {

  /** Queues an audit entry for writing. */
  void log(AuditRecord record);

  /** Queues a security event for writing. */
  void logSecurityEvent(SecurityEventRecord record);

  List<AuditLogEntry> findObjectHistory(String objectType, UUID objectId);

  Page<SecurityLogEntry> findSecurityEvents(
      UUID workspaceId, SecurityEventType eventType, SecuritySeverity severity, Pageable pageable);
}
