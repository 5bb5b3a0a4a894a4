package io.mylab.lab.labplatform.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.repository.Repository;

/** Insert-and-read repository. No update or delete methods are exposed for audit rows. */
public interface AuditLogRepository extends Repository<AuditLogEntry, UUID> {

  AuditLogEntry save(AuditLogEntry entry);

  Optional<AuditLogEntry> findById(UUID id);

  List<AuditLogEntry> findByObjectTypeAndObjectIdOrderByCreatedAtDesc(
      String objectType, UUID objectId);

  long count();
}
