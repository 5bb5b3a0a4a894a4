package io.mylab.lab.labplatform.audit;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/** Insert-and-read repository for security events. */
public interface SecurityLogRepository extends Repository<SecurityLogEntry, UUID> {

  SecurityLogEntry save(SecurityLogEntry entry);

  Optional<SecurityLogEntry> findById(UUID id);

  long count();

  /** Nullable filters: {@code (:param IS NULL OR e.field = :param)}. Newest first. */
  @Query(
      """
      SELECT e FROM SecurityLogEntry e
      WHERE e.workspaceId = :workspaceId
        AND (CAST(:eventType AS string) IS NULL OR e.eventType = :eventType)
        AND (CAST(:severity AS string) IS NULL OR e.severity = :severity)
      ORDER BY e.createdAt DESC
      """)
  Page<SecurityLogEntry> findByFilter(
      @Param("workspaceId") UUID workspaceId,
      @Param("eventType") String eventType,
      @Param("severity") String severity,
      Pageable pageable);
}
