package io.mylab.lab.labplatform.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Value object carrying everything needed to write one {@link AuditLogEntry}. Built on the request
 * thread by {@link AuditRecordBuilder}, before the write is handed to the background writer.
 *
 * @param occurredAt event time, stored as the entry's {@code created_at}
 */
public record AuditRecord(
    String objectType,
    UUID objectId,
    AuditAction action,
    UUID actorId,
    UUID actorWorkspaceId,
    UUID actorOrgId,
    Map<String, Object> details,
    String ipAddress,
    String userAgent,
    Instant occurredAt) {}
