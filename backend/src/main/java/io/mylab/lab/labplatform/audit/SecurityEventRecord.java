package io.mylab.lab.labplatform.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Value object for one {@link SecurityLogEntry}. See {@link SecurityEventBuilder}. */
public record SecurityEventRecord(
    SecurityEventType eventType,
    SecuritySeverity severity,
    UUID userId,
    UUID organizationId,
    UUID workspaceId,
    String resourceType,
    UUID resourceId,
    String reason,
    Map<String, Object> details,
    String ipAddress,
    String userAgent,
    Instant occurredAt) {}
