package io.mylab.lab.labplatform.audit;

import io.mylab.lab.labplatform.security.Principal;
import io.mylab.lab.labplatform.security.RequestScopes;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builds an {@link AuditRecord}. Actor ids default to the bound {@link Principal}; IP address and
 * user agent default to the current HTTP request.
 *
 * <p>Required fields: {@code objectType}, {@code objectId}, {@code action}.
 *
 * <pre>{@code
 * AuditRecord record = AuditRecordBuilder.builder()
 *     .objectType("sample")
 *     .objectId(sampleId)
 *     .action(AuditAction.SHARE)
 *     .details(Map.of("grantedRole", "processor"))
 *     .build();
 * }</pre>
 */
public class AuditRecordBuilder {

  private String objectType;
  private UUID objectId;
  private AuditAction action;
  private Principal actor;
  private Map<String, Object> details;
  private RequestMetadata metadata;

  private AuditRecordBuilder() {}

  public static AuditRecordBuilder builder() {
    return new AuditRecordBuilder();
  }

  public AuditRecordBuilder objectType(String objectType) {
    this.objectType = objectType;
    return this;
  }

  public AuditRecordBuilder objectId(UUID objectId) {
    this.objectId = objectId;
    return this;
  }

  public AuditRecordBuilder action(AuditAction action) {
    this.action = action;
    return this;
  }

  public AuditRecordBuilder actor(Principal actor) {
    this.actor = actor;
    return this;
  }

  public AuditRecordBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  AuditRecordBuilder metadata(RequestMetadata metadata) {
    this.metadata = metadata;
    return this;
  }

  public AuditRecord build() {
    if (objectType == null || objectId == null || action == null) {
      throw new IllegalStateException("objectType, objectId and action are required");
    }
    Principal resolvedActor = actor != null ? actor : RequestScopes.getPrincipalOrNull();
    RequestMetadata resolvedMetadata = metadata != null ? metadata : RequestMetadata.current();

    return new AuditRecord(
        objectType,
        objectId,
        action,
        resolvedActor != null ? resolvedActor.id() : null,
        resolvedActor != null ? resolvedActor.workspaceId() : null,
        resolvedActor != null ? resolvedActor.orgId() : null,
        details != null ? details : Map.of(),
        resolvedMetadata.ipAddress(),
        resolvedMetadata.userAgent(),
        Instant.now());
  }
}
