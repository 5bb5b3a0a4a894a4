package io.mylab.lab.labplatform.audit;

import io.mylab.lab.labplatform.access.RequireObjectAccess;
import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.RequestScopes;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditLogController {

  private final AuditService auditService;

  public AuditLogController(AuditService auditService) {
    this.auditService = auditService;
  }

  /** Audit history of one object, newest first. */
  @GetMapping("/api/audit-log/{objectType}/{objectId}")
  @PreAuthorize("hasAnyRole('MANAGER', 'ADMIN')")
  @RequireObjectAccess(idParam = "objectId")
  public ResponseEntity<List<AuditLogResponse>> objectHistory(
      @PathVariable String objectType, @PathVariable UUID objectId) {
    String storedType = ResourceType.parse(objectType).map(ResourceType::value).orElse(objectType);
    var entries =
        auditService.findObjectHistory(storedType, objectId).stream()
            .map(AuditLogResponse::from)
            .toList();
    return ResponseEntity.ok(entries);
  }

  /** Security events of the caller's workspace, newest first. */
  @GetMapping("/api/security-log")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Page<SecurityLogResponse>> securityEvents(
      @RequestParam(required = false) String eventType,
      @RequestParam(required = false) String severity,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    SecurityEventType type =
        eventType != null ? parse(eventType, SecurityEventType::fromValue) : null;
    SecuritySeverity level =
        severity != null ? parse(severity, SecuritySeverity::fromValue) : null;

    var events =
        auditService.findSecurityEvents(
            RequestScopes.requirePrincipal().workspaceId(),
            type,
            level,
            PageRequest.of(page, Math.min(size, 200)));
    return ResponseEntity.ok(events.map(SecurityLogResponse::from));
  }

  private static <T> T parse(String value, Function<String, T> parser) {
    try {
      return parser.apply(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid filter", "Unknown filter value " + value);
    }
  }

  // --- DTOs ---

  public record AuditLogResponse(
      UUID id,
      String objectType,
      UUID objectId,
      AuditAction action,
      UUID actorId,
      UUID actorWorkspaceId,
      UUID actorOrgId,
      Map<String, Object> details,
      String ipAddress,
      String userAgent,
      Instant createdAt) {

    public static AuditLogResponse from(AuditLogEntry entry) {
      return new AuditLogResponse(
          entry.getId(),
          entry.getObjectType(),
          entry.getObjectId(),
          entry.getAction(),
          entry.getActorId(),
          entry.getActorWorkspaceId(),
          entry.getActorOrgId(),
          entry.getDetails(),
          entry.getIpAddress(),
          entry.getUserAgent(),
          entry.getCreatedAt());
    }
  }

  public record SecurityLogResponse(
      UUID id,
      SecurityEventType eventType,
      SecuritySeverity severity,
      UUID userId,
      String resourceType,
      UUID resourceId,
      String reason,
      Map<String, Object> details,
      String ipAddress,
      Instant createdAt) {

    public static SecurityLogResponse from(SecurityLogEntry entry) {
      return new SecurityLogResponse(
          entry.getId(),
          entry.getEventType(),
          entry.getSeverity(),
          entry.getUserId(),
          entry.getResourceType(),
          entry.getResourceId(),
          entry.getReason(),
          entry.getDetails(),
          entry.getIpAddress(),
          entry.getCreatedAt());
    }
  }
}
