package io.mylab.lab.labplatform.audit;

import io.mylab.lab.labplatform.security.Principal;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builds a {@link SecurityEventRecord}. Severity follows the event type unless set explicitly; user,
 * organization and workspace come from the bound principal when there is one.
 */
public class SecurityEventBuilder {

  private final SecurityEventType eventType;
  private SecuritySeverity severity;
  private String resourceType;
  private UUID resourceId;
  private String reason;
  private Map<String, Object> details;
  private HttpServletRequest request;

  private SecurityEventBuilder(SecurityEventType eventType) {
    this.eventType = eventType;
  }

  public static SecurityEventBuilder event(SecurityEventType eventType) {
    return new SecurityEventBuilder(eventType);
  }

  public SecurityEventBuilder severity(SecuritySeverity severity) {
    this.severity = severity;
    return this;
  }

  public SecurityEventBuilder resource(String resourceType, UUID resourceId) {
    this.resourceType = resourceType;
    this.resourceId = resourceId;
    return this;
  }

  public SecurityEventBuilder reason(String reason) {
    this.reason = reason;
    return this;
  }

  public SecurityEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /** Request to read IP and user agent from, when not running inside the dispatcher. */
  public SecurityEventBuilder request(HttpServletRequest request) {
    this.request = request;
    return this;
  }

  public SecurityEventRecord build() {
    Principal principal = RequestScopes.getPrincipalOrNull();
    RequestMetadata metadata =
        request != null ? RequestMetadata.of(request) : RequestMetadata.current();

    return new SecurityEventRecord(
        eventType,
        severity != null ? severity : eventType.severity(),
        principal != null ? principal.id() : null,
        principal != null ? principal.orgId() : null,
        principal != null ? principal.workspaceId() : null,
        resourceType,
        resourceId,
        reason,
        details != null ? details : Map.of(),
        metadata.ipAddress(),
        metadata.userAgent(),
        Instant.now());
  }
}
