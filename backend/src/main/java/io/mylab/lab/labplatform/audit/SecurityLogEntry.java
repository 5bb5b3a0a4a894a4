package io.mylab.lab.labplatform.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Append-only row of the {@code security_log} table, stored like {@link AuditLogEntry}. */
@Entity
@Immutable
@Table(name = "security_log")
public class SecurityLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_type", nullable = false, length = 50)
  private String eventType;

  @Column(name = "severity", nullable = false, length = 20)
  private String severity;

  @Column(name = "user_id")
  private UUID userId;

  @Column(name = "organization_id")
  private UUID organizationId;

  @Column(name = "workspace_id")
  private UUID workspaceId;

  @Column(name = "resource_type", length = 50)
  private String resourceType;

  @Column(name = "resource_id")
  private UUID resourceId;

  @Column(name = "reason", length = 500)
  private String reason;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb")
  private Map<String, Object> details;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SecurityLogEntry() {}

  public SecurityLogEntry(SecurityEventRecord record) {
    this.eventType = record.eventType().value();
    this.severity = record.severity().value();
    this.userId = record.userId();
    this.organizationId = record.organizationId();
    this.workspaceId = record.workspaceId();
    this.resourceType = record.resourceType();
    this.resourceId = record.resourceId();
    this.reason = truncate(record.reason());
    this.details = record.details();
    this.ipAddress = record.ipAddress();
    this.userAgent = record.userAgent();
    this.createdAt = record.occurredAt();
  }

  private static String truncate(String reason) {
    return reason != null && reason.length() > 500 ? reason.substring(0, 500) : reason;
  }

  public UUID getId() {
    return id;
  }

  public SecurityEventType getEventType() {
    return SecurityEventType.fromValue(eventType);
  }

  public SecuritySeverity getSeverity() {
    return SecuritySeverity.fromValue(severity);
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public String getReason() {
    return reason;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
