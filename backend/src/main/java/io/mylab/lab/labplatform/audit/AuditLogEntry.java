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

/**
 * Append-only row of the {@code audit_log} table. Hibernate never issues updates for it and a
 * database trigger rejects UPDATE and DELETE. There are no setters.
 */
@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "object_type", nullable = false, length = 50)
  private String objectType;

  @Column(name = "object_id", nullable = false)
  private UUID objectId;

  @Column(name = "action", nullable = false, length = 20)
  private String action;

  @Column(name = "actor_id")
  private UUID actorId;

  @Column(name = "actor_workspace_id")
  private UUID actorWorkspaceId;

  @Column(name = "actor_org_id")
  private UUID actorOrgId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb")
  private Map<String, Object> details;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AuditLogEntry() {}

  public AuditLogEntry(AuditRecord record) {
    this.objectType = record.objectType();
    this.objectId = record.objectId();
    this.action = record.action().value();
    this.actorId = record.actorId();
    this.actorWorkspaceId = record.actorWorkspaceId();
    this.actorOrgId = record.actorOrgId();
    this.details = record.details();
    this.ipAddress = record.ipAddress();
    this.userAgent = record.userAgent();
    this.createdAt = record.occurredAt();
  }

  public UUID getId() {
    return id;
  }

  public String getObjectType() {
    return objectType;
  }

  public UUID getObjectId() {
    return objectId;
  }

  public AuditAction getAction() {
    return AuditAction.fromValue(action);
  }

  public UUID getActorId() {
    return actorId;
  }

  public UUID getActorWorkspaceId() {
    return actorWorkspaceId;
  }

  public UUID getActorOrgId() {
    return actorOrgId;
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
