package io.mylab.lab.labplatform.override;

import io.mylab.lab.labplatform.resource.ResourceType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Per-user access level on a single report or sample. Written through a native upsert. */
@Entity
@Table(name = "resource_access_overrides")
public class ResourceAccessOverride {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "resource_type", nullable = false, length = 20)
  private String resourceType;

  @Column(name = "resource_id", nullable = false)
  private UUID resourceId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "workspace_id", nullable = false)
  private UUID workspaceId;

  @Column(name = "access_level", nullable = false, length = 20)
  private String accessLevel;

  @Column(name = "can_share", nullable = false)
  private boolean canShare;

  @Column(name = "granted_by")
  private UUID grantedBy;

  @Column(name = "granted_at", nullable = false)
  private Instant grantedAt;

  protected ResourceAccessOverride() {}

  public ResourceAccessOverride(
      ResourceType resourceType,
      UUID resourceId,
      UUID userId,
      UUID workspaceId,
      AccessLevel accessLevel,
      boolean canShare,
      UUID grantedBy) {
    this.resourceType = resourceType.value();
    this.resourceId = resourceId;
    this.userId = userId;
    this.workspaceId = workspaceId;
    this.accessLevel = accessLevel.value();
    this.canShare = canShare;
    this.grantedBy = grantedBy;
    this.grantedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public ResourceType getResourceType() {
    return ResourceType.parse(resourceType)
        .orElseThrow(() -> new IllegalStateException("Unknown resource type " + resourceType));
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getWorkspaceId() {
    return workspaceId;
  }

  public AccessLevel getAccessLevel() {
    return AccessLevel.fromValue(accessLevel);
  }

  public boolean isCanShare() {
    return canShare;
  }

  public UUID getGrantedBy() {
    return grantedBy;
  }

  public Instant getGrantedAt() {
    return grantedAt;
  }
}
