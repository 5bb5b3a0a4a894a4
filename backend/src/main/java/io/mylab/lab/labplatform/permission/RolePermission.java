package io.mylab.lab.labplatform.permission;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One cell of the role permission matrix. A missing cell denies. */
@Entity
@Table(name = "role_permissions")
public class RolePermission {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "resource_type", nullable = false, length = 50)
  private String resourceType;

  @Column(name = "action", nullable = false, length = 20)
  private String action;

  @Column(name = "allowed", nullable = false)
  private boolean allowed;

  @Column(name = "updated_by")
  private UUID updatedBy;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected RolePermission() {}

  public RolePermission(
      PlatformRole role,
      ResourceType resourceType,
      Action action,
      boolean allowed,
      UUID updatedBy) {
    this.role = role.value();
    this.resourceType = resourceType.value();
    this.action = action.value();
    this.allowed = allowed;
    this.updatedBy = updatedBy;
    this.updatedAt = Instant.now();
  }

  public void update(boolean allowed, UUID updatedBy) {
    this.allowed = allowed;
    this.updatedBy = updatedBy;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getRole() {
    return role;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getAction() {
    return action;
  }

  public boolean isAllowed() {
    return allowed;
  }

  public UUID getUpdatedBy() {
    return updatedBy;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
