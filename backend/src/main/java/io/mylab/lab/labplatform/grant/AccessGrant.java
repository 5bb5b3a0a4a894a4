package io.mylab.lab.labplatform.grant;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Delegated access to one object for another organization. Rows are never deleted: revocation sets
 * {@code revokedAt}, which wins over any expiry.
 */
@Entity
@Table(name = "access_grants")
public class AccessGrant {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "object_type", nullable = false, length = 50)
  private String objectType;

  @Column(name = "object_id", nullable = false)
  private UUID objectId;

  @Column(name = "granted_to_org_id", nullable = false)
  private UUID grantedToOrgId;

  @Column(name = "granted_role", nullable = false, length = 20)
  private String grantedRole;

  @Enumerated(EnumType.STRING)
  @Column(name = "access_mode", nullable = false, length = 20)
  private AccessMode accessMode;

  @Column(name = "can_reshare", nullable = false)
  private boolean canReshare;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "created_by_org_id", nullable = false)
  private UUID createdByOrgId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "revoked_at")
  private Instant revokedAt;

  @Column(name = "revocation_reason", length = 500)
  private String revocationReason;

  @Column(name = "revoked_by")
  private UUID revokedBy;

  protected AccessGrant() {}

  public AccessGrant(
      ResourceType objectType,
      UUID objectId,
      UUID grantedToOrgId,
      GrantRole grantedRole,
      AccessMode accessMode,
      boolean canReshare,
      Instant expiresAt,
      UUID createdBy,
      UUID createdByOrgId) {
    this.objectType = objectType.value();
    this.objectId = objectId;
    this.grantedToOrgId = grantedToOrgId;
    this.grantedRole = grantedRole.value();
    this.accessMode = accessMode;
    this.canReshare = canReshare;
    this.expiresAt = expiresAt;
    this.createdBy = createdBy;
    this.createdByOrgId = createdByOrgId;
    this.createdAt = Instant.now();
  }

  /**
   * Active iff not revoked and not expiring within {@code expiryBuffer} of {@code now}. A revoked
   * grant is inactive even if its expiry lies in the future.
   */
  public boolean isActive(Instant now, Duration expiryBuffer) {
    if (revokedAt != null) {
      return false;
    }
    return expiresAt == null || expiresAt.isAfter(now.plus(expiryBuffer));
  }

  public boolean isRevoked() {
    return revokedAt != null;
  }

  /** Marks the grant revoked. A no-op if it already is; the first revocation is kept. */
  public void revoke(Instant at, String reason, UUID by) {
    if (revokedAt != null) {
      return;
    }
    this.revokedAt = at;
    this.revocationReason = reason;
    this.revokedBy = by;
  }

  public UUID getId() {
    return id;
  }

  public ResourceType getObjectType() {
    return ResourceType.parse(objectType)
        .orElseThrow(() -> new IllegalStateException("Unknown object type " + objectType));
  }

  public UUID getObjectId() {
    return objectId;
  }

  public UUID getGrantedToOrgId() {
    return grantedToOrgId;
  }

  public GrantRole getGrantedRole() {
    return GrantRole.fromValue(grantedRole);
  }

  public AccessMode getAccessMode() {
    return accessMode;
  }

  public boolean isCanReshare() {
    return canReshare;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public UUID getCreatedByOrgId() {
    return createdByOrgId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }

  public String getRevocationReason() {
    return revocationReason;
  }

  public UUID getRevokedBy() {
    return revokedBy;
  }
}
