package io.mylab.lab.labplatform.grant;

import io.mylab.lab.labplatform.audit.AuditAction;
import io.mylab.lab.labplatform.audit.AuditRecordBuilder;
import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.config.AccessControlProperties;
import io.mylab.lab.labplatform.exception.ForbiddenException;
import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.exception.ResourceConflictException;
import io.mylab.lab.labplatform.exception.ResourceNotFoundException;
import io.mylab.lab.labplatform.resource.OwnershipService;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.security.Principal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grant store: creation with re-share gating, idempotent revocation and the active-grant lookup
 * used by the ownership/grant policy.
 */
@Service
public class AccessGrantService {

  private static final Logger log = LoggerFactory.getLogger(AccessGrantService.class);

  static final String DEFAULT_REVOCATION_REASON = "User revoked access";
  static final String SUPERSEDED_REASON = "superseded after expiry";
  static final String GRANT_OBJECT_TYPE = "access_grant";

  private final AccessGrantRepository grantRepository;
  private final OwnershipService ownershipService;
  private final AuditService auditService;
  private final AccessControlProperties properties;

  public AccessGrantService(
      AccessGrantRepository grantRepository,
      OwnershipService ownershipService,
      AuditService auditService,
      AccessControlProperties properties) {
    this.grantRepository = grantRepository;
    this.ownershipService = ownershipService;
    this.auditService = auditService;
    this.properties = properties;
  }

  /**
   * The single active grant held by {@code orgId} on the object, if any. Grants expiring within the
   * configured buffer are already treated as expired.
   */
  @Transactional(readOnly = true)
  public Optional<AccessGrant> lookupActive(ResourceType objectType, UUID objectId, UUID orgId) {
    if (orgId == null) {
      return Optional.empty();
    }
    Instant cutoff = Instant.now().plus(properties.grantExpiryBuffer());
    return grantRepository.findActive(objectType.value(), objectId, orgId, cutoff);
  }

  /**
   * Grants {@code grantedToOrgId} access to the object. The issuer must own the object or hold an
   * active re-share-enabled grant on it. Fails with 409 while an active grant for the same
   * organization exists; an expired, unrevoked row is revoked first so the new one can take its
   * place.
   */
  @Transactional
  public AccessGrant grant(
      ResourceType objectType,
      UUID objectId,
      UUID grantedToOrgId,
      GrantRole role,
      AccessMode accessMode,
      boolean canReshare,
      Instant expiresAt,
      Principal issuer) {
    requireGrantable(objectType);
    if (expiresAt != null && !expiresAt.isAfter(Instant.now())) {
      throw new InvalidRequestException("Invalid expiry", "expiresAt must be in the future");
    }
    if (grantedToOrgId.equals(issuer.orgId())) {
      throw new InvalidRequestException(
          "Invalid recipient", "Cannot grant access to your own organization");
    }
    requireIssuerMayShare(objectType, objectId, issuer);

    Instant now = Instant.now();
    var existing =
        grantRepository.findByObjectTypeAndObjectIdAndGrantedToOrgIdAndRevokedAtIsNull(
            objectType.value(), objectId, grantedToOrgId);
    if (existing.isPresent()) {
      AccessGrant current = existing.get();
      if (current.isActive(now, properties.grantExpiryBuffer())) {
        throw new ResourceConflictException(
            "Grant already exists",
            "An active grant for this organization already exists on this "
                + objectType.value());
      }
      current.revoke(now, SUPERSEDED_REASON, issuer.id());
      grantRepository.saveAndFlush(current);
      log.info(
          "Superseded expired grant {} on {}/{} for org {}",
          current.getId(),
          objectType.value(),
          objectId,
          grantedToOrgId);
    }

    AccessGrant saved;
    try {
      saved =
          grantRepository.saveAndFlush(
              new AccessGrant(
                  objectType,
                  objectId,
                  grantedToOrgId,
                  role,
                  accessMode,
                  canReshare,
                  expiresAt,
                  issuer.id(),
                  issuer.orgId()));
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Grant already exists",
          "An active grant for this organization already exists on this " + objectType.value());
    }

    log.info(
        "Granted {} access on {}/{} to org {} (grant={}, reshare={}, expiresAt={})",
        role.value(),
        objectType.value(),
        objectId,
        grantedToOrgId,
        saved.getId(),
        canReshare,
        expiresAt);

    var details = new HashMap<String, Object>();
    details.put("grantId", saved.getId().toString());
    details.put("grantedToOrgId", grantedToOrgId.toString());
    details.put("grantedRole", role.value());
    details.put("accessMode", accessMode.name());
    details.put("canReshare", canReshare);
    if (expiresAt != null) {
      details.put("expiresAt", expiresAt.toString());
    }
    auditService.log(
        AuditRecordBuilder.builder()
            .objectType(objectType.value())
            .objectId(objectId)
            .action(AuditAction.SHARE)
            .actor(issuer)
            .details(details)
            .build());
    return saved;
  }

  /**
   * Revokes a grant. Revoking an already revoked grant succeeds without changes and keeps the
   * original revocation.
   */
  @Transactional
  public AccessGrant revoke(UUID grantId, String reason, UUID revokedBy) {
    AccessGrant grant =
        grantRepository
            .findById(grantId)
            .orElseThrow(() -> new ResourceNotFoundException("AccessGrant", grantId));
    return revokeGrant(grant, reason, revokedBy, null);
  }

  /**
   * Revokes a grant on behalf of the caller, who must be its issuer, an admin of the issuing
   * organization, or a member of the owning workspace.
   */
  @Transactional
  public AccessGrant revoke(UUID grantId, String reason, Principal caller) {
    AccessGrant grant =
        grantRepository
            .findById(grantId)
            .orElseThrow(() -> new ResourceNotFoundException("AccessGrant", grantId));
    boolean issuer = grant.getCreatedBy().equals(caller.id());
    boolean issuingOrgAdmin =
        caller.role() == PlatformRole.ADMIN && grant.getCreatedByOrgId().equals(caller.orgId());
    if (!issuer
        && !issuingOrgAdmin
        && !ownershipService.isOwner(
            grant.getObjectType(), grant.getObjectId(), caller.workspaceId())) {
      throw new ForbiddenException(
          "Cannot revoke grant", "Permission denied: Cannot revoke this grant");
    }
    return revokeGrant(grant, reason, caller.id(), caller);
  }

  /** Revokes the unrevoked grant held by {@code orgId} on an object the caller owns. */
  @Transactional
  public AccessGrant revokeForOrganization(
      ResourceType objectType, UUID objectId, UUID orgId, String reason, Principal caller) {
    requireOwner(objectType, objectId, caller);
    AccessGrant grant =
        grantRepository
            .findByObjectTypeAndObjectIdAndGrantedToOrgIdAndRevokedAtIsNull(
                objectType.value(), objectId, orgId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "AccessGrant not found",
                        "No unrevoked grant for organization " + orgId + " on this object"));
    return revokeGrant(grant, reason, caller.id(), caller);
  }

  /** A grant visible to the caller's organization as recipient or issuer. */
  @Transactional(readOnly = true)
  public AccessGrant getGrant(UUID grantId, Principal caller) {
    return grantRepository
        .findById(grantId)
        .filter(
            g ->
                g.getGrantedToOrgId().equals(caller.orgId())
                    || g.getCreatedByOrgId().equals(caller.orgId()))
        .orElseThrow(() -> new ResourceNotFoundException("AccessGrant", grantId));
  }

  @Transactional(readOnly = true)
  public List<AccessGrant> listGrants(ResourceType objectType, UUID objectId, Principal caller) {
    requireOwner(objectType, objectId, caller);
    return grantRepository.findByObjectTypeAndObjectIdOrderByCreatedAtDesc(
        objectType.value(), objectId);
  }

  @Transactional(readOnly = true)
  public List<AccessGrant> revocationHistory(
      ResourceType objectType, UUID objectId, Principal caller) {
    requireOwner(objectType, objectId, caller);
    return grantRepository.findByObjectTypeAndObjectIdAndRevokedAtIsNotNullOrderByRevokedAtDesc(
        objectType.value(), objectId);
  }

  private AccessGrant revokeGrant(
      AccessGrant grant, String reason, UUID revokedBy, Principal actor) {
    if (grant.isRevoked()) {
      log.debug("Grant {} already revoked at {}", grant.getId(), grant.getRevokedAt());
      return grant;
    }
    String effectiveReason =
        reason == null || reason.isBlank() ? DEFAULT_REVOCATION_REASON : reason;
    grant.revoke(Instant.now(), effectiveReason, revokedBy);
    AccessGrant saved = grantRepository.save(grant);

    log.info(
        "Revoked grant {} on {}/{} for org {}: {}",
        grant.getId(),
        grant.getObjectType().value(),
        grant.getObjectId(),
        grant.getGrantedToOrgId(),
        effectiveReason);

    var details = new HashMap<String, Object>();
    details.put("objectType", grant.getObjectType().value());
    details.put("objectId", grant.getObjectId().toString());
    details.put("grantedToOrgId", grant.getGrantedToOrgId().toString());
    details.put("grantedRole", grant.getGrantedRole().value());
    details.put(
        "originalExpiresAt", grant.getExpiresAt() != null ? grant.getExpiresAt().toString() : null);
    details.put("revocationReason", effectiveReason);
    var builder =
        AuditRecordBuilder.builder()
            .objectType(GRANT_OBJECT_TYPE)
            .objectId(grant.getId())
            .action(AuditAction.DELETE)
            .details(details);
    if (actor != null) {
      builder.actor(actor);
    }
    auditService.log(builder.build());
    return saved;
  }

  private void requireGrantable(ResourceType objectType) {
    if (!objectType.supportsGrants()) {
      throw new InvalidRequestException(
          "Invalid object type", objectType.value() + " cannot be shared through access grants");
    }
  }

  private void requireIssuerMayShare(ResourceType objectType, UUID objectId, Principal issuer) {
    if (ownershipService.isOwner(objectType, objectId, issuer.workspaceId())) {
      return;
    }
    boolean reshareGrant =
        lookupActive(objectType, objectId, issuer.orgId())
            .map(AccessGrant::isCanReshare)
            .orElse(false);
    if (!reshareGrant) {
      throw new ForbiddenException(
          "Access denied",
          "Access denied: re-sharing not permitted",
          objectType.value(),
          objectId);
    }
  }

  private void requireOwner(ResourceType objectType, UUID objectId, Principal caller) {
    if (!ownershipService.isOwner(objectType, objectId, caller.workspaceId())) {
      throw new ForbiddenException(
          "Access denied",
          "Access denied: workspace ownership required",
          objectType.value(),
          objectId);
    }
  }
}
