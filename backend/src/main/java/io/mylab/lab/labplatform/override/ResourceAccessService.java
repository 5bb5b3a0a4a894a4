package io.mylab.lab.labplatform.override;

import io.mylab.lab.labplatform.audit.AuditAction;
import io.mylab.lab.labplatform.audit.AuditRecordBuilder;
import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.resource.ResourceType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Per-user overrides on reports and samples. */
@Service
public class ResourceAccessService {

  private static final Logger log = LoggerFactory.getLogger(ResourceAccessService.class);

  private final ResourceAccessOverrideRepository overrideRepository;
  private final AuditService auditService;

  public ResourceAccessService(
      ResourceAccessOverrideRepository overrideRepository, AuditService auditService) {
    this.overrideRepository = overrideRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public Optional<ResourceAccessOverride> findOverride(
      ResourceType resourceType, UUID resourceId, UUID userId) {
    if (!resourceType.supportsOverrides()) {
      return Optional.empty();
    }
    return overrideRepository.findByResourceTypeAndResourceIdAndUserId(
        resourceType.value(), resourceId, userId);
  }

  @Transactional(readOnly = true)
  public List<ResourceAccessOverride> listOverrides(ResourceType resourceType, UUID resourceId) {
    requireOverridable(resourceType);
    return overrideRepository.findByResourceTypeAndResourceIdOrderByGrantedAtAsc(
        resourceType.value(), resourceId);
  }

  /**
   * Grants {@code userId} an explicit access level on the resource, replacing any previous override
   * for the same user. Returns the override id.
   */
  @Transactional
  public UUID grantResourceAccess(
      ResourceType resourceType,
      UUID resourceId,
      UUID userId,
      UUID workspaceId,
      AccessLevel level,
      UUID grantedBy) {
    return grantResourceAccess(
        resourceType, resourceId, userId, workspaceId, level, false, grantedBy);
  }

  @Transactional
  public UUID grantResourceAccess(
      ResourceType resourceType,
      UUID resourceId,
      UUID userId,
      UUID workspaceId,
      AccessLevel level,
      boolean canShare,
      UUID grantedBy) {
    requireOverridable(resourceType);
    UUID overrideId =
        overrideRepository.upsert(
            resourceType.value(),
            resourceId,
            userId,
            workspaceId,
            level.value(),
            canShare,
            grantedBy != null ? grantedBy.toString() : null);
    log.info(
        "Granted {} access on {}/{} to user {} (override={})",
        level.value(),
        resourceType.value(),
        resourceId,
        userId,
        overrideId);

    var details = new HashMap<String, Object>();
    details.put("userId", userId.toString());
    details.put("accessLevel", level.value());
    details.put("canShare", canShare);
    details.put("overrideId", overrideId.toString());
    auditService.log(
        AuditRecordBuilder.builder()
            .objectType(resourceType.value())
            .objectId(resourceId)
            .action(AuditAction.SHARE)
            .details(details)
            .build());
    return overrideId;
  }

  /** Removes the user's override. A missing override is not an error. */
  @Transactional
  public void revokeResourceAccess(ResourceType resourceType, UUID resourceId, UUID userId) {
    requireOverridable(resourceType);
    long removed =
        overrideRepository.deleteByResourceTypeAndResourceIdAndUserId(
            resourceType.value(), resourceId, userId);
    if (removed == 0) {
      log.debug(
          "No override to revoke on {}/{} for user {}", resourceType.value(), resourceId, userId);
      return;
    }
    log.info("Revoked override on {}/{} for user {}", resourceType.value(), resourceId, userId);
    auditService.log(
        AuditRecordBuilder.builder()
            .objectType(resourceType.value())
            .objectId(resourceId)
            .action(AuditAction.DELETE)
            .details(Map.of("userId", userId.toString(), "override", "revoked"))
            .build());
  }

  private static void requireOverridable(ResourceType resourceType) {
    if (!resourceType.supportsOverrides()) {
      throw new InvalidRequestException(
          "Invalid resource type",
          "Access overrides apply only to reports and samples, not " + resourceType.value());
    }
  }
}
