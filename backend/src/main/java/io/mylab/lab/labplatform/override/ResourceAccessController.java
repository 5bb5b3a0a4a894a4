package io.mylab.lab.labplatform.override;

import io.mylab.lab.labplatform.access.AccessDecision;
import io.mylab.lab.labplatform.access.ProjectAccessService;
import io.mylab.lab.labplatform.exception.ForbiddenException;
import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.exception.ResourceNotFoundException;
import io.mylab.lab.labplatform.permission.Action;
import io.mylab.lab.labplatform.resource.OwnershipService;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.Principal;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-user overrides on a report or sample. Every call requires the caller to be allowed to share
 * the resource in the project.
 */
@RestController
@RequestMapping("/api/projects/{projectId}/{resourceType}/{resourceId}/access")
public class ResourceAccessController {

  private final ResourceAccessService resourceAccessService;
  private final ProjectAccessService projectAccessService;
  private final OwnershipService ownershipService;

  public ResourceAccessController(
      ResourceAccessService resourceAccessService,
      ProjectAccessService projectAccessService,
      OwnershipService ownershipService) {
    this.resourceAccessService = resourceAccessService;
    this.projectAccessService = projectAccessService;
    this.ownershipService = ownershipService;
  }

  @GetMapping
  public ResponseEntity<List<OverrideResponse>> listOverrides(
      @PathVariable UUID projectId,
      @PathVariable String resourceType,
      @PathVariable UUID resourceId) {
    ResourceType type = parseType(resourceType);
    requireShareAccess(projectId, type, resourceId);
    var overrides =
        resourceAccessService.listOverrides(type, resourceId).stream()
            .map(OverrideResponse::from)
            .toList();
    return ResponseEntity.ok(overrides);
  }

  @PutMapping
  public ResponseEntity<GrantOverrideResponse> grantAccess(
      @PathVariable UUID projectId,
      @PathVariable String resourceType,
      @PathVariable UUID resourceId,
      @Valid @RequestBody GrantOverrideRequest request) {
    ResourceType type = parseType(resourceType);
    Principal caller = requireShareAccess(projectId, type, resourceId);
    AccessLevel level;
    try {
      level = AccessLevel.fromValue(request.accessLevel());
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid access level", e.getMessage());
    }

    UUID overrideId =
        resourceAccessService.grantResourceAccess(
            type,
            resourceId,
            request.userId(),
            caller.workspaceId(),
            level,
            Boolean.TRUE.equals(request.canShare()),
            caller.id());
    return ResponseEntity.ok(new GrantOverrideResponse(overrideId));
  }

  @DeleteMapping("/{userId}")
  public ResponseEntity<Void> revokeAccess(
      @PathVariable UUID projectId,
      @PathVariable String resourceType,
      @PathVariable UUID resourceId,
      @PathVariable UUID userId) {
    ResourceType type = parseType(resourceType);
    requireShareAccess(projectId, type, resourceId);
    resourceAccessService.revokeResourceAccess(type, resourceId, userId);
    return ResponseEntity.noContent().build();
  }

  /**
   * Share permission in a project only covers resources recorded under that project. The resource
   * is looked up only after the permission check passes.
   */
  private Principal requireShareAccess(UUID projectId, ResourceType type, UUID resourceId) {
    Principal caller = RequestScopes.requirePrincipal();
    AccessDecision decision =
        projectAccessService.checkAccess(caller.id(), projectId, type, Action.SHARE, resourceId);
    if (!decision.allowed()) {
      throw new ForbiddenException("Access denied", decision.reason(), type.value(), resourceId)
          .securityEventRecorded();
    }
    if (!ownershipService.belongsToProject(type, resourceId, projectId)) {
      throw ResourceNotFoundException.withDetail(
          "Resource not found",
          "No " + type.value() + " " + resourceId + " in project " + projectId);
    }
    return caller;
  }

  private static ResourceType parseType(String resourceType) {
    return ResourceType.parse(resourceType)
        .filter(ResourceType::supportsOverrides)
        .orElseThrow(
            () ->
                new InvalidRequestException(
                    "Invalid resource type",
                    "Access overrides apply only to reports and samples"));
  }

  // --- DTOs ---

  public record GrantOverrideRequest(
      @NotNull UUID userId, @NotBlank String accessLevel, Boolean canShare) {}

  public record GrantOverrideResponse(UUID overrideId) {}

  public record OverrideResponse(
      UUID id,
      UUID userId,
      String accessLevel,
      boolean canShare,
      UUID grantedBy,
      Instant grantedAt) {

    public static OverrideResponse from(ResourceAccessOverride override) {
      return new OverrideResponse(
          override.getId(),
          override.getUserId(),
          override.getAccessLevel().value(),
          override.isCanShare(),
          override.getGrantedBy(),
          override.getGrantedAt());
    }
  }
}
