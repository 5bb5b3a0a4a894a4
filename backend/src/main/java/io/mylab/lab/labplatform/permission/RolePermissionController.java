package io.mylab.lab.labplatform.permission;

import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/role-permissions")
public class RolePermissionController {

  private final RolePermissionService rolePermissionService;

  public RolePermissionController(RolePermissionService rolePermissionService) {
    this.rolePermissionService = rolePermissionService;
  }

  @GetMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<List<RolePermissionResponse>> listPermissions() {
    return ResponseEntity.ok(
        rolePermissionService.listPermissions().stream()
            .map(RolePermissionResponse::from)
            .toList());
  }

  @PutMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RolePermissionResponse> setPermission(
      @Valid @RequestBody SetPermissionRequest request) {
    PlatformRole role;
    try {
      role = PlatformRole.fromValue(request.role());
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid role", e.getMessage());
    }
    ResourceType resourceType =
        ResourceType.parse(request.resourceType())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Invalid resource type",
                        "Unknown resource type " + request.resourceType()));
    Action action =
        Action.parse(request.action())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "Invalid action", "Unknown action " + request.action()));

    var saved =
        rolePermissionService.setPermission(
            role, resourceType, action, request.allowed(), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(RolePermissionResponse.from(saved));
  }

  public record SetPermissionRequest(
      @NotBlank String role,
      @NotBlank String resourceType,
      @NotBlank String action,
      @NotNull Boolean allowed) {}

  public record RolePermissionResponse(
      UUID id,
      String role,
      String resourceType,
      String action,
      boolean allowed,
      UUID updatedBy,
      Instant updatedAt) {

    public static RolePermissionResponse from(RolePermission permission) {
      return new RolePermissionResponse(
          permission.getId(),
          permission.getRole(),
          permission.getResourceType(),
          permission.getAction(),
          permission.isAllowed(),
          permission.getUpdatedBy(),
          permission.getUpdatedAt());
    }
  }
}
