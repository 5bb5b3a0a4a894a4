package io.mylab.lab.labplatform.grant;

import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/access-grants")
public class AccessGrantController {

  private final AccessGrantService grantService;

  public AccessGrantController(AccessGrantService grantService) {
    this.grantService = grantService;
  }

  @PostMapping
  public ResponseEntity<GrantResponse> createGrant(@Valid @RequestBody CreateGrantRequest request) {
    var grant =
        grantService.grant(
            parseType(request.objectType()),
            request.objectId(),
            request.grantedToOrgId(),
            parseRole(request.role()),
            request.accessMode() != null ? request.accessMode() : AccessMode.PLATFORM,
            Boolean.TRUE.equals(request.canReshare()),
            request.expiresAt(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.created(URI.create("/api/access-grants/" + grant.getId()))
        .body(GrantResponse.from(grant));
  }

  @GetMapping("/{grantId}")
  public ResponseEntity<GrantResponse> getGrant(@PathVariable UUID grantId) {
    return ResponseEntity.ok(
        GrantResponse.from(grantService.getGrant(grantId, RequestScopes.requirePrincipal())));
  }

  @PostMapping("/{grantId}/revoke")
  public ResponseEntity<GrantResponse> revokeGrant(
      @PathVariable UUID grantId, @RequestBody(required = false) RevokeRequest request) {
    String reason = request != null ? request.reason() : null;
    var grant = grantService.revoke(grantId, reason, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(GrantResponse.from(grant));
  }

  @GetMapping
  public ResponseEntity<List<GrantResponse>> listGrants(
      @RequestParam String objectType, @RequestParam UUID objectId) {
    var grants =
        grantService
            .listGrants(parseType(objectType), objectId, RequestScopes.requirePrincipal())
            .stream()
            .map(GrantResponse::from)
            .toList();
    return ResponseEntity.ok(grants);
  }

  @GetMapping("/revocations")
  public ResponseEntity<List<GrantResponse>> revocationHistory(
      @RequestParam String objectType, @RequestParam UUID objectId) {
    var grants =
        grantService
            .revocationHistory(parseType(objectType), objectId, RequestScopes.requirePrincipal())
            .stream()
            .map(GrantResponse::from)
            .toList();
    return ResponseEntity.ok(grants);
  }

  @DeleteMapping
  public ResponseEntity<GrantResponse> revokeForOrganization(
      @RequestParam String objectType,
      @RequestParam UUID objectId,
      @RequestParam UUID orgId,
      @RequestParam(required = false) String reason) {
    var grant =
        grantService.revokeForOrganization(
            parseType(objectType), objectId, orgId, reason, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(GrantResponse.from(grant));
  }

  static ResourceType parseType(String objectType) {
    return ResourceType.parse(objectType)
        .filter(ResourceType::supportsGrants)
        .orElseThrow(
            () -> new InvalidRequestException("Invalid object type", "Invalid object type"));
  }

  static GrantRole parseRole(String role) {
    try {
      return GrantRole.fromValue(role);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid grant role", e.getMessage());
    }
  }

  // --- DTOs ---

  public record CreateGrantRequest(
      @NotBlank String objectType,
      @NotNull UUID objectId,
      @NotNull UUID grantedToOrgId,
      @NotBlank String role,
      AccessMode accessMode,
      Boolean canReshare,
      Instant expiresAt) {}

  public record RevokeRequest(String reason) {}

  public record GrantResponse(
      UUID id,
      String objectType,
      UUID objectId,
      UUID grantedToOrgId,
      GrantRole grantedRole,
      AccessMode accessMode,
      boolean canReshare,
      Instant expiresAt,
      UUID createdBy,
      UUID createdByOrgId,
      Instant createdAt,
      Instant revokedAt,
      String revocationReason,
      UUID revokedBy,
      String status) {

    public static GrantResponse from(AccessGrant grant) {
      String status;
      if (grant.isRevoked()) {
        status = "revoked";
      } else if (grant.getExpiresAt() != null && !grant.getExpiresAt().isAfter(Instant.now())) {
        status = "expired";
      } else {
        status = "active";
      }
      return new GrantResponse(
          grant.getId(),
          grant.getObjectType().value(),
          grant.getObjectId(),
          grant.getGrantedToOrgId(),
          grant.getGrantedRole(),
          grant.getAccessMode(),
          grant.isCanReshare(),
          grant.getExpiresAt(),
          grant.getCreatedBy(),
          grant.getCreatedByOrgId(),
          grant.getCreatedAt(),
          grant.getRevokedAt(),
          grant.getRevocationReason(),
          grant.getRevokedBy(),
          status);
    }
  }
}
