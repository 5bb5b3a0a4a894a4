package io.mylab.lab.labplatform.grant;

import io.mylab.lab.labplatform.access.ObjectAccessInterceptor;
import io.mylab.lab.labplatform.access.RequireObjectAccess;
import io.mylab.lab.labplatform.access.RequireResharePermission;
import io.mylab.lab.labplatform.audit.AuditAction;
import io.mylab.lab.labplatform.audit.Audited;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Object-scoped view of access: what the caller holds, and re-sharing onwards. */
@RestController
@RequestMapping("/api/objects/{objectType}/{id}")
public class ObjectSharingController {

  private final AccessGrantService grantService;

  public ObjectSharingController(AccessGrantService grantService) {
    this.grantService = grantService;
  }

  @GetMapping("/access")
  @RequireObjectAccess
  @Audited(action = AuditAction.READ)
  public ResponseEntity<ObjectAccessResponse> currentAccess(
      @PathVariable String objectType, @PathVariable UUID id, HttpServletRequest request) {
    GrantContext grant = ObjectAccessInterceptor.currentGrant(request);
    String type = AccessGrantController.parseType(objectType).value();
    if (grant == null) {
      return ResponseEntity.ok(new ObjectAccessResponse(type, id, true, null, null, false));
    }
    return ResponseEntity.ok(
        new ObjectAccessResponse(
            type, id, false, grant.grantId(), grant.grantedRole().value(), grant.canReshare()));
  }

  @PostMapping("/share")
  @RequireObjectAccess
  @RequireResharePermission
  public ResponseEntity<AccessGrantController.GrantResponse> share(
      @PathVariable String objectType,
      @PathVariable UUID id,
      @Valid @RequestBody ShareRequest request) {
    var grant =
        grantService.grant(
            AccessGrantController.parseType(objectType),
            id,
            request.grantedToOrgId(),
            AccessGrantController.parseRole(request.role()),
            request.accessMode() != null ? request.accessMode() : AccessMode.PLATFORM,
            Boolean.TRUE.equals(request.canReshare()),
            request.expiresAt(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.created(URI.create("/api/access-grants/" + grant.getId()))
        .body(AccessGrantController.GrantResponse.from(grant));
  }

  // --- DTOs ---

  public record ShareRequest(
      @NotNull UUID grantedToOrgId,
      @NotBlank String role,
      AccessMode accessMode,
      Boolean canReshare,
      Instant expiresAt) {}

  public record ObjectAccessResponse(
      String objectType,
      UUID objectId,
      boolean owner,
      UUID grantId,
      String grantedRole,
      boolean canReshare) {}
}
