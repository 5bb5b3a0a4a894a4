package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.permission.Action;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Lets a client ask what the current user may do before attempting it. */
@RestController
public class AccessCheckController {

  private final ProjectAccessService projectAccessService;

  public AccessCheckController(ProjectAccessService projectAccessService) {
    this.projectAccessService = projectAccessService;
  }

  @PostMapping("/api/access/check")
  public ResponseEntity<AccessDecision> check(@Valid @RequestBody AccessCheckRequest request) {
    ResourceType type =
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

    var decision =
        projectAccessService.checkAccess(
            RequestScopes.requirePrincipal().id(),
            request.projectId(),
            type,
            action,
            request.resourceId());
    return ResponseEntity.ok(decision);
  }

  public record AccessCheckRequest(
      @NotNull UUID projectId,
      @NotBlank String resourceType,
      @NotBlank String action,
      UUID resourceId) {}
}
