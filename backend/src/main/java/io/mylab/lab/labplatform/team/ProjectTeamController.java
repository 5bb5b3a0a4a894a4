package io.mylab.lab.labplatform.team;

import io.mylab.lab.labplatform.exception.InvalidRequestException;
import io.mylab.lab.labplatform.security.PlatformRole;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}/team")
public class ProjectTeamController {

  private final ProjectTeamService projectTeamService;

  public ProjectTeamController(ProjectTeamService projectTeamService) {
    this.projectTeamService = projectTeamService;
  }

  @GetMapping
  public ResponseEntity<List<AssignmentResponse>> listTeam(@PathVariable UUID projectId) {
    var team =
        projectTeamService.listTeam(projectId, RequestScopes.requirePrincipal()).stream()
            .map(AssignmentResponse::from)
            .toList();
    return ResponseEntity.ok(team);
  }

  @PostMapping
  public ResponseEntity<AssignmentResponse> assign(
      @PathVariable UUID projectId, @Valid @RequestBody AssignRequest request) {
    var assignment =
        projectTeamService.assign(
            projectId,
            request.userId(),
            parseRole(request.role()),
            RequestScopes.requirePrincipal());
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/team/" + assignment.getUserId()))
        .body(AssignmentResponse.from(assignment));
  }

  @PutMapping("/{userId}")
  public ResponseEntity<AssignmentResponse> changeRole(
      @PathVariable UUID projectId,
      @PathVariable UUID userId,
      @Valid @RequestBody ChangeRoleRequest request) {
    var assignment =
        projectTeamService.changeRole(
            projectId, userId, parseRole(request.role()), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(AssignmentResponse.from(assignment));
  }

  @DeleteMapping("/{userId}")
  public ResponseEntity<Void> remove(@PathVariable UUID projectId, @PathVariable UUID userId) {
    projectTeamService.remove(projectId, userId, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  private static PlatformRole parseRole(String role) {
    try {
      return PlatformRole.fromValue(role);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Invalid role", e.getMessage());
    }
  }

  // --- DTOs ---

  public record AssignRequest(@NotNull UUID userId, @NotBlank String role) {}

  public record ChangeRoleRequest(@NotBlank String role) {}

  public record AssignmentResponse(
      UUID id, UUID projectId, UUID userId, String role, UUID assignedBy, Instant assignedAt) {

    public static AssignmentResponse from(ProjectTeamAssignment assignment) {
      return new AssignmentResponse(
          assignment.getId(),
          assignment.getProjectId(),
          assignment.getUserId(),
          assignment.getAssignedRole().value(),
          assignment.getAssignedBy(),
          assignment.getAssignedAt());
    }
  }
}
