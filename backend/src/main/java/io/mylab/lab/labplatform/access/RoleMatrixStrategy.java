package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.permission.RolePermissionMatrix;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.team.ProjectTeamService;
import java.util.Optional;

/**
 * Project role against the role permission matrix. The project assignment replaces the caller's
 * organization-wide role; without one the request is denied. A matrix allow is provisional so an
 * override can still narrow it.
 */
public class RoleMatrixStrategy implements AccessPolicy {

  private final ProjectTeamService teamService;
  private final RolePermissionMatrix matrix;

  public RoleMatrixStrategy(ProjectTeamService teamService, RolePermissionMatrix matrix) {
    this.teamService = teamService;
    this.matrix = matrix;
  }

  @Override
  public String name() {
    return "role-matrix";
  }

  @Override
  public PolicyResult decide(AccessRequest request) {
    Optional<PlatformRole> role = teamService.roleInProject(request.userId(), request.projectId());
    if (role.isEmpty()) {
      return PolicyResult.deny("User is not assigned to this project");
    }

    String roleName = role.get().value();
    String action = request.action().value();
    String type = request.resourceType().value();
    if (!matrix.isRoleAllowed(role.get(), request.resourceType(), request.action())) {
      return PolicyResult.deny("Role '" + roleName + "' cannot " + action + " " + type);
    }
    return PolicyResult.provisionalAllow(
        "Role '" + roleName + "' allows " + action + " on " + type);
  }
}
