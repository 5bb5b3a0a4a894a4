package io.mylab.lab.labplatform.team;

import io.mylab.lab.labplatform.audit.AuditAction;
import io.mylab.lab.labplatform.audit.AuditRecordBuilder;
import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.exception.ForbiddenException;
import io.mylab.lab.labplatform.exception.ResourceConflictException;
import io.mylab.lab.labplatform.exception.ResourceNotFoundException;
import io.mylab.lab.labplatform.resource.OwnershipService;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.security.Principal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectTeamService {

  private static final Logger log = LoggerFactory.getLogger(ProjectTeamService.class);

  static final String NOT_ASSIGNED_REASON = "User is not assigned to this project";
  private static final String AUDIT_OBJECT_TYPE = "project_team_assignment";

  private final ProjectTeamAssignmentRepository assignmentRepository;
  private final OwnershipService ownershipService;
  private final AuditService auditService;

  public ProjectTeamService(
      ProjectTeamAssignmentRepository assignmentRepository,
      OwnershipService ownershipService,
      AuditService auditService) {
    this.assignmentRepository = assignmentRepository;
    this.ownershipService = ownershipService;
    this.auditService = auditService;
  }

  /** The user's role in the project, or empty when not assigned. */
  @Transactional(readOnly = true)
  public Optional<PlatformRole> roleInProject(UUID userId, UUID projectId) {
    return assignmentRepository
        .findByProjectIdAndUserId(projectId, userId)
        .map(ProjectTeamAssignment::getAssignedRole);
  }

  /** Throws 403 unless the user is assigned to the project. Returns the project role. */
  @Transactional(readOnly = true)
  public PlatformRole requireAssignment(UUID userId, UUID projectId) {
    return roleInProject(userId, projectId)
        .orElseThrow(
            () ->
                new ForbiddenException(
                    "Access denied",
                    NOT_ASSIGNED_REASON,
                    ResourceType.PROJECT.value(),
                    projectId));
  }

  @Transactional(readOnly = true)
  public List<ProjectTeamAssignment> listTeam(UUID projectId, Principal caller) {
    requireProjectInWorkspace(projectId, caller);
    if (caller.role() != PlatformRole.ADMIN) {
      requireAssignment(caller.id(), projectId);
    }
    return assignmentRepository.findByProjectIdOrderByAssignedAtAsc(projectId);
  }

  @Transactional
  public ProjectTeamAssignment assign(
      UUID projectId, UUID userId, PlatformRole role, Principal caller) {
    PlatformRole callerRole = requireTeamAdmin(projectId, caller);
    requireWithinCallerRole(role, callerRole, projectId);
    if (assignmentRepository.existsByProjectIdAndUserId(projectId, userId)) {
      throw new ResourceConflictException(
          "User already on project",
          "User " + userId + " is already assigned to project " + projectId);
    }

    ProjectTeamAssignment assignment;
    try {
      assignment =
          assignmentRepository.saveAndFlush(
              new ProjectTeamAssignment(projectId, userId, role, caller.id()));
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "User already on project",
          "User " + userId + " is already assigned to project " + projectId);
    }
    log.info("Assigned user {} to project {} as {}", userId, projectId, role.value());

    audit(assignment, AuditAction.CREATE, role, null, caller);
    return assignment;
  }

  @Transactional
  public ProjectTeamAssignment changeRole(
      UUID projectId, UUID userId, PlatformRole role, Principal caller) {
    PlatformRole callerRole = requireTeamAdmin(projectId, caller);
    if (caller.role() != PlatformRole.ADMIN && caller.id().equals(userId)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "Cannot change your own project role",
          ResourceType.PROJECT.value(),
          projectId);
    }
    requireWithinCallerRole(role, callerRole, projectId);
    var assignment = findAssignment(projectId, userId);
    PlatformRole previous = assignment.getAssignedRole();
    requireWithinCallerRole(previous, callerRole, projectId);
    assignment.changeRole(role, caller.id());
    assignment = assignmentRepository.save(assignment);
    log.info(
        "Changed role of user {} in project {} from {} to {}",
        userId,
        projectId,
        previous.value(),
        role.value());

    audit(assignment, AuditAction.UPDATE, role, previous, caller);
    return assignment;
  }

  @Transactional
  public void remove(UUID projectId, UUID userId, Principal caller) {
    PlatformRole callerRole = requireTeamAdmin(projectId, caller);
    var assignment = findAssignment(projectId, userId);
    requireWithinCallerRole(assignment.getAssignedRole(), callerRole, projectId);
    assignmentRepository.delete(assignment);
    log.info("Removed user {} from project {}", userId, projectId);

    audit(assignment, AuditAction.DELETE, null, assignment.getAssignedRole(), caller);
  }

  /**
   * Team changes need a global admin, or a project role of manager or above. Callers outside the
   * project's workspace get 404. Returns the highest role the caller may hand out or touch.
   */
  PlatformRole requireTeamAdmin(UUID projectId, Principal caller) {
    requireProjectInWorkspace(projectId, caller);
    if (caller.role() == PlatformRole.ADMIN) {
      return PlatformRole.ADMIN;
    }
    PlatformRole projectRole = requireAssignment(caller.id(), projectId);
    if (!projectRole.isAtLeast(PlatformRole.MANAGER)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "Requires manager role or higher in this project",
          ResourceType.PROJECT.value(),
          projectId);
    }
    return projectRole;
  }

  private static void requireWithinCallerRole(
      PlatformRole role, PlatformRole callerRole, UUID projectId) {
    if (!callerRole.isAtLeast(role)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "Cannot manage the " + role.value() + " role as " + callerRole.value(),
          ResourceType.PROJECT.value(),
          projectId);
    }
  }

  private void requireProjectInWorkspace(UUID projectId, Principal caller) {
    if (!ownershipService.isOwner(ResourceType.PROJECT, projectId, caller.workspaceId())) {
      throw new ResourceNotFoundException("Project", projectId);
    }
  }

  private ProjectTeamAssignment findAssignment(UUID projectId, UUID userId) {
    return assignmentRepository
        .findByProjectIdAndUserId(projectId, userId)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Assignment not found",
                    "User " + userId + " is not assigned to project " + projectId));
  }

  private void audit(
      ProjectTeamAssignment assignment,
      AuditAction action,
      PlatformRole role,
      PlatformRole previousRole,
      Principal caller) {
    var details = new HashMap<String, Object>();
    details.put("projectId", assignment.getProjectId().toString());
    details.put("userId", assignment.getUserId().toString());
    if (role != null) {
      details.put("role", role.value());
    }
    if (previousRole != null) {
      details.put("previousRole", previousRole.value());
    }
    auditService.log(
        AuditRecordBuilder.builder()
            .objectType(AUDIT_OBJECT_TYPE)
            .objectId(assignment.getId())
            .action(action)
            .actor(caller)
            .details(Map.copyOf(details))
            .build());
  }
}
