package io.mylab.lab.labplatform.team;

import io.mylab.lab.labplatform.security.PlatformRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A user's role inside one project. Replaces, never combines with, the organization-wide role. */
@Entity
@Table(name = "project_team_assignments")
public class ProjectTeamAssignment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "assigned_role", nullable = false, length = 20)
  private String assignedRole;

  @Column(name = "assigned_by")
  private UUID assignedBy;

  @Column(name = "assigned_at", nullable = false)
  private Instant assignedAt;

  protected ProjectTeamAssignment() {}

  public ProjectTeamAssignment(
      UUID projectId, UUID userId, PlatformRole assignedRole, UUID assignedBy) {
    this.projectId = projectId;
    this.userId = userId;
    this.assignedRole = assignedRole.value();
    this.assignedBy = assignedBy;
    this.assignedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getUserId() {
    return userId;
  }

  public PlatformRole getAssignedRole() {
    return PlatformRole.fromValue(assignedRole);
  }

  public void changeRole(PlatformRole role, UUID changedBy) {
    this.assignedRole = role.value();
    this.assignedBy = changedBy;
    this.assignedAt = Instant.now();
  }

  public UUID getAssignedBy() {
    return assignedBy;
  }

  public Instant getAssignedAt() {
    return assignedAt;
  }
}
