package io.mylab.lab.labplatform.team;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectTeamAssignmentRepository
    extends JpaRepository<ProjectTeamAssignment, UUID> {

  Optional<ProjectTeamAssignment> findByProjectIdAndUserId(UUID projectId, UUID userId);

  boolean existsByProjectIdAndUserId(UUID projectId, UUID userId);

  List<ProjectTeamAssignment> findByProjectIdOrderByAssignedAtAsc(UUID projectId);
}
