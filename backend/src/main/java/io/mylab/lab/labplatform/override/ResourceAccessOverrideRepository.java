package io.mylab.lab.labplatform.override;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResourceAccessOverrideRepository
    extends JpaRepository<ResourceAccessOverride, UUID> {

  Optional<ResourceAccessOverride> findByResourceTypeAndResourceIdAndUserId(
      String resourceType, UUID resourceId, UUID userId);

  List<ResourceAccessOverride> findByResourceTypeAndResourceIdOrderByGrantedAtAsc(
      String resourceType, UUID resourceId);

  long deleteByResourceTypeAndResourceIdAndUserId(
      String resourceType, UUID resourceId, UUID userId);

  /**
   * Inserts or replaces the override for (type, resource, user) in one statement and returns its
   * id. The id is stable across updates.
   */
  @Query(
      value =
          """
          INSERT INTO resource_access_overrides
              (id, resource_type, resource_id, user_id, workspace_id, access_level, can_share,
               granted_by, granted_at)
          VALUES (gen_random_uuid(), :resourceType, :resourceId, :userId, :workspaceId,
                  :accessLevel, :canShare, CAST(:grantedBy AS uuid), now())
          ON CONFLICT (resource_type, resource_id, user_id) DO UPDATE
             SET access_level = EXCLUDED.access_level,
                 can_share = EXCLUDED.can_share,
                 workspace_id = EXCLUDED.workspace_id,
                 granted_by = EXCLUDED.granted_by,
                 granted_at = EXCLUDED.granted_at
          RETURNING id
          """,
      nativeQuery = true)
  UUID upsert(
      @Param("resourceType") String resourceType,
      @Param("resourceId") UUID resourceId,
      @Param("userId") UUID userId,
      @Param("workspaceId") UUID workspaceId,
      @Param("accessLevel") String accessLevel,
      @Param("canShare") boolean canShare,
      @Param("grantedBy") String grantedBy);
}
