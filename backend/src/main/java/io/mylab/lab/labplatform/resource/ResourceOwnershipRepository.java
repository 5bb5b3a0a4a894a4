package io.mylab.lab.labplatform.resource;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Repository;

/**
 * Reads the owning workspace of a resource row. Lab resource tables are owned by other services and
 * are not mapped as entities here, so the lookup is a native query against the table and owner
 * column declared on {@link ResourceType}.
 */
@Repository
public class ResourceOwnershipRepository {

  @PersistenceContext private EntityManager entityManager;

  /** Returns the owning workspace, or empty when the row does not exist. */
  public Optional<UUID> findOwnerWorkspaceId(ResourceType type, UUID id) {
    // Table and column names come from the enum constant, never from request input
    String sql = "SELECT " + type.ownerColumn() + " FROM " + type.table() + " WHERE id = :id";
    @SuppressWarnings("unchecked")
    List<Object> rows = entityManager.createNativeQuery(sql).setParameter("id", id).getResultList();
    if (rows.isEmpty() || rows.get(0) == null) {
      return Optional.empty();
    }
    return Optional.of(toUuid(rows.get(0)));
  }

  /** Returns the project a project-scoped resource belongs to, or empty when there is none. */
  public Optional<UUID> findProjectId(ResourceType type, UUID id) {
    if (!type.isProjectScoped()) {
      return Optional.empty();
    }
    String sql = "SELECT project_id FROM " + type.table() + " WHERE id = :id";
    @SuppressWarnings("unchecked")
    List<Object> rows = entityManager.createNativeQuery(sql).setParameter("id", id).getResultList();
    if (rows.isEmpty() || rows.get(0) == null) {
      return Optional.empty();
    }
    return Optional.of(toUuid(rows.get(0)));
  }

  private static UUID toUuid(Object value) {
    return value instanceof UUID uuid ? uuid : UUID.fromString(value.toString());
  }
}
