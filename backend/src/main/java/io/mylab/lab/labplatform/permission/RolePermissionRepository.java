package io.mylab.lab.labplatform.permission;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

  Optional<RolePermission> findByRoleAndResourceTypeAndAction(
      String role, String resourceType, String action);

  List<RolePermission> findAllByOrderByRoleAscResourceTypeAscActionAsc();
}
