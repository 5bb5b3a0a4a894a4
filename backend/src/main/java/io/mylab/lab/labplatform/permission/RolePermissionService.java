package io.mylab.lab.labplatform.permission;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import io.mylab.lab.labplatform.security.Principal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RolePermissionService {

  private static final Logger log = LoggerFactory.getLogger(RolePermissionService.class);

  private final RolePermissionRepository repository;
  private final ApplicationEventPublisher eventPublisher;

  public RolePermissionService(
      RolePermissionRepository repository, ApplicationEventPublisher eventPublisher) {
    this.repository = repository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<RolePermission> listPermissions() {
    return repository.findAllByOrderByRoleAscResourceTypeAscActionAsc();
  }

  /**
   * Writes one matrix cell, inserting it if missing. The in-memory matrix reloads after the
   * transaction commits.
   */
  @Transactional
  public RolePermission setPermission(
      PlatformRole role,
      ResourceType resourceType,
      Action action,
      boolean allowed,
      Principal changedBy) {
    RolePermission permission =
        repository
            .findByRoleAndResourceTypeAndAction(role.value(), resourceType.value(), action.value())
            .map(
                existing -> {
                  existing.update(allowed, changedBy.id());
                  return existing;
                })
            .orElseGet(
                () -> new RolePermission(role, resourceType, action, allowed, changedBy.id()));
    RolePermission saved = repository.save(permission);

    log.info(
        "Role permission set: role={}, resourceType={}, action={}, allowed={}, by={}",
        role.value(),
        resourceType.value(),
        action.value(),
        allowed,
        changedBy.id());
    eventPublisher.publishEvent(
        new RolePermissionsChangedEvent(
            new PermissionKey(role, resourceType, action), allowed, changedBy.id()));
    return saved;
  }
}
