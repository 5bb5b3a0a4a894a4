package io.mylab.lab.labplatform.permission;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * In-memory snapshot of the {@code role_permissions} table. Lookups are lock-free reads of an
 * immutable map; reloads swap the whole map. A cell absent from the snapshot denies.
 */
@Component
public class RolePermissionMatrix {

  private static final Logger log = LoggerFactory.getLogger(RolePermissionMatrix.class);

  private final RolePermissionRepository repository;
  private volatile Map<PermissionKey, Boolean> snapshot = Map.of();

  public RolePermissionMatrix(RolePermissionRepository repository) {
    this.repository = repository;
  }

  public boolean isRoleAllowed(PlatformRole role, ResourceType resourceType, Action action) {
    Boolean allowed = snapshot.get(new PermissionKey(role, resourceType, action));
    if (allowed == null) {
      log.warn(
          "No role permission row for role={}, resourceType={}, action={}; denying",
          role.value(),
          resourceType.value(),
          action.value());
      return false;
    }
    return allowed;
  }

  /** Current snapshot, for the admin listing. */
  public Map<PermissionKey, Boolean> snapshot() {
    return snapshot;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void loadOnStartup() {
    reload();
  }

  @Scheduled(
      fixedDelayString = "${access-control.permission-refresh-interval:PT5M}",
      initialDelayString = "${access-control.permission-refresh-interval:PT5M}")
  public void refresh() {
    try {
      reload();
    } catch (RuntimeException e) {
      // Keep serving the previous snapshot
      log.error("Role permission refresh failed: {}", e.getMessage(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onPermissionsChanged(RolePermissionsChangedEvent event) {
    try {
      reload();
    } catch (RuntimeException e) {
      log.error(
          "Reload after change of {} failed, next scheduled refresh will retry: {}",
          event.key(),
          e.getMessage(),
          e);
    }
  }

  /** Re-reads every row. Rows naming unknown roles, types or actions are skipped. */
  public void reload() {
    var cells = new HashMap<PermissionKey, Boolean>();
    int skipped = 0;
    for (RolePermission row : repository.findAll()) {
      Optional<PermissionKey> key = toKey(row);
      if (key.isPresent()) {
        cells.put(key.get(), row.isAllowed());
      } else {
        skipped++;
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} role permission rows with unknown values", skipped);
    }
    load(cells);
  }

  /** Replaces the snapshot wholesale. */
  public void load(Map<PermissionKey, Boolean> cells) {
    Map<PermissionKey, Boolean> previous = snapshot;
    snapshot = Map.copyOf(cells);
    if (!previous.equals(snapshot)) {
      log.info("Loaded role permission matrix: {} cells", snapshot.size());
    }
  }

  private static Optional<PermissionKey> toKey(RolePermission row) {
    try {
      Optional<ResourceType> type = ResourceType.parse(row.getResourceType());
      Optional<Action> action = Action.parse(row.getAction());
      if (type.isEmpty() || action.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(
          new PermissionKey(PlatformRole.fromValue(row.getRole()), type.get(), action.get()));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
