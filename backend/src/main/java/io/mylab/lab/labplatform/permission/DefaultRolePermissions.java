package io.mylab.lab.labplatform.permission;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Seed policy of the role permission matrix. The {@code V3} migration inserts the same rows; this
 * copy backs tests and code paths that run without a database.
 *
 * <ul>
 *   <li>admin: every action
 *   <li>manager: everything except delete
 *   <li>scientist: view, download, create, edit
 *   <li>viewer: view
 * </ul>
 */
public final class DefaultRolePermissions {

  private static final Map<PlatformRole, Set<Action>> ALLOWED_ACTIONS =
      Map.of(
          PlatformRole.ADMIN, EnumSet.allOf(Action.class),
          PlatformRole.MANAGER, EnumSet.complementOf(EnumSet.of(Action.DELETE)),
          PlatformRole.SCIENTIST,
              EnumSet.of(Action.VIEW, Action.DOWNLOAD, Action.CREATE, Action.EDIT),
          PlatformRole.VIEWER, EnumSet.of(Action.VIEW));

  private DefaultRolePermissions() {}

  /** Every (role, type, action) cell, allowed or not. */
  public static Map<PermissionKey, Boolean> seed() {
    var cells = new HashMap<PermissionKey, Boolean>();
    for (PlatformRole role : PlatformRole.values()) {
      for (ResourceType type : ResourceType.values()) {
        for (Action action : Action.values()) {
          cells.put(
              new PermissionKey(role, type, action), ALLOWED_ACTIONS.get(role).contains(action));
        }
      }
    }
    return Map.copyOf(cells);
  }
}
