package io.mylab.lab.labplatform.permission;

import java.util.UUID;

/** Published after a matrix cell is written; the snapshot reloads once the write commits. */
public record RolePermissionsChangedEvent(PermissionKey key, boolean allowed, UUID changedBy) {}
