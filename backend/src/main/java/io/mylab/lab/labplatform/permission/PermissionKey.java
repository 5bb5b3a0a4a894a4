package io.mylab.lab.labplatform.permission;

import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.PlatformRole;

/** Coordinates of one role permission matrix cell. */
public record PermissionKey(PlatformRole role, ResourceType resourceType, Action action) {}
