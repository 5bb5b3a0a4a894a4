package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.permission.Action;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.Principal;
import java.util.UUID;

/**
 * Input of one access decision. Object requests carry the caller's workspace and organization;
 * project requests carry the project and action. Fields a strategy does not need may be null.
 */
public record AccessRequest(
    UUID userId,
    UUID workspaceId,
    UUID orgId,
    UUID projectId,
    ResourceType resourceType,
    UUID resourceId,
    Action action,
    GrantRole minimumGrantRole) {

  public static AccessRequest forObject(
      Principal principal, ResourceType type, UUID objectId, GrantRole minimumGrantRole) {
    return new AccessRequest(
        principal.id(),
        principal.workspaceId(),
        principal.orgId(),
        null,
        type,
        objectId,
        null,
        minimumGrantRole);
  }

  public static AccessRequest forProject(
      UUID userId, UUID projectId, ResourceType type, Action action, UUID resourceId) {
    return new AccessRequest(userId, null, null, projectId, type, resourceId, action, null);
  }
}
