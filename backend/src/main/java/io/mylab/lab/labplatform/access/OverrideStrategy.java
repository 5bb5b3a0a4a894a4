package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.override.AccessLevel;
import io.mylab.lab.labplatform.override.ResourceAccessOverride;
import io.mylab.lab.labplatform.override.ResourceAccessService;
import java.util.Optional;

/**
 * Explicit per-user access level on a report or sample. When present it decides view, download and
 * edit on its own. Create, delete and share are left to the role matrix.
 */
public class OverrideStrategy implements AccessPolicy {

  private final ResourceAccessService resourceAccessService;

  public OverrideStrategy(ResourceAccessService resourceAccessService) {
    this.resourceAccessService = resourceAccessService;
  }

  @Override
  public String name() {
    return "override";
  }

  @Override
  public PolicyResult decide(AccessRequest request) {
    if (request.resourceId() == null || !request.resourceType().supportsOverrides()) {
      return PolicyResult.notApplicable();
    }
    Optional<AccessLevel> required = request.action().requiredAccessLevel();
    if (required.isEmpty()) {
      return PolicyResult.notApplicable();
    }
    Optional<ResourceAccessOverride> override =
        resourceAccessService.findOverride(
            request.resourceType(), request.resourceId(), request.userId());
    if (override.isEmpty()) {
      return PolicyResult.notApplicable();
    }

    AccessLevel level = override.get().getAccessLevel();
    if (!level.permits(required.get())) {
      return PolicyResult.deny(
          "User's explicit access level ("
              + level.value()
              + ") does not allow "
              + request.action().value());
    }
    return PolicyResult.allow("User has explicit " + level.value() + " access", level);
  }
}
