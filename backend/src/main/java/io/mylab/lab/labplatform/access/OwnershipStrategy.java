package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.resource.OwnershipService;

/** The owning workspace may do anything with its resource. Not applicable otherwise. */
public class OwnershipStrategy implements AccessPolicy {

  private final OwnershipService ownershipService;

  public OwnershipStrategy(OwnershipService ownershipService) {
    this.ownershipService = ownershipService;
  }

  @Override
  public String name() {
    return "ownership";
  }

  @Override
  public PolicyResult decide(AccessRequest request) {
    if (ownershipService.isOwner(
        request.resourceType(), request.resourceId(), request.workspaceId())) {
      return PolicyResult.allow("Caller's workspace owns this " + request.resourceType().value());
    }
    return PolicyResult.notApplicable();
  }
}
