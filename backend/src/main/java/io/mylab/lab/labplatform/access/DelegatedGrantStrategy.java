package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.grant.AccessGrant;
import io.mylab.lab.labplatform.grant.AccessGrantService;
import io.mylab.lab.labplatform.grant.GrantContext;
import io.mylab.lab.labplatform.security.GrantRole;
import java.util.Optional;

/**
 * Access through an active grant held by the caller's organization, optionally requiring a minimum
 * grant role. Runs after ownership, so reaching it without a grant means denial.
 */
public class DelegatedGrantStrategy implements AccessPolicy {

  static final String NO_GRANT_REASON = "no ownership or access grant found";

  private final AccessGrantService grantService;

  public DelegatedGrantStrategy(AccessGrantService grantService) {
    this.grantService = grantService;
  }

  @Override
  public String name() {
    return "delegated-grant";
  }

  @Override
  public PolicyResult decide(AccessRequest request) {
    Optional<AccessGrant> grant =
        grantService.lookupActive(request.resourceType(), request.resourceId(), request.orgId());
    if (grant.isEmpty()) {
      return PolicyResult.deny(NO_GRANT_REASON);
    }

    GrantRole actual = grant.get().getGrantedRole();
    GrantRole required = request.minimumGrantRole();
    if (!GrantRole.hasSufficientRole(actual, required)) {
      return PolicyResult.deny(
          actual.value() + " role insufficient, " + required.value() + " required");
    }
    return PolicyResult.allowViaGrant(
        "Organization holds a " + actual.value() + " grant", GrantContext.from(grant.get()));
  }
}
