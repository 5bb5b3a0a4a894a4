package io.mylab.lab.labplatform.grant;

import io.mylab.lab.labplatform.security.GrantRole;
import java.util.UUID;

/** Grant that authorized the current request, attached for later re-share enforcement. */
public record GrantContext(UUID grantId, GrantRole grantedRole, boolean canReshare) {

  public static GrantContext from(AccessGrant grant) {
    return new GrantContext(grant.getId(), grant.getGrantedRole(), grant.isCanReshare());
  }
}
