package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.grant.AccessGrantService;
import io.mylab.lab.labplatform.override.ResourceAccessService;
import io.mylab.lab.labplatform.permission.RolePermissionMatrix;
import io.mylab.lab.labplatform.resource.OwnershipService;
import io.mylab.lab.labplatform.team.ProjectTeamService;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Precedence of the two policy chains. Order in each list is evaluation order. */
@Configuration
public class AccessPolicyConfig {

  @Bean
  public AccessPolicyChain objectAccessChain(
      OwnershipService ownershipService, AccessGrantService grantService) {
    return new AccessPolicyChain(
        "object-access",
        List.of(new OwnershipStrategy(ownershipService), new DelegatedGrantStrategy(grantService)));
  }

  @Bean
  public AccessPolicyChain projectAccessChain(
      ProjectTeamService teamService,
      RolePermissionMatrix matrix,
      ResourceAccessService resourceAccessService) {
    return new AccessPolicyChain(
        "project-access",
        List.of(
            new RoleMatrixStrategy(teamService, matrix),
            new OverrideStrategy(resourceAccessService)));
  }
}
