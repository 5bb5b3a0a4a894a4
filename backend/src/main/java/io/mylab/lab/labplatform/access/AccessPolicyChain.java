package io.mylab.lab.labplatform.access;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of {@link AccessPolicy} steps. Evaluation stops at the first deny or conclusive
 * allow. A provisional allow is remembered and returned if no later step overrides it. When no step
 * allows, the request is denied.
 */
public class AccessPolicyChain {

  private static final Logger log = LoggerFactory.getLogger(AccessPolicyChain.class);

  static final String DEFAULT_DENY_REASON = "No policy granted access for this request";

  private final String name;
  private final List<AccessPolicy> policies;

  public AccessPolicyChain(String name, List<AccessPolicy> policies) {
    this.name = name;
    this.policies = List.copyOf(policies);
  }

  public AccessDecision decide(AccessRequest request) {
    PolicyResult provisional = null;
    for (AccessPolicy policy : policies) {
      PolicyResult result = policy.decide(request);
      switch (result.effect()) {
        case DENY -> {
          log.debug("{}: denied by {}: {}", name, policy.name(), result.reason());
          return AccessDecision.from(result);
        }
        case ALLOW -> {
          if (result.conclusive()) {
            log.debug("{}: allowed by {}: {}", name, policy.name(), result.reason());
            return AccessDecision.from(result);
          }
          provisional = result;
        }
        case NOT_APPLICABLE -> {
          // next policy
        }
      }
    }
    if (provisional != null) {
      log.debug("{}: allowed: {}", name, provisional.reason());
      return AccessDecision.from(provisional);
    }
    log.debug("{}: no policy allowed {}", name, request);
    return AccessDecision.deny(DEFAULT_DENY_REASON);
  }

  public String name() {
    return name;
  }

  public List<AccessPolicy> policies() {
    return policies;
  }
}
