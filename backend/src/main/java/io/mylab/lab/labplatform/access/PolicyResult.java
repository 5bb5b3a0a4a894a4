package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.grant.GrantContext;
import io.mylab.lab.labplatform.override.AccessLevel;

/**
 * Verdict of a single {@link AccessPolicy}. An allow is either conclusive, which ends evaluation,
 * or provisional, which stands unless a later policy denies or concludes.
 */
public record PolicyResult(
    Effect effect,
    boolean conclusive,
    String reason,
    AccessLevel accessLevel,
    GrantContext grant) {

  public enum Effect {
    ALLOW,
    DENY,
    NOT_APPLICABLE
  }

  public static PolicyResult allow(String reason) {
    return new PolicyResult(Effect.ALLOW, true, reason, null, null);
  }

  public static PolicyResult allow(String reason, AccessLevel accessLevel) {
    return new PolicyResult(Effect.ALLOW, true, reason, accessLevel, null);
  }

  public static PolicyResult allowViaGrant(String reason, GrantContext grant) {
    return new PolicyResult(Effect.ALLOW, true, reason, null, grant);
  }

  public static PolicyResult provisionalAllow(String reason) {
    return new PolicyResult(Effect.ALLOW, false, reason, null, null);
  }

  public static PolicyResult deny(String reason) {
    return new PolicyResult(Effect.DENY, true, reason, null, null);
  }

  public static PolicyResult notApplicable() {
    return new PolicyResult(Effect.NOT_APPLICABLE, false, null, null, null);
  }
}
