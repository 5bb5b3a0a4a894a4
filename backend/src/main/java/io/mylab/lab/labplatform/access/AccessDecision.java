package io.mylab.lab.labplatform.access;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.mylab.lab.labplatform.grant.GrantContext;
import io.mylab.lab.labplatform.override.AccessLevel;

/**
 * Outcome of a policy chain. A denial is a normal result, not an exception, and always carries a
 * short reason.
 *
 * @param accessLevel override level that decided the request, if any
 * @param grant grant that authorized an object request, if access came through one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessDecision(
    boolean allowed, String reason, AccessLevel accessLevel, @JsonIgnore GrantContext grant) {

  public static AccessDecision deny(String reason) {
    return new AccessDecision(false, reason, null, null);
  }

  static AccessDecision from(PolicyResult result) {
    return new AccessDecision(
        result.effect() == PolicyResult.Effect.ALLOW,
        result.reason(),
        result.accessLevel(),
        result.grant());
  }
}
