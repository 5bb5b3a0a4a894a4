package io.mylab.lab.labplatform.access;

import static org.assertj.core.api.Assertions.assertThat;

import io.mylab.lab.labplatform.override.AccessLevel;
import io.mylab.lab.labplatform.permission.Action;
import io.mylab.lab.labplatform.resource.ResourceType;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AccessPolicyChainTest {

  private static final AccessRequest REQUEST =
      AccessRequest.forProject(
          UUID.randomUUID(), UUID.randomUUID(), ResourceType.REPORT, Action.VIEW, null);

  private final List<String> evaluated = new ArrayList<>();

  @Test
  void deniesByDefaultWhenNoPolicyApplies() {
    var chain = new AccessPolicyChain("test", List.of(policy("a", PolicyResult.notApplicable())));

    var decision = chain.decide(REQUEST);

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo(AccessPolicyChain.DEFAULT_DENY_REASON);
  }

  @Test
  void denyStopsEvaluation() {
    var chain =
        new AccessPolicyChain(
            "test",
            List.of(
                policy("first", PolicyResult.deny("nope")),
                policy("second", PolicyResult.allow("yes"))));

    var decision = chain.decide(REQUEST);

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo("nope");
    assertThat(evaluated).containsExactly("first");
  }

  @Test
  void conclusiveAllowStopsEvaluation() {
    var chain =
        new AccessPolicyChain(
            "test",
            List.of(
                policy("first", PolicyResult.allow("owner")),
                policy("second", PolicyResult.deny("never reached"))));

    assertThat(chain.decide(REQUEST).allowed()).isTrue();
    assertThat(evaluated).containsExactly("first");
  }

  @Test
  void provisionalAllowStandsWhenLaterPoliciesAbstain() {
    var chain =
        new AccessPolicyChain(
            "test",
            List.of(
                policy("matrix", PolicyResult.provisionalAllow("role allows")),
                policy("override", PolicyResult.notApplicable())));

    var decision = chain.decide(REQUEST);

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.reason()).isEqualTo("role allows");
    assertThat(evaluated).containsExactly("matrix", "override");
  }

  @Test
  void laterDenyOverridesProvisionalAllow() {
    var chain =
        new AccessPolicyChain(
            "test",
            List.of(
                policy("matrix", PolicyResult.provisionalAllow("role allows")),
                policy("override", PolicyResult.deny("level too low"))));

    var decision = chain.decide(REQUEST);

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo("level too low");
  }

  @Test
  void laterConclusiveAllowReplacesProvisionalReason() {
    var chain =
        new AccessPolicyChain(
            "test",
            List.of(
                policy("matrix", PolicyResult.provisionalAllow("role allows")),
                policy(
                    "override",
                    PolicyResult.allow("User has explicit edit access", AccessLevel.EDIT))));

    var decision = chain.decide(REQUEST);

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.accessLevel()).isEqualTo(AccessLevel.EDIT);
    assertThat(decision.reason()).isEqualTo("User has explicit edit access");
  }

  private AccessPolicy policy(String name, PolicyResult result) {
    return new AccessPolicy() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public PolicyResult decide(AccessRequest request) {
        evaluated.add(name);
        return result;
      }
    };
  }
}
