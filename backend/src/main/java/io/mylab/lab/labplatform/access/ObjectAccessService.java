package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.config.AccessControlProperties;
import io.mylab.lab.labplatform.exception.AccessCheckFailedException;
import io.mylab.lab.labplatform.resource.ResourceType;
import io.mylab.lab.labplatform.security.GrantRole;
import io.mylab.lab.labplatform.security.Principal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Ownership/grant policy for projects, samples, derived samples, batches, analyses and documents.
 * Each decision runs in one read-only transaction bounded by {@code access-control.lookup-timeout};
 * a store failure or timeout surfaces as {@link AccessCheckFailedException}, never as a verdict.
 */
@Service
public class ObjectAccessService {

  private static final Logger log = LoggerFactory.getLogger(ObjectAccessService.class);

  private final AccessPolicyChain objectAccessChain;
  private final AccessDecisionRecorder decisionRecorder;
  private final TransactionTemplate txTemplate;

  public ObjectAccessService(
      @Qualifier("objectAccessChain") AccessPolicyChain objectAccessChain,
      AccessDecisionRecorder decisionRecorder,
      PlatformTransactionManager transactionManager,
      AccessControlProperties properties) {
    this.objectAccessChain = objectAccessChain;
    this.decisionRecorder = decisionRecorder;
    this.txTemplate = new TransactionTemplate(transactionManager);
    this.txTemplate.setReadOnly(true);
    this.txTemplate.setTimeout(properties.lookupTimeoutSeconds());
  }

  public AccessDecision checkAccess(
      Principal principal, ResourceType type, UUID objectId, GrantRole minimumGrantRole) {
    var request = AccessRequest.forObject(principal, type, objectId, minimumGrantRole);
    AccessDecision decision;
    try {
      decision = txTemplate.execute(status -> objectAccessChain.decide(request));
    } catch (DataAccessException | TransactionException e) {
      log.error(
          "Object access check failed: type={}, id={}, user={}",
          type.value(),
          objectId,
          principal.id(),
          e);
      throw new AccessCheckFailedException(e);
    }
    decisionRecorder.record("object", request, decision);
    return decision;
  }
}
