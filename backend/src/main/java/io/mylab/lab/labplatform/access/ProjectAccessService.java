package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.config.AccessControlProperties;
import io.mylab.lab.labplatform.exception.AccessCheckFailedException;
import io.mylab.lab.labplatform.permission.Action;
import io.mylab.lab.labplatform.resource.ResourceType;
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
 * Project role and override policy. Callable directly by services that need a decision without
 * going through an HTTP endpoint.
 */
@Service
public class ProjectAccessService {

  private static final Logger log = LoggerFactory.getLogger(ProjectAccessService.class);

  private final AccessPolicyChain projectAccessChain;
  private final AccessDecisionRecorder decisionRecorder;
  private final TransactionTemplate txTemplate;

  public ProjectAccessService(
      @Qualifier("projectAccessChain") AccessPolicyChain projectAccessChain,
      AccessDecisionRecorder decisionRecorder,
      PlatformTransactionManager transactionManager,
      AccessControlProperties properties) {
    this.projectAccessChain = projectAccessChain;
    this.decisionRecorder = decisionRecorder;
    this.txTemplate = new TransactionTemplate(transactionManager);
    this.txTemplate.setReadOnly(true);
    this.txTemplate.setTimeout(properties.lookupTimeoutSeconds());
  }

  /**
   * Decides whether {@code userId} may perform {@code action} on a resource of {@code resourceType}
   * in the project. {@code resourceId} is optional; when given for a report or sample, a per-user
   * override can decide view, download and edit.
   */
  public AccessDecision checkAccess(
      UUID userId, UUID projectId, ResourceType resourceType, Action action, UUID resourceId) {
    var request = AccessRequest.forProject(userId, projectId, resourceType, action, resourceId);
    AccessDecision decision;
    try {
      decision = txTemplate.execute(status -> projectAccessChain.decide(request));
    } catch (DataAccessException | TransactionException e) {
      log.error(
          "Project access check failed: project={}, type={}, action={}, user={}",
          projectId,
          resourceType.value(),
          action.value(),
          userId,
          e);
      throw new AccessCheckFailedException(e);
    }
    decisionRecorder.record("project", request, decision);
    return decision;
  }
}
