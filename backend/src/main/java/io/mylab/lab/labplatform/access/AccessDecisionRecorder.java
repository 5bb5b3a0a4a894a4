package io.mylab.lab.labplatform.access;

import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.audit.SecurityEventBuilder;
import io.mylab.lab.labplatform.audit.SecurityEventType;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records the outcome of every policy decision. Denials go to the security log as {@code
 * access_denied} events; allows are logged at debug level. Recording never fails the decision.
 */
@Component
public class AccessDecisionRecorder {

  private static final Logger log = LoggerFactory.getLogger(AccessDecisionRecorder.class);

  private final AuditService auditService;

  public AccessDecisionRecorder(AuditService auditService) {
    this.auditService = auditService;
  }

  void record(String policy, AccessRequest request, AccessDecision decision) {
    if (decision.allowed()) {
      log.debug(
          "Access allowed: policy={}, user={}, type={}, id={}, action={}, reason={}",
          policy,
          request.userId(),
          request.resourceType().value(),
          request.resourceId(),
          request.action() != null ? request.action().value() : null,
          decision.reason());
      return;
    }

    log.warn(
        "Access denied: policy={}, user={}, type={}, id={}, reason={}",
        policy,
        request.userId(),
        request.resourceType().value(),
        request.resourceId(),
        decision.reason());
    try {
      auditService.logSecurityEvent(
          SecurityEventBuilder.event(SecurityEventType.ACCESS_DENIED)
              .resource(request.resourceType().value(), request.resourceId())
              .reason(decision.reason())
              .details(details(policy, request))
              .build());
    } catch (RuntimeException e) {
      log.warn("Failed to record access decision: {}", e.getMessage());
    }
  }

  private static Map<String, Object> details(String policy, AccessRequest request) {
    var details = new HashMap<String, Object>();
    details.put("policy", policy);
    details.put("subjectId", request.userId().toString());
    if (request.projectId() != null) {
      details.put("projectId", request.projectId().toString());
    }
    if (request.action() != null) {
      details.put("action", request.action().value());
    }
    if (request.minimumGrantRole() != null) {
      details.put("minimumGrantRole", request.minimumGrantRole().value());
    }
    return Map.copyOf(details);
  }
}
