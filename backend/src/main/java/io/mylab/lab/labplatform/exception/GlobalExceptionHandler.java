package io.mylab.lab.labplatform.exception;

import io.mylab.lab.labplatform.audit.AuditService;
import io.mylab.lab.labplatform.audit.SecurityEventBuilder;
import io.mylab.lab.labplatform.audit.SecurityEventType;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final AuditService auditService;

  public GlobalExceptionHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    recordAccessDenied(request, "insufficient_role", null, null);

    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    String reason = ex.getBody().getDetail();
    log.warn(
        "Forbidden: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        reason);
    if (!ex.isSecurityEventRecorded()) {
      recordAccessDenied(
          request, reason != null ? reason : "forbidden", ex.getResourceType(), ex.getResourceId());
    }

    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ex.getBody());
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ProblemDetail> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    log.warn(
        "Invalid request: path={}, method={}, detail={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }

  @ExceptionHandler(AccessCheckFailedException.class)
  public ResponseEntity<ProblemDetail> handleAccessCheckFailed(
      AccessCheckFailedException ex, HttpServletRequest request) {
    log.error(
        "Access check failed: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ex.getBody());
  }

  @ExceptionHandler(PrincipalNotBoundException.class)
  public ResponseEntity<ProblemDetail> handlePrincipalNotBound(PrincipalNotBoundException ex) {
    log.error("Principal invariant violation: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Principal not available");
    problem.setDetail("Unable to resolve caller identity for request");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex) {
    log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflict");
    problem.setDetail("The request conflicts with existing data");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  private void recordAccessDenied(
      HttpServletRequest request,
      String reason,
      String resourceType,
      UUID resourceId) {
    try {
      auditService.logSecurityEvent(
          SecurityEventBuilder.event(SecurityEventType.ACCESS_DENIED)
              .resource(resourceType, resourceId)
              .reason(reason)
              .details(Map.of("path", request.getRequestURI(), "method", request.getMethod()))
              .request(request)
              .build());
    } catch (RuntimeException e) {
      log.warn("Failed to record access denied event: {}", e.getMessage());
    }
  }
}
