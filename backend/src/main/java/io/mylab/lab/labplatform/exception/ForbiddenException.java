package io.mylab.lab.labplatform.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * 403 carrying a short, non-sensitive denial reason. When the denial concerns a specific resource,
 * its type and id ride along for the security log.
 */
public class ForbiddenException extends ErrorResponseException {

  private final String resourceType;
  private final UUID resourceId;
  private boolean securityEventRecorded;

  public ForbiddenException(String title, String detail) {
    this(title, detail, null, null);
  }

  public ForbiddenException(String title, String detail, String resourceType, UUID resourceId) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail), null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  /** Marks a denial whose {@code access_denied} event was already written by the access engine. */
  public ForbiddenException securityEventRecorded() {
    this.securityEventRecorded = true;
    return this;
  }

  public boolean isSecurityEventRecorded() {
    return securityEventRecorded;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
