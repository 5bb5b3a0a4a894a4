package io.mylab.lab.labplatform.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A store failure or timeout while computing an access decision. The response body is generic; the
 * underlying cause is kept for server-side logging only.
 */
public class AccessCheckFailedException extends ErrorResponseException {

  public AccessCheckFailedException(Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(), cause);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Access control check failed");
    problem.setDetail("The access decision could not be computed. Please retry.");
    return problem;
  }
}
