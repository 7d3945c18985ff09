package io.b2mash.toil.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when storage or locking fails for reasons outside the caller's control. Always retryable:
 * the background accrual worker retries only this type. Results in HTTP 503.
 */
public class InfrastructureException extends ErrorResponseException {

  private final String code;

  public InfrastructureException(String code, String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(code, detail), cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  @Override
  public String getMessage() {
    return code + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String code, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Temporarily unavailable");
    problem.setDetail(detail);
    problem.setProperty("code", code);
    problem.setProperty("retryable", true);
    return problem;
  }
}
