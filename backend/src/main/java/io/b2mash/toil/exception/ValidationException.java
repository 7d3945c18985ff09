package io.b2mash.toil.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a request is well-formed but violates a business rule the caller can fix (missing
 * supervisor, insufficient balance, short rejection reason). Results in HTTP 422.
 */
public class ValidationException extends ErrorResponseException {

  private final String code;

  public ValidationException(String code, String title, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(code, title, detail), null);
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  @Override
  public String getMessage() {
    return code + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
