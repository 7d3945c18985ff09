package io.b2mash.toil.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  private final String code;

  public ResourceConflictException(String code, String title, String detail) {
    this(code, title, detail, null);
  }

  public ResourceConflictException(String code, String title, String detail, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(code, title, detail), cause);
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
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
