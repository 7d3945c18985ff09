package io.b2mash.toil.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ForbiddenException extends ErrorResponseException {

  private final String code;

  public ForbiddenException(String code, String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(code, title, detail), null);
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
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
