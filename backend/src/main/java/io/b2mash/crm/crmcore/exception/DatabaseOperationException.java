package io.b2mash.crm.crmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Opaque storage failure. The original exception is kept as the cause for diagnostics. */
public class DatabaseOperationException extends ErrorResponseException {

  public DatabaseOperationException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Database error");
    problem.setDetail(detail);
    return problem;
  }
}
