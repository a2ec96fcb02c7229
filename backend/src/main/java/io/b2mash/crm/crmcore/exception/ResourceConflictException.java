package io.b2mash.crm.crmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A store-enforced constraint (foreign key, unique, check or not-null) rejected the write. The
 * violated constraint name is exposed as the {@code constraint} problem property.
 */
public class ResourceConflictException extends ErrorResponseException {

  private final String constraint;

  public ResourceConflictException(String constraint, String detail) {
    super(HttpStatus.CONFLICT, createProblem(constraint, detail), null);
    this.constraint = constraint;
  }

  public String getConstraint() {
    return constraint;
  }

  private static ProblemDetail createProblem(String constraint, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Constraint violation");
    problem.setDetail(detail);
    problem.setProperty("constraint", constraint);
    return problem;
  }
}
