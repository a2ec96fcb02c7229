package io.b2mash.crm.crmcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  private final String entityType;
  private final Object entityId;

  public ResourceNotFoundException(String entityType, Object entityId) {
    super(HttpStatus.NOT_FOUND, createProblem(entityType, entityId), null);
    this.entityType = entityType;
    this.entityId = entityId;
  }

  public String getEntityType() {
    return entityType;
  }

  public Object getEntityId() {
    return entityId;
  }

  private static ProblemDetail createProblem(String entityType, Object entityId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(entityType + " not found");
    problem.setDetail("No " + entityType.toLowerCase() + " found with id " + entityId);
    problem.setProperty("entityType", entityType);
    problem.setProperty("entityId", String.valueOf(entityId));
    return problem;
  }
}
