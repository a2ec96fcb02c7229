package io.b2mash.crm.crmcore.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Caller-supplied input failed validation. Results in HTTP 400 with every violation grouped by
 * field name under the {@code fieldErrors} property, so callers can show all problems at once.
 */
public class ValidationFailedException extends ErrorResponseException {

  private final String summary;
  private final Map<String, List<String>> fieldErrors;

  public ValidationFailedException(String summary, Map<String, List<String>> fieldErrors) {
    super(HttpStatus.BAD_REQUEST, createProblem(summary, fieldErrors), null);
    this.summary = summary;
    this.fieldErrors = copyOf(fieldErrors);
  }

  public static ValidationFailedException forField(String field, String message) {
    return new ValidationFailedException(message, Map.of(field, List.of(message)));
  }

  public String getSummary() {
    return summary;
  }

  public Map<String, List<String>> getFieldErrors() {
    return fieldErrors;
  }

  private static ProblemDetail createProblem(
      String summary, Map<String, List<String>> fieldErrors) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(summary);
    problem.setProperty("fieldErrors", copyOf(fieldErrors));
    return problem;
  }

  private static Map<String, List<String>> copyOf(Map<String, List<String>> fieldErrors) {
    var copy = new LinkedHashMap<String, List<String>>();
    fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
    return Collections.unmodifiableMap(copy);
  }
}
