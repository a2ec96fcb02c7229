package io.b2mash.crm.crmcore.validation;

import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Runs Bean Validation over service inputs and reports every violation in one {@link
 * ValidationFailedException}, keyed by property path.
 */
@Component
public class InputValidator {

  private final Validator validator;

  public InputValidator(Validator validator) {
    this.validator = validator;
  }

  public <T> T validate(T input) {
    if (input == null) {
      throw ValidationFailedException.forField("input", "Input is required");
    }
    var violations = validator.validate(input);
    if (violations.isEmpty()) {
      return input;
    }
    var fieldErrors = new LinkedHashMap<String, List<String>>();
    violations.stream()
        .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
        .forEach(
            v ->
                fieldErrors
                    .computeIfAbsent(propertyName(v), k -> new ArrayList<>())
                    .add(v.getMessage()));
    throw new ValidationFailedException(summarize(fieldErrors), fieldErrors);
  }

  private static String propertyName(ConstraintViolation<?> violation) {
    String path = violation.getPropertyPath().toString();
    return path.isEmpty() ? "input" : path;
  }

  private static String summarize(Map<String, List<String>> fieldErrors) {
    return "Invalid input: " + String.join(", ", fieldErrors.keySet());
  }
}
