package io.b2mash.crm.crmcore.customfield;

import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class CustomFieldValidator {

  private static final int ISO_DATE_LENGTH = 10;

  private final CustomFieldDefinitionRepository definitionRepository;

  public CustomFieldValidator(CustomFieldDefinitionRepository definitionRepository) {
    this.definitionRepository = definitionRepository;
  }

  /**
   * Validates custom field values against the definitions of {@code entityType} and returns the
   * mapping in its stored form.
   *
   * <ol>
   *   <li>Load the field definitions for the entity type
   *   <li>Reject unknown keys
   *   <li>Type-check each value against its field kind
   *   <li>Report every required field that is absent
   *   <li>Convert the typed values to their stored representation
   * </ol>
   *
   * @throws ValidationFailedException listing every problem, keyed by field name
   */
  public Map<String, Object> validateAndClean(EntityType entityType, Map<String, Object> input) {
    var definitions = definitionRepository.findByEntityType(entityType);
    return clean(validate(definitions, input != null ? input : Map.of()));
  }

  /**
   * Checks {@code input} against {@code definitions} without touching storage. Unknown keys, type
   * errors and missing required fields are all collected before failing.
   */
  public static Map<String, CustomFieldValue> validate(
      List<CustomFieldDefinition> definitions, Map<String, Object> input) {
    var byName =
        definitions.stream()
            .collect(
                Collectors.toMap(
                    CustomFieldDefinition::name, Function.identity(), (a, b) -> a));

    var typed = new LinkedHashMap<String, CustomFieldValue>();
    var errors = new LinkedHashMap<String, List<String>>();

    for (var entry : input.entrySet()) {
      String name = entry.getKey();
      var definition = byName.get(name);
      if (definition == null) {
        addError(errors, name, "Unknown custom field: " + name);
        continue;
      }
      var value = toTypedValue(definition, entry.getValue());
      if (value == null) {
        addError(errors, name, typeError(definition));
      } else {
        typed.put(name, value);
      }
    }

    for (var definition : definitions) {
      if (definition.required() && !input.containsKey(definition.name())) {
        addError(
            errors, definition.name(), "Required field '" + definition.label() + "' is missing");
      }
    }

    if (!errors.isEmpty()) {
      throw new ValidationFailedException("Custom field validation failed", errors);
    }
    return typed;
  }

  /** Converts validated values to the representation stored in {@code custom_fields}. */
  public static Map<String, Object> clean(Map<String, CustomFieldValue> values) {
    var stored = new LinkedHashMap<String, Object>();
    values.forEach((name, value) -> stored.put(name, value.toStoredValue()));
    return stored;
  }

  /** Returns {@code null} when the raw value does not fit the field kind. */
  private static CustomFieldValue toTypedValue(CustomFieldDefinition definition, Object raw) {
    if (raw == null) {
      return null;
    }
    return switch (definition.fieldType()) {
      case TEXT -> raw instanceof String s ? new CustomFieldValue.Text(s) : null;
      case NUMBER -> toNumber(raw);
      case DATE -> toDate(raw);
      case BOOLEAN -> raw instanceof Boolean b ? new CustomFieldValue.Bool(b) : null;
      case ENUM ->
          raw instanceof String s
                  && definition.enumValues() != null
                  && definition.enumValues().contains(s)
              ? new CustomFieldValue.Enum(s)
              : null;
    };
  }

  private static CustomFieldValue toNumber(Object raw) {
    if (!(raw instanceof Number number)) {
      return null;
    }
    double value = number.doubleValue();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return null;
    }
    return new CustomFieldValue.Number(value);
  }

  private static CustomFieldValue toDate(Object raw) {
    if (raw instanceof LocalDate date) {
      return new CustomFieldValue.Date(date);
    }
    if (!(raw instanceof String text)) {
      return null;
    }
    try {
      if (text.length() == ISO_DATE_LENGTH) {
        return new CustomFieldValue.Date(LocalDate.parse(text));
      }
      var parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              text, OffsetDateTime::from, LocalDateTime::from);
      var date =
          parsed instanceof OffsetDateTime offset
              ? offset.toLocalDate()
              : ((LocalDateTime) parsed).toLocalDate();
      return new CustomFieldValue.Date(date);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String typeError(CustomFieldDefinition definition) {
    String label = definition.label();
    return switch (definition.fieldType()) {
      case TEXT -> "Field '" + label + "' must be a string";
      case NUMBER -> "Field '" + label + "' must be a number";
      case DATE -> "Field '" + label + "' must be a valid date";
      case BOOLEAN -> "Field '" + label + "' must be a boolean";
      case ENUM -> {
        var legal = definition.enumValues() != null ? definition.enumValues() : List.<String>of();
        yield "Field '" + label + "' must be one of: " + String.join(", ", legal);
      }
    };
  }

  private static void addError(Map<String, List<String>> errors, String field, String message) {
    errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
  }
}
