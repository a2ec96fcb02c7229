package io.b2mash.crm.crmcore.customfield.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.openapitools.jackson.nullable.JsonNullable;

/** Partial update of a field definition. Name, kind and entity type cannot change. */
public class UpdateCustomFieldDefinitionRequest {

  @NotBlank
  @Size(max = 255)
  private JsonNullable<String> label = JsonNullable.undefined();

  @NotNull private JsonNullable<Boolean> required = JsonNullable.undefined();

  public JsonNullable<String> getLabel() {
    return label;
  }

  public UpdateCustomFieldDefinitionRequest label(String label) {
    this.label = JsonNullable.of(label);
    return this;
  }

  public JsonNullable<Boolean> getRequired() {
    return required;
  }

  public UpdateCustomFieldDefinitionRequest required(Boolean required) {
    this.required = JsonNullable.of(required);
    return this;
  }
}
