package io.b2mash.crm.crmcore.customfield.dto;

import io.b2mash.crm.crmcore.customfield.CustomFieldType;
import io.b2mash.crm.crmcore.customfield.EntityType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * @param enumValues legal values; required and non-empty for {@link CustomFieldType#ENUM}, must be
 *     absent for every other kind
 */
public record CreateCustomFieldDefinitionRequest(
    @NotBlank @Size(max = 100) String name,
    @NotBlank @Size(max = 255) String label,
    @NotNull EntityType entityType,
    @NotNull CustomFieldType fieldType,
    List<@NotBlank String> enumValues,
    boolean required) {

  public static CreateCustomFieldDefinitionRequest of(
      String name, String label, EntityType entityType, CustomFieldType fieldType) {
    return new CreateCustomFieldDefinitionRequest(name, label, entityType, fieldType, null, false);
  }

  public CreateCustomFieldDefinitionRequest withEnumValues(List<String> values) {
    return new CreateCustomFieldDefinitionRequest(
        name, label, entityType, fieldType, values, required);
  }

  public CreateCustomFieldDefinitionRequest asRequired() {
    return new CreateCustomFieldDefinitionRequest(
        name, label, entityType, fieldType, enumValues, true);
  }
}
