package io.b2mash.crm.crmcore.contact.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record CreateContactRequest(
    @NotBlank @Size(max = 255) String firstName,
    @NotBlank @Size(max = 255) String lastName,
    List<@NotBlank @Email String> emails,
    List<@NotBlank String> phones,
    UUID companyId,
    Map<String, Object> customFields) {

  public static CreateContactRequest of(String firstName, String lastName, UUID companyId) {
    return new CreateContactRequest(firstName, lastName, List.of(), List.of(), companyId, Map.of());
  }

  public CreateContactRequest withEmails(List<String> emails) {
    return new CreateContactRequest(firstName, lastName, emails, phones, companyId, customFields);
  }

  public CreateContactRequest withCustomFields(Map<String, Object> customFields) {
    return new CreateContactRequest(firstName, lastName, emails, phones, companyId, customFields);
  }
}
