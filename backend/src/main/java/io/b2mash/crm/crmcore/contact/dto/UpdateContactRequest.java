package io.b2mash.crm.crmcore.contact.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.openapitools.jackson.nullable.JsonNullable;

public class UpdateContactRequest {

  @NotBlank
  @Size(max = 255)
  private JsonNullable<String> firstName = JsonNullable.undefined();

  @NotBlank
  @Size(max = 255)
  private JsonNullable<String> lastName = JsonNullable.undefined();

  @NotNull private JsonNullable<List<@NotBlank @Email String>> emails = JsonNullable.undefined();

  @NotNull private JsonNullable<List<@NotBlank String>> phones = JsonNullable.undefined();

  private JsonNullable<UUID> companyId = JsonNullable.undefined();

  private JsonNullable<Map<String, Object>> customFields = JsonNullable.undefined();

  public JsonNullable<String> getFirstName() {
    return firstName;
  }

  public UpdateContactRequest firstName(String firstName) {
    this.firstName = JsonNullable.of(firstName);
    return this;
  }

  public JsonNullable<String> getLastName() {
    return lastName;
  }

  public UpdateContactRequest lastName(String lastName) {
    this.lastName = JsonNullable.of(lastName);
    return this;
  }

  public JsonNullable<List<String>> getEmails() {
    return emails;
  }

  public UpdateContactRequest emails(List<String> emails) {
    this.emails = JsonNullable.of(emails);
    return this;
  }

  public JsonNullable<List<String>> getPhones() {
    return phones;
  }

  public UpdateContactRequest phones(List<String> phones) {
    this.phones = JsonNullable.of(phones);
    return this;
  }

  public JsonNullable<UUID> getCompanyId() {
    return companyId;
  }

  /** {@code null} detaches the contact from its company. */
  public UpdateContactRequest companyId(UUID companyId) {
    this.companyId = JsonNullable.of(companyId);
    return this;
  }

  public JsonNullable<Map<String, Object>> getCustomFields() {
    return customFields;
  }

  public UpdateContactRequest customFields(Map<String, Object> customFields) {
    this.customFields = JsonNullable.of(customFields);
    return this;
  }

  /** Returns a copy carrying {@code customFields} in place of this update's value. */
  public UpdateContactRequest withCustomFields(Map<String, Object> customFields) {
    var copy = new UpdateContactRequest();
    copy.firstName = firstName;
    copy.lastName = lastName;
    copy.emails = emails;
    copy.phones = phones;
    copy.companyId = companyId;
    copy.customFields = JsonNullable.of(customFields);
    return copy;
  }
}
