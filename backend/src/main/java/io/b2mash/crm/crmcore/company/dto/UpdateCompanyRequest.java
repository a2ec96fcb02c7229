package io.b2mash.crm.crmcore.company.dto;

import io.b2mash.crm.crmcore.company.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * Partial company update. Undefined fields are left unchanged; a present {@code customFields}
 * replaces the stored mapping.
 */
public class UpdateCompanyRequest {

  @NotBlank
  @Size(max = 255)
  private JsonNullable<String> name = JsonNullable.undefined();

  private JsonNullable<Address> address = JsonNullable.undefined();

  private JsonNullable<Map<String, Object>> customFields = JsonNullable.undefined();

  public JsonNullable<String> getName() {
    return name;
  }

  public UpdateCompanyRequest name(String name) {
    this.name = JsonNullable.of(name);
    return this;
  }

  public JsonNullable<Address> getAddress() {
    return address;
  }

  public UpdateCompanyRequest address(Address address) {
    this.address = JsonNullable.of(address);
    return this;
  }

  public JsonNullable<Map<String, Object>> getCustomFields() {
    return customFields;
  }

  public UpdateCompanyRequest customFields(Map<String, Object> customFields) {
    this.customFields = JsonNullable.of(customFields);
    return this;
  }

  /** Returns a copy carrying {@code customFields} in place of this update's value. */
  public UpdateCompanyRequest withCustomFields(Map<String, Object> customFields) {
    var copy = new UpdateCompanyRequest();
    copy.name = name;
    copy.address = address;
    copy.customFields = JsonNullable.of(customFields);
    return copy;
  }
}
