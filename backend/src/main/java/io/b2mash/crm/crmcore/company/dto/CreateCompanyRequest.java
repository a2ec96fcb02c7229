package io.b2mash.crm.crmcore.company.dto;

import io.b2mash.crm.crmcore.company.Address;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

public record CreateCompanyRequest(
    @NotBlank @Size(max = 255) String name,
    @Valid Address address,
    Map<String, Object> customFields) {

  public static CreateCompanyRequest named(String name) {
    return new CreateCompanyRequest(name, null, Map.of());
  }

  public CreateCompanyRequest withCustomFields(Map<String, Object> customFields) {
    return new CreateCompanyRequest(name, address, customFields);
  }
}
