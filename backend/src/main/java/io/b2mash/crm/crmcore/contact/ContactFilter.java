package io.b2mash.crm.crmcore.contact;

import java.util.UUID;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * @param companyId undefined for no constraint, {@code null} for contacts without a company
 * @param email exact address held in the contact's e-mail list, or {@code null}
 */
public record ContactFilter(JsonNullable<UUID> companyId, String email) {

  public static ContactFilter none() {
    return new ContactFilter(JsonNullable.undefined(), null);
  }

  public static ContactFilter byCompany(UUID companyId) {
    return new ContactFilter(JsonNullable.of(companyId), null);
  }

  public static ContactFilter byEmail(String email) {
    return new ContactFilter(JsonNullable.undefined(), email);
  }
}
