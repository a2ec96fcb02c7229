package io.b2mash.crm.crmcore.deal;

import java.util.UUID;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * Exact-match deal filter. Undefined components add no constraint; a present {@code null}
 * contact matches deals without a contact.
 */
public record DealFilter(
    JsonNullable<UUID> companyId, JsonNullable<UUID> contactId, String stage) {

  public static DealFilter none() {
    return new DealFilter(JsonNullable.undefined(), JsonNullable.undefined(), null);
  }

  public static DealFilter byCompany(UUID companyId) {
    return new DealFilter(JsonNullable.of(companyId), JsonNullable.undefined(), null);
  }

  public DealFilter withContact(UUID contactId) {
    return new DealFilter(companyId, JsonNullable.of(contactId), stage);
  }

  public DealFilter withStage(String stage) {
    return new DealFilter(companyId, contactId, stage);
  }
}
