package io.b2mash.crm.crmcore.attachment;

import io.b2mash.crm.crmcore.customfield.EntityType;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/**
 * Target of a polymorphic attachment. Persisted as an {@code entity_type}/{@code entity_id} pair
 * with no foreign key, so the referenced row is not checked for existence.
 */
public record EntityReference(@NotNull EntityType type, @NotNull UUID id) {

  public static EntityReference contact(UUID id) {
    return new EntityReference(EntityType.CONTACT, id);
  }

  public static EntityReference company(UUID id) {
    return new EntityReference(EntityType.COMPANY, id);
  }

  public static EntityReference deal(UUID id) {
    return new EntityReference(EntityType.DEAL, id);
  }

  @Override
  public String toString() {
    return type.value() + "/" + id;
  }
}
