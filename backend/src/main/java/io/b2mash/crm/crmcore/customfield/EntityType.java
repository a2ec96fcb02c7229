package io.b2mash.crm.crmcore.customfield;

import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;

/** Core entity kinds that carry custom fields and accept task/note attachments. */
public enum EntityType {
  CONTACT("contact", "contacts"),
  COMPANY("company", "companies"),
  DEAL("deal", "deals");

  private final String value;
  private final String tableName;

  EntityType(String value, String tableName) {
    this.value = value;
    this.tableName = tableName;
  }

  /** Name stored in {@code entity_type} columns. */
  @JsonValue
  public String value() {
    return value;
  }

  public String tableName() {
    return tableName;
  }

  public static EntityType fromValue(String value) {
    for (var type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw ValidationFailedException.forField("entityType", "Unknown entity type: " + value);
  }
}
