package io.b2mash.crm.crmcore.customfield;

import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import java.util.Locale;

public enum CustomFieldType {
  TEXT,
  NUMBER,
  DATE,
  ENUM,
  BOOLEAN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static CustomFieldType fromValue(String value) {
    for (var type : values()) {
      if (type.value().equals(value)) {
        return type;
      }
    }
    throw ValidationFailedException.forField("fieldType", "Unknown field type: " + value);
  }
}
