package io.b2mash.crm.crmcore.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AuditAction {
  CREATE,
  UPDATE,
  DELETE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AuditAction fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
