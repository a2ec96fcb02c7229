package io.b2mash.crm.crmcore.task;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TaskStatus {
  OPEN,
  CLOSED;

  /** Stored and serialized form, {@code open} or {@code closed}. */
  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TaskStatus fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
