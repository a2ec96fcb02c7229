package io.b2mash.crm.crmcore.customfield;

import java.time.LocalDate;

/**
 * Typed custom-field value produced by {@link CustomFieldValidator}. {@link #toStoredValue()} is
 * the canonical form written to the {@code custom_fields} document.
 */
public sealed interface CustomFieldValue {

  Object toStoredValue();

  record Text(String value) implements CustomFieldValue {
    @Override
    public Object toStoredValue() {
      return value;
    }
  }

  record Number(double value) implements CustomFieldValue {

    private static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992d; // 2^53

    /** Integral values are stored as integers, everything else as a double. */
    @Override
    public Object toStoredValue() {
      if (value == Math.rint(value) && Math.abs(value) <= MAX_EXACT_INTEGER) {
        return (long) value;
      }
      return value;
    }
  }

  record Date(LocalDate value) implements CustomFieldValue {
    /** ISO {@code yyyy-MM-dd}. */
    @Override
    public Object toStoredValue() {
      return value.toString();
    }
  }

  record Bool(boolean value) implements CustomFieldValue {
    @Override
    public Object toStoredValue() {
      return value;
    }
  }

  record Enum(String value) implements CustomFieldValue {
    @Override
    public Object toStoredValue() {
      return value;
    }
  }
}
