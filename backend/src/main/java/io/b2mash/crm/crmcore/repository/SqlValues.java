package io.b2mash.crm.crmcore.repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/** Conversions between JDBC column values and entity field types. */
public final class SqlValues {

  private SqlValues() {}

  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp timestamp = rs.getTimestamp(column);
    return timestamp != null ? timestamp.toInstant() : null;
  }

  /** Reads a {@code text[]} column; SQL {@code NULL} reads as {@code null}. */
  public static List<String> stringList(ResultSet rs, String column) throws SQLException {
    Array array = rs.getArray(column);
    if (array == null) {
      return null;
    }
    try {
      return List.copyOf(Arrays.asList((String[]) array.getArray()));
    } finally {
      array.free();
    }
  }

  public static String[] toArray(List<String> values) {
    return values != null ? values.toArray(String[]::new) : null;
  }
}
