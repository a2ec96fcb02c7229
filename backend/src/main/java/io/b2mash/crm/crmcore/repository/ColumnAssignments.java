package io.b2mash.crm.crmcore.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * Collects the {@code SET} clause of a partial update. Only fields present in the update input
 * produce an assignment; an explicit {@code null} assigns SQL {@code NULL}.
 */
public final class ColumnAssignments {

  private final List<String> assignments = new ArrayList<>();
  private final List<Object> params = new ArrayList<>();

  public <V> ColumnAssignments set(String column, JsonNullable<V> value) {
    return set(column, value, v -> v);
  }

  public <V> ColumnAssignments set(
      String column, JsonNullable<V> value, Function<? super V, ?> converter) {
    if (value != null && value.isPresent()) {
      assignments.add(column + " = ?");
      params.add(convert(value.get(), converter));
    }
    return this;
  }

  /** Assigns a {@code jsonb} column from already serialized JSON text. */
  public <V> ColumnAssignments setJson(
      String column, JsonNullable<V> value, Function<? super V, String> writer) {
    if (value != null && value.isPresent()) {
      assignments.add(column + " = CAST(? AS jsonb)");
      params.add(convert(value.get(), writer));
    }
    return this;
  }

  public boolean isEmpty() {
    return assignments.isEmpty();
  }

  /**
   * Builds {@code UPDATE table SET ... , updated_at = now(), updated_by = ? WHERE id = ? RETURNING
   * *} and appends the trailing parameters.
   */
  public String toUpdateSql(String table) {
    return "UPDATE "
        + table
        + " SET "
        + String.join(", ", assignments)
        + ", updated_at = now(), updated_by = ? WHERE id = ? RETURNING *";
  }

  public List<Object> params(String actingUser, Object id) {
    var all = new ArrayList<>(params);
    all.add(actingUser);
    all.add(id);
    return all;
  }

  private static <V> Object convert(V value, Function<? super V, ?> converter) {
    return value != null ? converter.apply(value) : null;
  }
}
