package io.b2mash.crm.crmcore.repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * Builds the {@code WHERE}, ordering and paging tail of a list query. An undefined filter value
 * adds no predicate; a present {@code null} becomes {@code IS NULL}.
 */
public final class FilterConditions {

  private final List<String> conditions = new ArrayList<>();
  private final List<Object> params = new ArrayList<>();

  public <V> FilterConditions equal(String column, JsonNullable<V> value) {
    return equal(column, value, v -> v);
  }

  public <V> FilterConditions equal(
      String column, JsonNullable<V> value, Function<? super V, ?> converter) {
    if (value == null || !value.isPresent()) {
      return this;
    }
    if (value.get() == null) {
      conditions.add(column + " IS NULL");
    } else {
      conditions.add(column + " = ?");
      params.add(converter.apply(value.get()));
    }
    return this;
  }

  /** Exact match on a non-null value; {@code null} adds no predicate. */
  public FilterConditions equalIfSet(String column, Object value) {
    if (value != null) {
      conditions.add(column + " = ?");
      params.add(value);
    }
    return this;
  }

  /** Case-insensitive substring match with LIKE wildcards in {@code text} taken literally. */
  public FilterConditions containsIgnoreCase(String column, String text) {
    if (text != null) {
      conditions.add(column + " ILIKE ? ESCAPE '\\'");
      params.add("%" + escapeLike(text) + "%");
    }
    return this;
  }

  /** Matches rows whose array column holds {@code value}. */
  public FilterConditions arrayContains(String column, String value) {
    if (value != null) {
      conditions.add("? = ANY(" + column + ")");
      params.add(value);
    }
    return this;
  }

  public FilterConditions from(String column, Instant inclusiveStart) {
    if (inclusiveStart != null) {
      conditions.add(column + " >= ?");
      params.add(Timestamp.from(inclusiveStart));
    }
    return this;
  }

  public FilterConditions until(String column, Instant exclusiveEnd) {
    if (exclusiveEnd != null) {
      conditions.add(column + " < ?");
      params.add(Timestamp.from(exclusiveEnd));
    }
    return this;
  }

  /** Returns the full statement and appends paging parameters when {@code pagination} is set. */
  public String toSelectSql(String table, String orderColumn, Pagination pagination) {
    var sql = new StringBuilder("SELECT * FROM ").append(table);
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    sql.append(" ORDER BY ").append(orderColumn).append(" DESC, id DESC");
    if (pagination != null) {
      sql.append(" LIMIT ? OFFSET ?");
      params.add(pagination.limit());
      params.add(pagination.offset());
    }
    return sql.toString();
  }

  public List<Object> params() {
    return params;
  }

  static String escapeLike(String text) {
    return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
