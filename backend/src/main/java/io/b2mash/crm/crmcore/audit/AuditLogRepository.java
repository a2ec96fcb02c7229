package io.b2mash.crm.crmcore.audit;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.repository.FilterConditions;
import io.b2mash.crm.crmcore.repository.JsonColumnMapper;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.repository.SqlValues;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Append-only access to {@code audit_logs}; there are no update or delete operations. */
@Repository
public class AuditLogRepository {

  private static final String TABLE = "audit_logs";
  private static final String TIMESTAMP_COLUMN = "\"timestamp\"";

  private final JdbcClient jdbc;
  private final JsonColumnMapper json;

  public AuditLogRepository(JdbcClient jdbc, JsonColumnMapper json) {
    this.jdbc = jdbc;
    this.json = json;
  }

  public AuditLog insert(AuditEntry entry) {
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO audit_logs (entity_type, entity_id, action, user_id, changes)
                    VALUES (?, ?, ?, ?, CAST(? AS jsonb))
                    RETURNING *
                    """)
                .params(
                    entry.entityType(),
                    entry.entityId(),
                    entry.action().value(),
                    entry.userId(),
                    json.write(entry.changes()))
                .query(this::mapRow)
                .single());
  }

  public List<AuditLog> findByEntity(String entityType, UUID entityId, Pagination pagination) {
    return findAll(
        new AuditLogFilter(entityType, entityId, null, null, null, null), pagination);
  }

  public List<AuditLog> findByUser(String userId, Pagination pagination) {
    return findAll(new AuditLogFilter(null, null, null, userId, null, null), pagination);
  }

  public List<AuditLog> findAll(AuditLogFilter filter, Pagination pagination) {
    var conditions =
        new FilterConditions()
            .equalIfSet("entity_type", filter.entityType())
            .equalIfSet("entity_id", filter.entityId())
            .equalIfSet("action", filter.action() != null ? filter.action().value() : null)
            .equalIfSet("user_id", filter.userId())
            .from(TIMESTAMP_COLUMN, filter.from())
            .until(TIMESTAMP_COLUMN, filter.to());
    String sql = conditions.toSelectSql(TABLE, TIMESTAMP_COLUMN, pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  private AuditLog mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditLog(
        rs.getObject("id", UUID.class),
        rs.getString("entity_type"),
        rs.getObject("entity_id", UUID.class),
        AuditAction.fromValue(rs.getString("action")),
        rs.getString("user_id"),
        json.readNullableMap(rs.getString("changes")),
        SqlValues.instant(rs, "timestamp"));
  }
}
