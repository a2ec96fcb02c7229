package io.b2mash.crm.crmcore.customfield;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.customfield.dto.CreateCustomFieldDefinitionRequest;
import io.b2mash.crm.crmcore.customfield.dto.UpdateCustomFieldDefinitionRequest;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.repository.ColumnAssignments;
import io.b2mash.crm.crmcore.repository.EntityRepository;
import io.b2mash.crm.crmcore.repository.FilterConditions;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.repository.SqlValues;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Field definitions, filtered by target entity type ({@code null} filter lists every type). */
@Repository
public class CustomFieldDefinitionRepository
    implements EntityRepository<
        CustomFieldDefinition,
        CreateCustomFieldDefinitionRequest,
        UpdateCustomFieldDefinitionRequest,
        EntityType> {

  private static final String TABLE = "custom_field_definitions";

  private final JdbcClient jdbc;

  public CustomFieldDefinitionRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public CustomFieldDefinition create(
      CreateCustomFieldDefinitionRequest input, String actingUser) {
    String[] enumValues = SqlValues.toArray(input.enumValues());
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO custom_field_definitions
                        (name, label, entity_type, field_type, enum_values, required,
                         created_by, updated_by)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    RETURNING *
                    """)
                .params(
                    input.name(),
                    input.label(),
                    input.entityType().value(),
                    input.fieldType().value(),
                    enumValues,
                    input.required(),
                    actingUser,
                    actingUser)
                .query(this::mapRow)
                .single());
  }

  @Override
  public Optional<CustomFieldDefinition> findById(UUID id) {
    return call(
        () ->
            jdbc.sql("SELECT * FROM custom_field_definitions WHERE id = ?")
                .param(id)
                .query(this::mapRow)
                .optional());
  }

  @Override
  public List<CustomFieldDefinition> findAll(EntityType entityType, Pagination pagination) {
    var conditions =
        new FilterConditions()
            .equalIfSet("entity_type", entityType != null ? entityType.value() : null);
    String sql = conditions.toSelectSql(TABLE, "created_at", pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  /** Every definition for the entity type, in creation order. */
  public List<CustomFieldDefinition> findByEntityType(EntityType entityType) {
    return call(
        () ->
            jdbc.sql(
                    """
                    SELECT * FROM custom_field_definitions
                    WHERE entity_type = ?
                    ORDER BY created_at, name
                    """)
                .param(entityType.value())
                .query(this::mapRow)
                .list());
  }

  @Override
  public CustomFieldDefinition update(
      UUID id, UpdateCustomFieldDefinitionRequest update, String actingUser) {
    var assignments =
        new ColumnAssignments()
            .set("label", update.getLabel())
            .set("required", update.getRequired());
    if (assignments.isEmpty()) {
      return findById(id).orElseThrow(() -> new ResourceNotFoundException("CustomField", id));
    }
    return call(
            () ->
                jdbc.sql(assignments.toUpdateSql(TABLE))
                    .params(assignments.params(actingUser, id))
                    .query(this::mapRow)
                    .optional())
        .orElseThrow(() -> new ResourceNotFoundException("CustomField", id));
  }

  @Override
  public void delete(UUID id, String actingUser) {
    int deleted =
        call(() -> jdbc.sql("DELETE FROM custom_field_definitions WHERE id = ?").param(id).update());
    if (deleted == 0) {
      throw new ResourceNotFoundException("CustomField", id);
    }
  }

  /**
   * Removes {@code fieldName} from the {@code custom_fields} document of every row of the entity
   * type's table. Returns the number of rows changed.
   */
  public int removeFieldFromEntities(EntityType entityType, String fieldName) {
    String sql =
        "UPDATE "
            + entityType.tableName()
            + " SET custom_fields = custom_fields - CAST(? AS text)"
            + " WHERE custom_fields -> CAST(? AS text) IS NOT NULL";
    return call(() -> jdbc.sql(sql).params(fieldName, fieldName).update());
  }

  private CustomFieldDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CustomFieldDefinition(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getString("label"),
        EntityType.fromValue(rs.getString("entity_type")),
        CustomFieldType.fromValue(rs.getString("field_type")),
        SqlValues.stringList(rs, "enum_values"),
        rs.getBoolean("required"),
        SqlValues.instant(rs, "created_at"),
        SqlValues.instant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
