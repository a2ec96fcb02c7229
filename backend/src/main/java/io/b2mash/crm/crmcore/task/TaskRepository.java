package io.b2mash.crm.crmcore.task;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.customfield.EntityType;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.repository.ColumnAssignments;
import io.b2mash.crm.crmcore.repository.EntityRepository;
import io.b2mash.crm.crmcore.repository.FilterConditions;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.repository.SqlValues;
import io.b2mash.crm.crmcore.task.dto.CreateTaskRequest;
import io.b2mash.crm.crmcore.task.dto.UpdateTaskRequest;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Tasks attach to any entity through the {@code entity_type}/{@code entity_id} pair. The pair has
 * no foreign key, so deleting the owning entity leaves its tasks in place.
 */
@Repository
public class TaskRepository
    implements EntityRepository<Task, CreateTaskRequest, UpdateTaskRequest, TaskFilter> {

  private static final String TABLE = "tasks";

  private final JdbcClient jdbc;

  public TaskRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Task create(CreateTaskRequest input, String actingUser) {
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO tasks
                        (description, due_date, assigned_to, status, entity_type, entity_id,
                         created_by, updated_by)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    RETURNING *
                    """)
                .params(
                    input.description(),
                    input.dueDate(),
                    input.assignedTo(),
                    input.status().value(),
                    input.attachedTo().type().value(),
                    input.attachedTo().id(),
                    actingUser,
                    actingUser)
                .query(this::mapRow)
                .single());
  }

  @Override
  public Optional<Task> findById(UUID id) {
    return call(
        () ->
            jdbc.sql("SELECT * FROM tasks WHERE id = ?")
                .param(id)
                .query(this::mapRow)
                .optional());
  }

  @Override
  public List<Task> findAll(TaskFilter filter, Pagination pagination) {
    var conditions = new FilterConditions();
    if (filter != null) {
      var entity = filter.attachedTo();
      conditions
          .equalIfSet("entity_type", entity != null ? entity.type().value() : null)
          .equalIfSet("entity_id", entity != null ? entity.id() : null)
          .equal("assigned_to", filter.assignedTo())
          .equalIfSet("status", filter.status() != null ? filter.status().value() : null);
    }
    String sql = conditions.toSelectSql(TABLE, "created_at", pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  /** Every task attached to the entity, newest first. */
  public List<Task> findByEntity(EntityReference entity) {
    return findAll(TaskFilter.attachedTo(entity), null);
  }

  @Override
  public Task update(UUID id, UpdateTaskRequest update, String actingUser) {
    var assignments =
        new ColumnAssignments()
            .set("description", update.getDescription())
            .set("due_date", update.getDueDate())
            .set("assigned_to", update.getAssignedTo())
            .set("status", update.getStatus(), TaskStatus::value)
            .set("entity_type", update.getAttachedTo(), ref -> ref.type().value())
            .set("entity_id", update.getAttachedTo(), EntityReference::id);
    if (assignments.isEmpty()) {
      return findById(id).orElseThrow(() -> new ResourceNotFoundException("Task", id));
    }
    return call(
            () ->
                jdbc.sql(assignments.toUpdateSql(TABLE))
                    .params(assignments.params(actingUser, id))
                    .query(this::mapRow)
                    .optional())
        .orElseThrow(() -> new ResourceNotFoundException("Task", id));
  }

  @Override
  public void delete(UUID id, String actingUser) {
    int deleted = call(() -> jdbc.sql("DELETE FROM tasks WHERE id = ?").param(id).update());
    if (deleted == 0) {
      throw new ResourceNotFoundException("Task", id);
    }
  }

  private Task mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Task(
        rs.getObject("id", UUID.class),
        rs.getString("description"),
        rs.getObject("due_date", LocalDate.class),
        rs.getString("assigned_to"),
        TaskStatus.fromValue(rs.getString("status")),
        new EntityReference(
            EntityType.fromValue(rs.getString("entity_type")),
            rs.getObject("entity_id", UUID.class)),
        SqlValues.instant(rs, "created_at"),
        SqlValues.instant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
