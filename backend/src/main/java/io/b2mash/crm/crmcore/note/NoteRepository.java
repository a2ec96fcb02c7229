package io.b2mash.crm.crmcore.note;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.customfield.EntityType;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.note.dto.CreateNoteRequest;
import io.b2mash.crm.crmcore.note.dto.UpdateNoteRequest;
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

@Repository
public class NoteRepository
    implements EntityRepository<Note, CreateNoteRequest, UpdateNoteRequest, NoteFilter> {

  private static final String TABLE = "notes";

  private final JdbcClient jdbc;

  public NoteRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Note create(CreateNoteRequest input, String actingUser) {
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO notes (content, entity_type, entity_id, created_by, updated_by)
                    VALUES (?, ?, ?, ?, ?)
                    RETURNING *
                    """)
                .params(
                    input.content(),
                    input.attachedTo().type().value(),
                    input.attachedTo().id(),
                    actingUser,
                    actingUser)
                .query(this::mapRow)
                .single());
  }

  @Override
  public Optional<Note> findById(UUID id) {
    return call(
        () ->
            jdbc.sql("SELECT * FROM notes WHERE id = ?")
                .param(id)
                .query(this::mapRow)
                .optional());
  }

  @Override
  public List<Note> findAll(NoteFilter filter, Pagination pagination) {
    var conditions = new FilterConditions();
    if (filter != null && filter.attachedTo() != null) {
      conditions
          .equalIfSet("entity_type", filter.attachedTo().type().value())
          .equalIfSet("entity_id", filter.attachedTo().id());
    }
    String sql = conditions.toSelectSql(TABLE, "created_at", pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  public List<Note> findByEntity(EntityReference entity) {
    return findAll(new NoteFilter(entity), null);
  }

  @Override
  public Note update(UUID id, UpdateNoteRequest update, String actingUser) {
    var assignments =
        new ColumnAssignments()
            .set("content", update.getContent())
            .set("entity_type", update.getAttachedTo(), ref -> ref.type().value())
            .set("entity_id", update.getAttachedTo(), EntityReference::id);
    if (assignments.isEmpty()) {
      return findById(id).orElseThrow(() -> new ResourceNotFoundException("Note", id));
    }
    return call(
            () ->
                jdbc.sql(assignments.toUpdateSql(TABLE))
                    .params(assignments.params(actingUser, id))
                    .query(this::mapRow)
                    .optional())
        .orElseThrow(() -> new ResourceNotFoundException("Note", id));
  }

  @Override
  public void delete(UUID id, String actingUser) {
    int deleted = call(() -> jdbc.sql("DELETE FROM notes WHERE id = ?").param(id).update());
    if (deleted == 0) {
      throw new ResourceNotFoundException("Note", id);
    }
  }

  private Note mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Note(
        rs.getObject("id", UUID.class),
        rs.getString("content"),
        new EntityReference(
            EntityType.fromValue(rs.getString("entity_type")),
            rs.getObject("entity_id", UUID.class)),
        SqlValues.instant(rs, "created_at"),
        SqlValues.instant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
