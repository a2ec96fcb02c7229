package io.b2mash.crm.crmcore.contact;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.contact.dto.CreateContactRequest;
import io.b2mash.crm.crmcore.contact.dto.UpdateContactRequest;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.repository.ColumnAssignments;
import io.b2mash.crm.crmcore.repository.EntityRepository;
import io.b2mash.crm.crmcore.repository.FilterConditions;
import io.b2mash.crm.crmcore.repository.JsonColumnMapper;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.repository.SqlValues;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class ContactRepository
    implements EntityRepository<
        Contact, CreateContactRequest, UpdateContactRequest, ContactFilter> {

  private static final String TABLE = "contacts";

  private final JdbcClient jdbc;
  private final JsonColumnMapper json;

  public ContactRepository(JdbcClient jdbc, JsonColumnMapper json) {
    this.jdbc = jdbc;
    this.json = json;
  }

  @Override
  public Contact create(CreateContactRequest input, String actingUser) {
    var emails = input.emails() != null ? input.emails() : List.<String>of();
    var phones = input.phones() != null ? input.phones() : List.<String>of();
    var customFields = input.customFields() != null ? input.customFields() : Map.of();
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO contacts
                        (first_name, last_name, emails, phones, company_id, custom_fields,
                         created_by, updated_by)
                    VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?)
                    RETURNING *
                    """)
                .params(
                    input.firstName(),
                    input.lastName(),
                    SqlValues.toArray(emails),
                    SqlValues.toArray(phones),
                    input.companyId(),
                    json.write(customFields),
                    actingUser,
                    actingUser)
                .query(this::mapRow)
                .single());
  }

  @Override
  public Optional<Contact> findById(UUID id) {
    return call(
        () ->
            jdbc.sql("SELECT * FROM contacts WHERE id = ?")
                .param(id)
                .query(this::mapRow)
                .optional());
  }

  @Override
  public List<Contact> findAll(ContactFilter filter, Pagination pagination) {
    var conditions = new FilterConditions();
    if (filter != null) {
      conditions.equal("company_id", filter.companyId()).arrayContains("emails", filter.email());
    }
    String sql = conditions.toSelectSql(TABLE, "created_at", pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  public List<Contact> findByCompany(UUID companyId) {
    return findAll(ContactFilter.byCompany(companyId), null);
  }

  @Override
  public Contact update(UUID id, UpdateContactRequest update, String actingUser) {
    var assignments =
        new ColumnAssignments()
            .set("first_name", update.getFirstName())
            .set("last_name", update.getLastName())
            .set("emails", update.getEmails(), SqlValues::toArray)
            .set("phones", update.getPhones(), SqlValues::toArray)
            .set("company_id", update.getCompanyId())
            .setJson("custom_fields", update.getCustomFields(), json::write);
    if (assignments.isEmpty()) {
      return findById(id).orElseThrow(() -> new ResourceNotFoundException("Contact", id));
    }
    return call(
            () ->
                jdbc.sql(assignments.toUpdateSql(TABLE))
                    .params(assignments.params(actingUser, id))
                    .query(this::mapRow)
                    .optional())
        .orElseThrow(() -> new ResourceNotFoundException("Contact", id));
  }

  @Override
  public void delete(UUID id, String actingUser) {
    int deleted = call(() -> jdbc.sql("DELETE FROM contacts WHERE id = ?").param(id).update());
    if (deleted == 0) {
      throw new ResourceNotFoundException("Contact", id);
    }
  }

  private Contact mapRow(ResultSet rs, int rowNum) throws SQLException {
    var emails = SqlValues.stringList(rs, "emails");
    var phones = SqlValues.stringList(rs, "phones");
    return new Contact(
        rs.getObject("id", UUID.class),
        rs.getString("first_name"),
        rs.getString("last_name"),
        emails != null ? emails : List.of(),
        phones != null ? phones : List.of(),
        rs.getObject("company_id", UUID.class),
        json.readMap(rs.getString("custom_fields")),
        SqlValues.instant(rs, "created_at"),
        SqlValues.instant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
