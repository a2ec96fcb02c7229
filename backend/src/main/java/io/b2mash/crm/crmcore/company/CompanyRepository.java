package io.b2mash.crm.crmcore.company;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.company.dto.CreateCompanyRequest;
import io.b2mash.crm.crmcore.company.dto.UpdateCompanyRequest;
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
public class CompanyRepository
    implements EntityRepository<
        Company, CreateCompanyRequest, UpdateCompanyRequest, CompanyFilter> {

  private static final String TABLE = "companies";

  private final JdbcClient jdbc;
  private final JsonColumnMapper json;

  public CompanyRepository(JdbcClient jdbc, JsonColumnMapper json) {
    this.jdbc = jdbc;
    this.json = json;
  }

  @Override
  public Company create(CreateCompanyRequest input, String actingUser) {
    var customFields = input.customFields() != null ? input.customFields() : Map.of();
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO companies (name, address, custom_fields, created_by, updated_by)
                    VALUES (?, CAST(? AS jsonb), CAST(? AS jsonb), ?, ?)
                    RETURNING *
                    """)
                .params(
                    input.name(),
                    json.write(input.address()),
                    json.write(customFields),
                    actingUser,
                    actingUser)
                .query(this::mapRow)
                .single());
  }

  @Override
  public Optional<Company> findById(UUID id) {
    return call(
        () ->
            jdbc.sql("SELECT * FROM companies WHERE id = ?")
                .param(id)
                .query(this::mapRow)
                .optional());
  }

  @Override
  public List<Company> findAll(CompanyFilter filter, Pagination pagination) {
    var conditions = new FilterConditions();
    if (filter != null) {
      conditions.containsIgnoreCase("name", filter.name());
    }
    String sql = conditions.toSelectSql(TABLE, "created_at", pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  @Override
  public Company update(UUID id, UpdateCompanyRequest update, String actingUser) {
    var assignments =
        new ColumnAssignments()
            .set("name", update.getName())
            .setJson("address", update.getAddress(), json::write)
            .setJson("custom_fields", update.getCustomFields(), json::write);
    if (assignments.isEmpty()) {
      return findById(id).orElseThrow(() -> new ResourceNotFoundException("Company", id));
    }
    return call(
            () ->
                jdbc.sql(assignments.toUpdateSql(TABLE))
                    .params(assignments.params(actingUser, id))
                    .query(this::mapRow)
                    .optional())
        .orElseThrow(() -> new ResourceNotFoundException("Company", id));
  }

  /** Deals of the company are deleted with it; its contacts keep existing without a company. */
  @Override
  public void delete(UUID id, String actingUser) {
    int deleted = call(() -> jdbc.sql("DELETE FROM companies WHERE id = ?").param(id).update());
    if (deleted == 0) {
      throw new ResourceNotFoundException("Company", id);
    }
  }

  private Company mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Company(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        json.read(rs.getString("address"), Address.class),
        json.readMap(rs.getString("custom_fields")),
        SqlValues.instant(rs, "created_at"),
        SqlValues.instant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
