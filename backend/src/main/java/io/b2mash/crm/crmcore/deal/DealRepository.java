package io.b2mash.crm.crmcore.deal;

import static io.b2mash.crm.crmcore.repository.DatabaseErrorTranslator.call;

import io.b2mash.crm.crmcore.deal.dto.CreateDealRequest;
import io.b2mash.crm.crmcore.deal.dto.UpdateDealRequest;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.repository.ColumnAssignments;
import io.b2mash.crm.crmcore.repository.EntityRepository;
import io.b2mash.crm.crmcore.repository.FilterConditions;
import io.b2mash.crm.crmcore.repository.JsonColumnMapper;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.repository.SqlValues;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class DealRepository
    implements EntityRepository<Deal, CreateDealRequest, UpdateDealRequest, DealFilter> {

  private static final String TABLE = "deals";

  private final JdbcClient jdbc;
  private final JsonColumnMapper json;

  public DealRepository(JdbcClient jdbc, JsonColumnMapper json) {
    this.jdbc = jdbc;
    this.json = json;
  }

  @Override
  public Deal create(CreateDealRequest input, String actingUser) {
    var currency =
        input.currency() != null ? input.currency() : CreateDealRequest.DEFAULT_CURRENCY;
    var customFields = input.customFields() != null ? input.customFields() : Map.of();
    return call(
        () ->
            jdbc.sql(
                    """
                    INSERT INTO deals
                        (title, company_id, contact_id, value, currency, stage, probability,
                         close_date, custom_fields, created_by, updated_by)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?)
                    RETURNING *
                    """)
                .params(
                    input.title(),
                    input.companyId(),
                    input.contactId(),
                    input.value(),
                    currency,
                    input.stage(),
                    input.probability(),
                    input.closeDate(),
                    json.write(customFields),
                    actingUser,
                    actingUser)
                .query(this::mapRow)
                .single());
  }

  @Override
  public Optional<Deal> findById(UUID id) {
    return call(
        () ->
            jdbc.sql("SELECT * FROM deals WHERE id = ?")
                .param(id)
                .query(this::mapRow)
                .optional());
  }

  @Override
  public List<Deal> findAll(DealFilter filter, Pagination pagination) {
    var conditions = new FilterConditions();
    if (filter != null) {
      conditions
          .equal("company_id", filter.companyId())
          .equal("contact_id", filter.contactId())
          .equalIfSet("stage", filter.stage());
    }
    String sql = conditions.toSelectSql(TABLE, "created_at", pagination);
    return call(() -> jdbc.sql(sql).params(conditions.params()).query(this::mapRow).list());
  }

  public List<Deal> findByCompany(UUID companyId) {
    return findAll(DealFilter.byCompany(companyId), null);
  }

  @Override
  public Deal update(UUID id, UpdateDealRequest update, String actingUser) {
    var assignments =
        new ColumnAssignments()
            .set("title", update.getTitle())
            .set("company_id", update.getCompanyId())
            .set("contact_id", update.getContactId())
            .set("value", update.getValue())
            .set("currency", update.getCurrency())
            .set("stage", update.getStage())
            .set("probability", update.getProbability())
            .set("close_date", update.getCloseDate())
            .setJson("custom_fields", update.getCustomFields(), json::write);
    if (assignments.isEmpty()) {
      return findById(id).orElseThrow(() -> new ResourceNotFoundException("Deal", id));
    }
    return call(
            () ->
                jdbc.sql(assignments.toUpdateSql(TABLE))
                    .params(assignments.params(actingUser, id))
                    .query(this::mapRow)
                    .optional())
        .orElseThrow(() -> new ResourceNotFoundException("Deal", id));
  }

  @Override
  public void delete(UUID id, String actingUser) {
    int deleted = call(() -> jdbc.sql("DELETE FROM deals WHERE id = ?").param(id).update());
    if (deleted == 0) {
      throw new ResourceNotFoundException("Deal", id);
    }
  }

  private Deal mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Deal(
        rs.getObject("id", UUID.class),
        rs.getString("title"),
        rs.getObject("company_id", UUID.class),
        rs.getObject("contact_id", UUID.class),
        rs.getBigDecimal("value"),
        rs.getString("currency"),
        rs.getString("stage"),
        rs.getInt("probability"),
        rs.getObject("close_date", LocalDate.class),
        json.readMap(rs.getString("custom_fields")),
        SqlValues.instant(rs, "created_at"),
        SqlValues.instant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
