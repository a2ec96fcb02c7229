package io.b2mash.crm.crmcore.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.crm.crmcore.TestcontainersConfiguration;
import io.b2mash.crm.crmcore.company.Address;
import io.b2mash.crm.crmcore.company.CompanyService;
import io.b2mash.crm.crmcore.company.dto.CreateCompanyRequest;
import io.b2mash.crm.crmcore.company.dto.UpdateCompanyRequest;
import io.b2mash.crm.crmcore.repository.Pagination;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AuditIntegrationTest {

  @Autowired private CompanyService companyService;
  @Autowired private AuditService auditService;
  @Autowired private JdbcClient jdbc;

  @Test
  void everyMutationWritesOneRecordWithActionAndUser() {
    var company =
        companyService.createCompany(CreateCompanyRequest.named("Audited Co"), "creator");
    companyService.updateCompany(
        company.id(), new UpdateCompanyRequest().name("Audited Co Ltd"), "editor");
    companyService.deleteCompany(company.id(), "remover");

    var logs = auditService.findByEntity("company", company.id(), null);

    assertThat(logs)
        .extracting(AuditLog::action, AuditLog::userId)
        .containsExactly(
            tuple(AuditAction.DELETE, "remover"),
            tuple(AuditAction.UPDATE, "editor"),
            tuple(AuditAction.CREATE, "creator"));
    assertThat(logs).allSatisfy(l -> assertThat(l.timestamp()).isNotNull());
  }

  @Test
  @SuppressWarnings("unchecked")
  void createAndDeleteRecordsCarryFullSnapshot() {
    var company =
        companyService.createCompany(CreateCompanyRequest.named("Snapshot Co"), "creator");
    companyService.deleteCompany(company.id(), "remover");

    var logs = auditService.findByEntity("company", company.id(), null);
    var deleted = (Map<String, Object>) logs.get(0).changes().get("deleted");
    var created = (Map<String, Object>) logs.get(1).changes().get("created");

    assertThat(created).containsEntry("name", "Snapshot Co").containsKey("id");
    assertThat(deleted)
        .containsEntry("name", "Snapshot Co")
        .containsEntry("id", company.id().toString());
  }

  @Test
  void updateDiffHoldsOnlyChangedBusinessFields() {
    var company =
        companyService.createCompany(CreateCompanyRequest.named("Diff Co"), "creator");

    companyService.updateCompany(
        company.id(),
        new UpdateCompanyRequest()
            .name("Diff Co Renamed")
            .address(new Address("1 Main St", "Springfield", null, null, "US")),
        "editor");

    var update = auditService.findByEntity("company", company.id(), null).get(0);
    assertThat(update.action()).isEqualTo(AuditAction.UPDATE);
    assertThat(update.changes()).containsOnlyKeys("name", "address");
    assertThat(update.changes().get("name"))
        .isEqualTo(Map.of("before", "Diff Co", "after", "Diff Co Renamed"));
  }

  @Test
  void updateThatChangesNothingWritesNoRecord() {
    var company =
        companyService.createCompany(CreateCompanyRequest.named("Steady Co"), "creator");

    companyService.updateCompany(
        company.id(), new UpdateCompanyRequest().name("Steady Co"), "editor");
    companyService.updateCompany(company.id(), new UpdateCompanyRequest(), "editor");

    assertThat(auditService.findByEntity("company", company.id(), null))
        .extracting(AuditLog::action)
        .containsExactly(AuditAction.CREATE);
  }

  @Test
  void logsCanBeQueriedByUserActionAndTimeRange() {
    String user = "auditor-" + UUID.randomUUID();
    Instant before = Instant.now().minusSeconds(60);
    var first = companyService.createCompany(CreateCompanyRequest.named("One Co"), user);
    var second = companyService.createCompany(CreateCompanyRequest.named("Two Co"), user);
    companyService.deleteCompany(first.id(), user);

    assertThat(auditService.findByUser(user, null)).hasSize(3);
    assertThat(auditService.findByUser(user, Pagination.of(1, 0)))
        .singleElement()
        .extracting(AuditLog::action)
        .isEqualTo(AuditAction.DELETE);
    assertThat(
            auditService.findLogs(
                new AuditLogFilter("company", null, AuditAction.CREATE, user, before, null),
                null))
        .extracting(AuditLog::entityId)
        .containsExactly(second.id(), first.id());
    assertThat(
            auditService.findLogs(
                new AuditLogFilter(null, null, null, user, null, before), null))
        .isEmpty();
  }

  @Test
  void auditRecordsCannotBeModifiedOrDeleted() {
    var company =
        companyService.createCompany(CreateCompanyRequest.named("Immutable Co"), "creator");
    var record = auditService.findByEntity("company", company.id(), null).get(0);

    assertThatThrownBy(
            () ->
                jdbc.sql("UPDATE audit_logs SET user_id = 'tamper' WHERE id = ?")
                    .param(record.id())
                    .update())
        .isInstanceOf(DataAccessException.class);
    assertThatThrownBy(
            () -> jdbc.sql("DELETE FROM audit_logs WHERE id = ?").param(record.id()).update())
        .isInstanceOf(DataAccessException.class);

    assertThat(auditService.findByEntity("company", company.id(), null))
        .singleElement()
        .extracting(AuditLog::userId)
        .isEqualTo("creator");
  }
}
