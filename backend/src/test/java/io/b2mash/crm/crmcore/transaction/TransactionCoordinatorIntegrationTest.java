package io.b2mash.crm.crmcore.transaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.crm.crmcore.TestcontainersConfiguration;
import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.audit.AuditAction;
import io.b2mash.crm.crmcore.audit.AuditLog;
import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.company.CompanyFilter;
import io.b2mash.crm.crmcore.company.CompanyService;
import io.b2mash.crm.crmcore.company.dto.CreateCompanyRequest;
import io.b2mash.crm.crmcore.deal.DealFilter;
import io.b2mash.crm.crmcore.deal.DealService;
import io.b2mash.crm.crmcore.deal.dto.CreateDealRequest;
import io.b2mash.crm.crmcore.deal.dto.DealTaskRequest;
import io.b2mash.crm.crmcore.exception.DatabaseOperationException;
import io.b2mash.crm.crmcore.exception.ResourceConflictException;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import io.b2mash.crm.crmcore.task.Task;
import io.b2mash.crm.crmcore.task.TaskService;
import io.b2mash.crm.crmcore.task.TaskStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TransactionCoordinatorIntegrationTest {

  private static final String USER = "user_tx_test";

  @Autowired private TransactionCoordinator coordinator;
  @Autowired private CompanyService companyService;
  @Autowired private DealService dealService;
  @Autowired private TaskService taskService;
  @Autowired private AuditService auditService;
  @Autowired private HikariDataSource dataSource;

  @Test
  void commitsEveryStepWhenCallbackSucceeds() {
    String name = unique("Committed");

    var companyId =
        coordinator.execute(
            () -> {
              var company = companyService.createCompany(CreateCompanyRequest.named(name), USER);
              dealService.createDeal(
                  CreateDealRequest.of("Pilot", company.id(), new BigDecimal("500"), "lead", 10),
                  USER);
              return company.id();
            });

    assertThat(dealService.getDealsByCompany(companyId)).hasSize(1);
    assertThat(auditService.findByEntity("company", companyId, null)).hasSize(1);
    assertThat(dataSource.getHikariPoolMXBean().getActiveConnections()).isZero();
  }

  @Test
  void rollsBackEveryStepIncludingAuditWhenCallbackThrows() {
    String name = unique("Rolled Back");
    var createdIds = new ArrayList<UUID>();

    assertThatThrownBy(
            () ->
                coordinator.executeWithoutResult(
                    () -> {
                      var company =
                          companyService.createCompany(CreateCompanyRequest.named(name), USER);
                      createdIds.add(company.id());
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOfSatisfying(
            DatabaseOperationException.class,
            e -> {
              assertThat(e.getBody().getDetail()).isEqualTo("Transaction failed");
              assertThat(e).hasCauseInstanceOf(IllegalStateException.class);
            });

    assertThat(companyService.listCompanies(new CompanyFilter(name), null)).isEmpty();
    assertThat(auditService.findByEntity("company", createdIds.get(0), null)).isEmpty();
    assertThat(dataSource.getHikariPoolMXBean().getActiveConnections()).isZero();
  }

  @Test
  void domainFailuresPassThroughUnchanged() {
    var missing = new ResourceNotFoundException("Company", UUID.randomUUID());

    assertThatThrownBy(
            () ->
                coordinator.execute(
                    () -> {
                      throw missing;
                    }))
        .isSameAs(missing);
    assertThat(dataSource.getHikariPoolMXBean().getActiveConnections()).isZero();
  }

  @Test
  void storeFailureInsideCallbackIsTranslatedAndRolledBack() {
    String name = unique("Orphan Deal");

    assertThatThrownBy(
            () ->
                coordinator.execute(
                    () -> {
                      companyService.createCompany(CreateCompanyRequest.named(name), USER);
                      return dealService.createDeal(
                          CreateDealRequest.of(
                              "Ghost", UUID.randomUUID(), BigDecimal.ONE, "lead", 5),
                          USER);
                    }))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            e ->
                assertThat(e.getBody().getDetail())
                    .isEqualTo("Referenced company does not exist"));

    assertThat(companyService.listCompanies(new CompanyFilter(name), null)).isEmpty();
  }

  @Test
  void nestedCallsJoinTheOuterTransaction() {
    String name = unique("Nested");

    assertThatThrownBy(
            () ->
                coordinator.executeWithoutResult(
                    () -> {
                      coordinator.execute(
                          () ->
                              companyService.createCompany(
                                  CreateCompanyRequest.named(name), USER));
                      throw new IllegalStateException("outer failure");
                    }))
        .isInstanceOf(DatabaseOperationException.class);

    assertThat(companyService.listCompanies(new CompanyFilter(name), null)).isEmpty();
  }

  @Test
  void dealWithTasksIsCreatedAtomicallyAndAudited() {
    var company = companyService.createCompany(CreateCompanyRequest.named(unique("Bundle")), USER);

    var result =
        dealService.createDealWithTasks(
            CreateDealRequest.of(
                "Expansion", company.id(), new BigDecimal("12000.50"), "won", 100),
            List.of(
                new DealTaskRequest("Send contract", LocalDate.of(2030, 2, 1), "alice"),
                new DealTaskRequest("Schedule onboarding", null, null)),
            USER);

    var dealRef = EntityReference.deal(result.deal().id());
    assertThat(result.tasks())
        .allSatisfy(
            t -> {
              assertThat(t.status()).isEqualTo(TaskStatus.OPEN);
              assertThat(t.attachedTo()).isEqualTo(dealRef);
            });
    assertThat(taskService.getTasksByEntity(dealRef))
        .extracting(Task::id)
        .containsExactlyInAnyOrderElementsOf(result.tasks().stream().map(Task::id).toList());
    assertThat(auditService.findByEntity("deal", result.deal().id(), null))
        .extracting(AuditLog::action)
        .containsExactly(AuditAction.CREATE);
    assertThat(auditService.findByEntity("task", result.tasks().get(0).id(), null)).hasSize(1);
  }

  @Test
  void dealWithTasksLeavesNothingBehindOnFailure() {
    var company = companyService.createCompany(CreateCompanyRequest.named(unique("Failed")), USER);

    assertThatThrownBy(
            () ->
                dealService.createDealWithTasks(
                    CreateDealRequest.of("Doomed", company.id(), BigDecimal.TEN, "lead", 20)
                        .withCustomFields(Map.of("undefined_field", "x")),
                    List.of(new DealTaskRequest("Never created", null, null)),
                    USER))
        .isInstanceOf(ValidationFailedException.class);

    assertThat(dealService.listDeals(DealFilter.byCompany(company.id()), null)).isEmpty();
  }

  private static String unique(String prefix) {
    return prefix + " " + UUID.randomUUID();
  }
}
