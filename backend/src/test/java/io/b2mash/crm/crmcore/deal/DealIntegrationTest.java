package io.b2mash.crm.crmcore.deal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.crm.crmcore.TestcontainersConfiguration;
import io.b2mash.crm.crmcore.company.CompanyService;
import io.b2mash.crm.crmcore.company.dto.CreateCompanyRequest;
import io.b2mash.crm.crmcore.contact.ContactService;
import io.b2mash.crm.crmcore.contact.dto.CreateContactRequest;
import io.b2mash.crm.crmcore.deal.dto.CreateDealRequest;
import io.b2mash.crm.crmcore.deal.dto.UpdateDealRequest;
import io.b2mash.crm.crmcore.exception.ResourceConflictException;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
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
class DealIntegrationTest {

  private static final String USER = "user_deal_test";

  @Autowired private DealService dealService;
  @Autowired private DealRepository dealRepository;
  @Autowired private CompanyService companyService;
  @Autowired private ContactService contactService;

  private UUID companyId;

  @BeforeAll
  void createCompany() {
    companyId =
        companyService
            .createCompany(CreateCompanyRequest.named("Deal Co " + UUID.randomUUID()), USER)
            .id();
  }

  @Test
  void currencyDefaultsToUsdAndValuesRoundTrip() {
    var created =
        dealService.createDeal(
            new CreateDealRequest(
                "Renewal",
                companyId,
                null,
                new BigDecimal("2500.75"),
                null,
                "proposal",
                60,
                LocalDate.of(2030, 6, 30),
                null),
            USER);

    var fetched = dealService.getDeal(created.id());
    assertThat(fetched.currency()).isEqualTo("USD");
    assertThat(fetched.value()).isEqualByComparingTo("2500.75");
    assertThat(fetched.probability()).isEqualTo(60);
    assertThat(fetched.closeDate()).isEqualTo(LocalDate.of(2030, 6, 30));
    assertThat(fetched.customFields()).isEmpty();
  }

  @Test
  void outOfRangeProbabilityIsRejectedByServiceValidation() {
    assertThatThrownBy(
            () ->
                dealService.createDeal(
                    CreateDealRequest.of("Too Sure", companyId, BigDecimal.ONE, "lead", 150),
                    USER))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> assertThat(e.getFieldErrors()).containsKey("probability"));
  }

  @Test
  void outOfRangeProbabilityReachingTheStoreIsAConstraintViolation() {
    assertThatThrownBy(
            () ->
                dealRepository.create(
                    CreateDealRequest.of("Bypass", companyId, BigDecimal.ONE, "lead", 150), USER))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            e -> {
              assertThat(e.getConstraint()).isEqualTo("deals_probability_check");
              assertThat(e.getBody().getDetail())
                  .isEqualTo("Probability must be between 0 and 100");
            });
  }

  @Test
  void unknownCompanyIsReportedAsMissingReference() {
    assertThatThrownBy(
            () ->
                dealService.createDeal(
                    CreateDealRequest.of("Nowhere", UUID.randomUUID(), BigDecimal.ONE, "lead", 5),
                    USER))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            e ->
                assertThat(e.getBody().getDetail())
                    .isEqualTo("Referenced company does not exist"));
  }

  @Test
  void deletingContactClearsDealContact() {
    var contact =
        contactService.createContact(CreateContactRequest.of("Pat", "Lee", companyId), USER);
    var deal =
        dealService.createDeal(
            CreateDealRequest.of("With Contact", companyId, BigDecimal.TEN, "lead", 20)
                .withContact(contact.id()),
            USER);

    contactService.deleteContact(contact.id(), USER);

    var fetched = dealService.getDeal(deal.id());
    assertThat(fetched.contactId()).isNull();
    assertThat(fetched.companyId()).isEqualTo(companyId);
  }

  @Test
  void dealsCanBeFilteredByStageAndContact() {
    var company =
        companyService.createCompany(
            CreateCompanyRequest.named("Filter Co " + UUID.randomUUID()), USER);
    var contact =
        contactService.createContact(CreateContactRequest.of("Sam", "Ray", company.id()), USER);
    var lead =
        dealService.createDeal(
            CreateDealRequest.of("Lead", company.id(), BigDecimal.ONE, "lead", 10), USER);
    var won =
        dealService.createDeal(
            CreateDealRequest.of("Won", company.id(), BigDecimal.ONE, "won", 100)
                .withContact(contact.id()),
            USER);

    assertThat(dealService.listDeals(DealFilter.byCompany(company.id()).withStage("won"), null))
        .extracting(Deal::id)
        .containsExactly(won.id());
    assertThat(dealService.listDeals(DealFilter.none().withContact(contact.id()), null))
        .extracting(Deal::id)
        .containsExactly(won.id());
    assertThat(dealService.getDealsByCompany(company.id()))
        .extracting(Deal::id)
        .containsExactly(won.id(), lead.id());
  }

  @Test
  void updateMovesStageAndRejectsUnknownId() {
    var deal =
        dealService.createDeal(
            CreateDealRequest.of("Progressing", companyId, BigDecimal.ONE, "lead", 10), USER);

    var updated =
        dealService.updateDeal(
            deal.id(), new UpdateDealRequest().stage("negotiation").probability(75), USER);

    assertThat(updated.stage()).isEqualTo("negotiation");
    assertThat(updated.probability()).isEqualTo(75);
    assertThat(updated.title()).isEqualTo("Progressing");

    assertThatThrownBy(
            () ->
                dealService.updateDeal(
                    UUID.randomUUID(), new UpdateDealRequest().stage("won"), USER))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void deleteRemovesDeal() {
    var deal =
        dealService.createDeal(
            CreateDealRequest.of("Short", companyId, BigDecimal.ONE, "lead", 10), USER);

    dealService.deleteDeal(deal.id(), USER);

    assertThatThrownBy(() -> dealService.getDeal(deal.id()))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThatThrownBy(() -> dealService.deleteDeal(deal.id(), USER))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
