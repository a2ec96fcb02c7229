package io.b2mash.crm.crmcore.company;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.crm.crmcore.TestcontainersConfiguration;
import io.b2mash.crm.crmcore.company.dto.CreateCompanyRequest;
import io.b2mash.crm.crmcore.company.dto.UpdateCompanyRequest;
import io.b2mash.crm.crmcore.contact.ContactFilter;
import io.b2mash.crm.crmcore.contact.ContactService;
import io.b2mash.crm.crmcore.contact.dto.CreateContactRequest;
import io.b2mash.crm.crmcore.contact.dto.UpdateContactRequest;
import io.b2mash.crm.crmcore.deal.DealService;
import io.b2mash.crm.crmcore.deal.dto.CreateDealRequest;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import io.b2mash.crm.crmcore.repository.Pagination;
import java.math.BigDecimal;
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
class CompanyContactIntegrationTest {

  private static final String USER = "user_company_test";

  @Autowired private CompanyService companyService;
  @Autowired private ContactService contactService;
  @Autowired private DealService dealService;

  @Test
  void contactFilteredByCompanySurvivesCompanyDeletion() {
    var acme = companyService.createCompany(CreateCompanyRequest.named("Acme"), USER);
    var john =
        contactService.createContact(CreateContactRequest.of("John", "Doe", acme.id()), USER);

    var contacts = contactService.listContacts(ContactFilter.byCompany(acme.id()), null);
    assertThat(contacts).hasSize(1);
    assertThat(contacts.get(0).firstName()).isEqualTo("John");

    companyService.deleteCompany(acme.id(), USER);

    var reloaded = contactService.getContact(john.id());
    assertThat(reloaded.companyId()).isNull();
  }

  @Test
  void deletingCompanyDeletesDealsAndDetachesContacts() {
    var company = companyService.createCompany(CreateCompanyRequest.named(unique("Cascade")), USER);
    var contactIds =
        List.of("Ann", "Ben", "Cid").stream()
            .map(
                name ->
                    contactService
                        .createContact(CreateContactRequest.of(name, "Smith", company.id()), USER)
                        .id())
            .toList();
    var dealIds =
        List.of("Renewal", "Upsell").stream()
            .map(
                title ->
                    dealService
                        .createDeal(
                            CreateDealRequest.of(
                                title, company.id(), new BigDecimal("1000.00"), "lead", 20),
                            USER)
                        .id())
            .toList();

    companyService.deleteCompany(company.id(), USER);

    for (UUID dealId : dealIds) {
      assertThatThrownBy(() -> dealService.getDeal(dealId))
          .isInstanceOf(ResourceNotFoundException.class);
    }
    for (UUID contactId : contactIds) {
      assertThat(contactService.getContact(contactId).companyId()).isNull();
    }
    assertThat(dealService.getDealsByCompany(company.id())).isEmpty();
  }

  @Test
  void createdCompanyRoundTripsEveryField() {
    var address = new Address("1 Main St", "Springfield", "IL", "62701", "US");
    var created =
        companyService.createCompany(
            new CreateCompanyRequest(unique("Globex"), address, Map.of()), USER);

    var fetched = companyService.getCompany(created.id());

    assertThat(fetched).isEqualTo(created);
    assertThat(fetched.address()).isEqualTo(address);
    assertThat(fetched.customFields()).isEmpty();
    assertThat(fetched.createdBy()).isEqualTo(USER);
    assertThat(fetched.updatedBy()).isEqualTo(USER);
  }

  @Test
  void emptyUpdateKeepsModificationTimestamp() {
    var created = companyService.createCompany(CreateCompanyRequest.named(unique("Idle")), USER);

    var result = companyService.updateCompany(created.id(), new UpdateCompanyRequest(), "other");

    assertThat(result).isEqualTo(created);
    assertThat(companyService.getCompany(created.id()).updatedAt())
        .isEqualTo(created.updatedAt());
  }

  @Test
  void nonEmptyUpdateAdvancesModificationTimestamp() {
    var created = companyService.createCompany(CreateCompanyRequest.named(unique("Busy")), USER);

    var updated =
        companyService.updateCompany(
            created.id(), new UpdateCompanyRequest().name("Busy Renamed"), "editor");

    assertThat(updated.name()).isEqualTo("Busy Renamed");
    assertThat(updated.updatedAt()).isAfter(created.updatedAt());
    assertThat(updated.updatedBy()).isEqualTo("editor");
    assertThat(updated.createdAt()).isEqualTo(created.createdAt());
  }

  @Test
  void updatingUnknownCompanyThrowsNotFound() {
    var id = UUID.randomUUID();

    assertThatThrownBy(
            () -> companyService.updateCompany(id, new UpdateCompanyRequest().name("X"), USER))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> {
              assertThat(e.getEntityType()).isEqualTo("Company");
              assertThat(e.getEntityId()).isEqualTo(id);
            });
  }

  @Test
  void nameFilterIsCaseInsensitiveSubstringWithLiteralWildcards() {
    String token = UUID.randomUUID().toString().substring(0, 8);
    companyService.createCompany(
        CreateCompanyRequest.named("Wayne " + token + " Enterprises"), USER);
    companyService.createCompany(CreateCompanyRequest.named("100% " + token), USER);

    assertThat(companyService.listCompanies(new CompanyFilter(token.toUpperCase()), null))
        .hasSize(2);
    assertThat(companyService.listCompanies(new CompanyFilter("100% " + token), null))
        .extracting(Company::name)
        .containsExactly("100% " + token);
    assertThat(companyService.listCompanies(new CompanyFilter("_" + token), null)).isEmpty();
  }

  @Test
  void listIsNewestFirstAndPaginated() {
    String token = unique("Page");
    var first = companyService.createCompany(CreateCompanyRequest.named(token + " A"), USER);
    var second = companyService.createCompany(CreateCompanyRequest.named(token + " B"), USER);
    var third = companyService.createCompany(CreateCompanyRequest.named(token + " C"), USER);

    var all = companyService.listCompanies(new CompanyFilter(token), null);
    assertThat(all)
        .extracting(Company::id)
        .containsExactly(third.id(), second.id(), first.id());

    var page = companyService.listCompanies(new CompanyFilter(token), Pagination.of(1, 1));
    assertThat(page).extracting(Company::id).containsExactly(second.id());
  }

  @Test
  void blankNameIsRejectedBeforeStorage() {
    assertThatThrownBy(
            () -> companyService.createCompany(CreateCompanyRequest.named(" "), USER))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            e -> assertThat(e.getFieldErrors()).containsKey("name"));
  }

  @Test
  void contactEmailsAreValidatedAndFilterable() {
    String email = unique("jane").toLowerCase() + "@example.test";
    var contact =
        contactService.createContact(
            CreateContactRequest.of("Jane", "Roe", null).withEmails(List.of(email)), USER);

    assertThat(contactService.listContacts(ContactFilter.byEmail(email), null))
        .extracting(c -> c.id())
        .containsExactly(contact.id());

    assertThatThrownBy(
            () ->
                contactService.updateContact(
                    contact.id(), new UpdateContactRequest().emails(List.of("not-an-email")), USER))
        .isInstanceOf(ValidationFailedException.class);
  }

  private static String unique(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
