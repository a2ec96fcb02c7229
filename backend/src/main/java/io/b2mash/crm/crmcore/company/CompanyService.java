package io.b2mash.crm.crmcore.company;

import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.company.dto.CreateCompanyRequest;
import io.b2mash.crm.crmcore.company.dto.UpdateCompanyRequest;
import io.b2mash.crm.crmcore.customfield.CustomFieldValidator;
import io.b2mash.crm.crmcore.customfield.EntityType;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.validation.InputValidator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CompanyService {

  private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

  private final CompanyRepository companyRepository;
  private final InputValidator inputValidator;
  private final CustomFieldValidator customFieldValidator;
  private final AuditService auditService;

  public CompanyService(
      CompanyRepository companyRepository,
      InputValidator inputValidator,
      CustomFieldValidator customFieldValidator,
      AuditService auditService) {
    this.companyRepository = companyRepository;
    this.inputValidator = inputValidator;
    this.customFieldValidator = customFieldValidator;
    this.auditService = auditService;
  }

  public Company createCompany(CreateCompanyRequest request, String actingUser) {
    inputValidator.validate(request);
    var customFields =
        customFieldValidator.validateAndClean(EntityType.COMPANY, request.customFields());

    var company = companyRepository.create(request.withCustomFields(customFields), actingUser);
    auditService.logCreate(EntityType.COMPANY.value(), company.id(), actingUser, company);

    log.info("Created company: id={}, name={}, user={}", company.id(), company.name(), actingUser);
    return company;
  }

  public Company getCompany(UUID id) {
    return companyRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Company", id));
  }

  public List<Company> listCompanies(CompanyFilter filter, Pagination pagination) {
    return companyRepository.findAll(filter, pagination);
  }

  public Company updateCompany(UUID id, UpdateCompanyRequest request, String actingUser) {
    inputValidator.validate(request);
    var existing = getCompany(id);
    var update = request;
    if (request.getCustomFields().isPresent()) {
      update =
          request.withCustomFields(
              customFieldValidator.validateAndClean(
                  EntityType.COMPANY, request.getCustomFields().get()));
    }

    var updated = companyRepository.update(id, update, actingUser);
    auditService.logUpdate(EntityType.COMPANY.value(), id, actingUser, existing, updated);

    log.info("Updated company: id={}, user={}", id, actingUser);
    return updated;
  }

  /** Cascades to the company's deals and detaches its contacts. */
  public void deleteCompany(UUID id, String actingUser) {
    var existing = getCompany(id);

    companyRepository.delete(id, actingUser);
    auditService.logDelete(EntityType.COMPANY.value(), id, actingUser, existing);

    log.info("Deleted company: id={}, user={}", id, actingUser);
  }
}
