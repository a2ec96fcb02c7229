package io.b2mash.crm.crmcore.contact;

import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.contact.dto.CreateContactRequest;
import io.b2mash.crm.crmcore.contact.dto.UpdateContactRequest;
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
public class ContactService {

  private static final Logger log = LoggerFactory.getLogger(ContactService.class);

  private final ContactRepository contactRepository;
  private final InputValidator inputValidator;
  private final CustomFieldValidator customFieldValidator;
  private final AuditService auditService;

  public ContactService(
      ContactRepository contactRepository,
      InputValidator inputValidator,
      CustomFieldValidator customFieldValidator,
      AuditService auditService) {
    this.contactRepository = contactRepository;
    this.inputValidator = inputValidator;
    this.customFieldValidator = customFieldValidator;
    this.auditService = auditService;
  }

  public Contact createContact(CreateContactRequest request, String actingUser) {
    inputValidator.validate(request);
    var customFields =
        customFieldValidator.validateAndClean(EntityType.CONTACT, request.customFields());

    var contact = contactRepository.create(request.withCustomFields(customFields), actingUser);
    auditService.logCreate(EntityType.CONTACT.value(), contact.id(), actingUser, contact);

    log.info(
        "Created contact: id={}, companyId={}, user={}",
        contact.id(),
        contact.companyId(),
        actingUser);
    return contact;
  }

  public Contact getContact(UUID id) {
    return contactRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Contact", id));
  }

  public List<Contact> listContacts(ContactFilter filter, Pagination pagination) {
    return contactRepository.findAll(filter, pagination);
  }

  public List<Contact> getContactsByCompany(UUID companyId) {
    return contactRepository.findByCompany(companyId);
  }

  public Contact updateContact(UUID id, UpdateContactRequest request, String actingUser) {
    inputValidator.validate(request);
    var existing = getContact(id);
    var update = request;
    if (request.getCustomFields().isPresent()) {
      update =
          request.withCustomFields(
              customFieldValidator.validateAndClean(
                  EntityType.CONTACT, request.getCustomFields().get()));
    }

    var updated = contactRepository.update(id, update, actingUser);
    auditService.logUpdate(EntityType.CONTACT.value(), id, actingUser, existing, updated);

    log.info("Updated contact: id={}, user={}", id, actingUser);
    return updated;
  }

  /** Deals referencing the contact keep existing with their contact reference cleared. */
  public void deleteContact(UUID id, String actingUser) {
    var existing = getContact(id);

    contactRepository.delete(id, actingUser);
    auditService.logDelete(EntityType.CONTACT.value(), id, actingUser, existing);

    log.info("Deleted contact: id={}, user={}", id, actingUser);
  }
}
