package io.b2mash.crm.crmcore.customfield;

import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.customfield.dto.CreateCustomFieldDefinitionRequest;
import io.b2mash.crm.crmcore.customfield.dto.UpdateCustomFieldDefinitionRequest;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.transaction.TransactionCoordinator;
import io.b2mash.crm.crmcore.validation.InputValidator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CustomFieldService {

  static final String AUDIT_ENTITY_TYPE = "custom_field_definition";

  private static final Logger log = LoggerFactory.getLogger(CustomFieldService.class);

  private final CustomFieldDefinitionRepository definitionRepository;
  private final InputValidator inputValidator;
  private final AuditService auditService;
  private final TransactionCoordinator transactionCoordinator;

  public CustomFieldService(
      CustomFieldDefinitionRepository definitionRepository,
      InputValidator inputValidator,
      AuditService auditService,
      TransactionCoordinator transactionCoordinator) {
    this.definitionRepository = definitionRepository;
    this.inputValidator = inputValidator;
    this.auditService = auditService;
    this.transactionCoordinator = transactionCoordinator;
  }

  public CustomFieldDefinition createCustomFieldDefinition(
      CreateCustomFieldDefinitionRequest request, String actingUser) {
    inputValidator.validate(request);
    checkEnumValues(request);

    var definition = definitionRepository.create(request, actingUser);
    auditService.logCreate(AUDIT_ENTITY_TYPE, definition.id(), actingUser, definition);

    log.info(
        "Created custom field definition: id={}, entityType={}, name={}, user={}",
        definition.id(),
        definition.entityType().value(),
        definition.name(),
        actingUser);
    return definition;
  }

  public CustomFieldDefinition getCustomFieldDefinition(UUID id) {
    return definitionRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("CustomField", id));
  }

  /**
   * @param entityType restrict to one entity type, or {@code null} for all
   */
  public List<CustomFieldDefinition> listCustomFieldDefinitions(
      EntityType entityType, Pagination pagination) {
    return definitionRepository.findAll(entityType, pagination);
  }

  public List<CustomFieldDefinition> getCustomFieldDefinitionsByEntityType(EntityType entityType) {
    return definitionRepository.findByEntityType(entityType);
  }

  /** Changes label and/or required flag. Name and kind are immutable. */
  public CustomFieldDefinition updateCustomFieldDefinition(
      UUID id, UpdateCustomFieldDefinitionRequest request, String actingUser) {
    inputValidator.validate(request);
    var existing = getCustomFieldDefinition(id);

    var updated = definitionRepository.update(id, request, actingUser);
    auditService.logUpdate(AUDIT_ENTITY_TYPE, id, actingUser, existing, updated);

    log.info("Updated custom field definition: id={}, user={}", id, actingUser);
    return updated;
  }

  /**
   * Deletes the definition and strips its key from the custom fields of every entity of the
   * target type, in one transaction.
   */
  public void deleteCustomFieldDefinition(UUID id, String actingUser) {
    var existing = getCustomFieldDefinition(id);

    int stripped =
        transactionCoordinator.execute(
            () -> {
              definitionRepository.delete(id, actingUser);
              int rows =
                  definitionRepository.removeFieldFromEntities(
                      existing.entityType(), existing.name());
              auditService.logDelete(AUDIT_ENTITY_TYPE, id, actingUser, existing);
              return rows;
            });

    log.info(
        "Deleted custom field definition: id={}, name={}, strippedFrom={} {}, user={}",
        id,
        existing.name(),
        stripped,
        existing.entityType().tableName(),
        actingUser);
  }

  private static void checkEnumValues(CreateCustomFieldDefinitionRequest request) {
    boolean hasValues = request.enumValues() != null && !request.enumValues().isEmpty();
    if (request.fieldType() == CustomFieldType.ENUM && !hasValues) {
      throw ValidationFailedException.forField(
          "enumValues", "enumValues must be provided for enum field type");
    }
    if (request.fieldType() != CustomFieldType.ENUM && request.enumValues() != null) {
      throw ValidationFailedException.forField(
          "enumValues", "enumValues are only allowed for enum field type");
    }
  }
}
