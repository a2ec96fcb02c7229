package io.b2mash.crm.crmcore.deal;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.customfield.CustomFieldValidator;
import io.b2mash.crm.crmcore.customfield.EntityType;
import io.b2mash.crm.crmcore.deal.dto.CreateDealRequest;
import io.b2mash.crm.crmcore.deal.dto.DealTaskRequest;
import io.b2mash.crm.crmcore.deal.dto.UpdateDealRequest;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.exception.ValidationFailedException;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.task.TaskService;
import io.b2mash.crm.crmcore.task.TaskStatus;
import io.b2mash.crm.crmcore.task.dto.CreateTaskRequest;
import io.b2mash.crm.crmcore.transaction.TransactionCoordinator;
import io.b2mash.crm.crmcore.validation.InputValidator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DealService {

  private static final Logger log = LoggerFactory.getLogger(DealService.class);

  private final DealRepository dealRepository;
  private final TaskService taskService;
  private final InputValidator inputValidator;
  private final CustomFieldValidator customFieldValidator;
  private final AuditService auditService;
  private final TransactionCoordinator transactionCoordinator;

  public DealService(
      DealRepository dealRepository,
      TaskService taskService,
      InputValidator inputValidator,
      CustomFieldValidator customFieldValidator,
      AuditService auditService,
      TransactionCoordinator transactionCoordinator) {
    this.dealRepository = dealRepository;
    this.taskService = taskService;
    this.inputValidator = inputValidator;
    this.customFieldValidator = customFieldValidator;
    this.auditService = auditService;
    this.transactionCoordinator = transactionCoordinator;
  }

  public Deal createDeal(CreateDealRequest request, String actingUser) {
    inputValidator.validate(request);
    var customFields =
        customFieldValidator.validateAndClean(EntityType.DEAL, request.customFields());

    var deal = dealRepository.create(request.withCustomFields(customFields), actingUser);
    auditService.logCreate(EntityType.DEAL.value(), deal.id(), actingUser, deal);

    log.info(
        "Created deal: id={}, companyId={}, stage={}, user={}",
        deal.id(),
        deal.companyId(),
        deal.stage(),
        actingUser);
    return deal;
  }

  /**
   * Creates a deal and its open follow-up tasks atomically. Either the deal and every task exist
   * afterwards, or none of them do; each created entity gets its own audit record.
   */
  public DealWithTasks createDealWithTasks(
      CreateDealRequest request, List<DealTaskRequest> tasks, String actingUser) {
    if (tasks == null) {
      throw ValidationFailedException.forField("tasks", "Task list is required");
    }
    tasks.forEach(inputValidator::validate);
    return transactionCoordinator.execute(
        () -> {
          var deal = createDeal(request, actingUser);
          var created =
              tasks.stream()
                  .map(
                      task ->
                          taskService.createTask(
                              new CreateTaskRequest(
                                  task.description(),
                                  task.dueDate(),
                                  task.assignedTo(),
                                  TaskStatus.OPEN,
                                  EntityReference.deal(deal.id())),
                              actingUser))
                  .toList();
          return new DealWithTasks(deal, created);
        });
  }

  public Deal getDeal(UUID id) {
    return dealRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Deal", id));
  }

  public List<Deal> listDeals(DealFilter filter, Pagination pagination) {
    return dealRepository.findAll(filter, pagination);
  }

  public List<Deal> getDealsByCompany(UUID companyId) {
    return dealRepository.findByCompany(companyId);
  }

  public Deal updateDeal(UUID id, UpdateDealRequest request, String actingUser) {
    inputValidator.validate(request);
    var existing = getDeal(id);
    var update = request;
    if (request.getCustomFields().isPresent()) {
      update =
          request.withCustomFields(
              customFieldValidator.validateAndClean(
                  EntityType.DEAL, request.getCustomFields().get()));
    }

    var updated = dealRepository.update(id, update, actingUser);
    auditService.logUpdate(EntityType.DEAL.value(), id, actingUser, existing, updated);

    log.info("Updated deal: id={}, stage={}, user={}", id, updated.stage(), actingUser);
    return updated;
  }

  public void deleteDeal(UUID id, String actingUser) {
    var existing = getDeal(id);

    dealRepository.delete(id, actingUser);
    auditService.logDelete(EntityType.DEAL.value(), id, actingUser, existing);

    log.info("Deleted deal: id={}, user={}", id, actingUser);
  }
}
