package io.b2mash.crm.crmcore.task;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.audit.AuditService;
import io.b2mash.crm.crmcore.exception.ResourceNotFoundException;
import io.b2mash.crm.crmcore.repository.Pagination;
import io.b2mash.crm.crmcore.task.dto.CreateTaskRequest;
import io.b2mash.crm.crmcore.task.dto.UpdateTaskRequest;
import io.b2mash.crm.crmcore.validation.InputValidator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TaskService {

  static final String AUDIT_ENTITY_TYPE = "task";

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final InputValidator inputValidator;
  private final AuditService auditService;

  public TaskService(
      TaskRepository taskRepository, InputValidator inputValidator, AuditService auditService) {
    this.taskRepository = taskRepository;
    this.inputValidator = inputValidator;
    this.auditService = auditService;
  }

  public Task createTask(CreateTaskRequest request, String actingUser) {
    inputValidator.validate(request);

    var task = taskRepository.create(request, actingUser);
    auditService.logCreate(AUDIT_ENTITY_TYPE, task.id(), actingUser, task);

    log.info(
        "Created task: id={}, attachedTo={}, user={}", task.id(), task.attachedTo(), actingUser);
    return task;
  }

  public Task getTask(UUID id) {
    return taskRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Task", id));
  }

  public List<Task> listTasks(TaskFilter filter, Pagination pagination) {
    return taskRepository.findAll(filter, pagination);
  }

  public List<Task> getTasksByEntity(EntityReference entity) {
    return taskRepository.findByEntity(entity);
  }

  public Task updateTask(UUID id, UpdateTaskRequest request, String actingUser) {
    inputValidator.validate(request);
    var existing = getTask(id);

    var updated = taskRepository.update(id, request, actingUser);
    auditService.logUpdate(AUDIT_ENTITY_TYPE, id, actingUser, existing, updated);

    log.info("Updated task: id={}, status={}, user={}", id, updated.status().value(), actingUser);
    return updated;
  }

  public void deleteTask(UUID id, String actingUser) {
    var existing = getTask(id);

    taskRepository.delete(id, actingUser);
    auditService.logDelete(AUDIT_ENTITY_TYPE, id, actingUser, existing);

    log.info("Deleted task: id={}, user={}", id, actingUser);
  }
}
