package io.b2mash.crm.crmcore.task.dto;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.task.TaskStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import org.openapitools.jackson.nullable.JsonNullable;

public class UpdateTaskRequest {

  @NotBlank private JsonNullable<String> description = JsonNullable.undefined();

  private JsonNullable<LocalDate> dueDate = JsonNullable.undefined();

  @Size(max = 255)
  private JsonNullable<String> assignedTo = JsonNullable.undefined();

  @NotNull private JsonNullable<TaskStatus> status = JsonNullable.undefined();

  /** Moving a task to another entity; both parts are required when present. */
  @NotNull @Valid private JsonNullable<EntityReference> attachedTo = JsonNullable.undefined();

  public JsonNullable<String> getDescription() {
    return description;
  }

  public UpdateTaskRequest description(String description) {
    this.description = JsonNullable.of(description);
    return this;
  }

  public JsonNullable<LocalDate> getDueDate() {
    return dueDate;
  }

  public UpdateTaskRequest dueDate(LocalDate dueDate) {
    this.dueDate = JsonNullable.of(dueDate);
    return this;
  }

  public JsonNullable<String> getAssignedTo() {
    return assignedTo;
  }

  public UpdateTaskRequest assignedTo(String assignedTo) {
    this.assignedTo = JsonNullable.of(assignedTo);
    return this;
  }

  public JsonNullable<TaskStatus> getStatus() {
    return status;
  }

  public UpdateTaskRequest status(TaskStatus status) {
    this.status = JsonNullable.of(status);
    return this;
  }

  public JsonNullable<EntityReference> getAttachedTo() {
    return attachedTo;
  }

  public UpdateTaskRequest attachedTo(EntityReference attachedTo) {
    this.attachedTo = JsonNullable.of(attachedTo);
    return this;
  }
}
