package io.b2mash.crm.crmcore.task.dto;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import io.b2mash.crm.crmcore.task.TaskStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record CreateTaskRequest(
    @NotBlank String description,
    LocalDate dueDate,
    @Size(max = 255) String assignedTo,
    @NotNull TaskStatus status,
    @NotNull @Valid EntityReference attachedTo) {

  public static CreateTaskRequest open(String description, EntityReference attachedTo) {
    return new CreateTaskRequest(description, null, null, TaskStatus.OPEN, attachedTo);
  }

  public CreateTaskRequest assignedTo(String assignee) {
    return new CreateTaskRequest(description, dueDate, assignee, status, attachedTo);
  }

  public CreateTaskRequest due(LocalDate date) {
    return new CreateTaskRequest(description, date, assignedTo, status, attachedTo);
  }
}
