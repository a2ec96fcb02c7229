package io.b2mash.crm.crmcore.task;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import org.openapitools.jackson.nullable.JsonNullable;

/**
 * @param attachedTo owning entity, or {@code null} for any
 * @param assignedTo undefined for no constraint, {@code null} for unassigned tasks
 * @param status task status, or {@code null} for any
 */
public record TaskFilter(
    EntityReference attachedTo, JsonNullable<String> assignedTo, TaskStatus status) {

  public static TaskFilter none() {
    return new TaskFilter(null, JsonNullable.undefined(), null);
  }

  public static TaskFilter attachedTo(EntityReference entity) {
    return new TaskFilter(entity, JsonNullable.undefined(), null);
  }

  public TaskFilter withAssignee(String assignedTo) {
    return new TaskFilter(attachedTo, JsonNullable.of(assignedTo), status);
  }

  public TaskFilter withStatus(TaskStatus status) {
    return new TaskFilter(attachedTo, assignedTo, status);
  }
}
