package io.b2mash.crm.crmcore.task;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record Task(
    UUID id,
    String description,
    LocalDate dueDate,
    String assignedTo,
    TaskStatus status,
    EntityReference attachedTo,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {}
