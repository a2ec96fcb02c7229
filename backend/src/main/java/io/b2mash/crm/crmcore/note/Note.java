package io.b2mash.crm.crmcore.note;

import io.b2mash.crm.crmcore.attachment.EntityReference;
import java.time.Instant;
import java.util.UUID;

public record Note(
    UUID id,
    String content,
    EntityReference attachedTo,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {}
