package io.b2mash.crm.crmcore.customfield;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Administrator-defined extra field on one entity type. {@code name} and {@code fieldType} are
 * fixed once created; only {@code label} and {@code required} change afterwards.
 */
public record CustomFieldDefinition(
    UUID id,
    String name,
    String label,
    EntityType entityType,
    CustomFieldType fieldType,
    List<String> enumValues,
    boolean required,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {}
