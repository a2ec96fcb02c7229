package io.b2mash.crm.crmcore.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit record. {@code changes} holds {@code {"created": snapshot}} for creates, {@code
 * {"deleted": snapshot}} for deletes and {@code {field: {"before": x, "after": y}}} for updates.
 */
public record AuditLog(
    UUID id,
    String entityType,
    UUID entityId,
    AuditAction action,
    String userId,
    Map<String, Object> changes,
    Instant timestamp) {}
