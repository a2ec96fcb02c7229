package io.b2mash.crm.crmcore.audit;

import java.util.Map;
import java.util.UUID;

/** Data for a new audit row; id and timestamp are assigned by the store. */
public record AuditEntry(
    String entityType,
    UUID entityId,
    AuditAction action,
    String userId,
    Map<String, Object> changes) {}
