package io.b2mash.crm.crmcore.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Query filter for {@link AuditService#findLogs}. All fields are nullable; null means "no filter
 * on this field".
 *
 * @param entityType filter by entity kind (e.g., "contact", "custom_field_definition")
 * @param entityId filter by specific entity
 * @param action filter by mutation kind
 * @param userId filter by acting user
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record AuditLogFilter(
    String entityType,
    UUID entityId,
    AuditAction action,
    String userId,
    Instant from,
    Instant to) {

  public static AuditLogFilter none() {
    return new AuditLogFilter(null, null, null, null, null, null);
  }
}
