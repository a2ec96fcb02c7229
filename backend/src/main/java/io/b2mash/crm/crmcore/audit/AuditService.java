package io.b2mash.crm.crmcore.audit;

import io.b2mash.crm.crmcore.repository.Pagination;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records and queries audit records. One record is written per mutating service call.
 *
 * <p>Writes run as their own statement after the entity mutation. When the caller is inside a
 * {@link io.b2mash.crm.crmcore.transaction.TransactionCoordinator} unit of work the write joins
 * that transaction and rolls back with it.
 */
public interface AuditService {

  /** Records a create with the full entity snapshot under {@code "created"}. */
  AuditLog logCreate(String entityType, UUID entityId, String userId, Object entity);

  /**
   * Records the field-level diff between {@code before} and {@code after}.
   *
   * @return the written record, or empty when no non-metadata field changed and nothing was
   *     written
   */
  Optional<AuditLog> logUpdate(
      String entityType, UUID entityId, String userId, Object before, Object after);

  /** Records a delete with the full snapshot of the removed entity under {@code "deleted"}. */
  AuditLog logDelete(String entityType, UUID entityId, String userId, Object entity);

  /** Audit history of one entity, newest first. */
  List<AuditLog> findByEntity(String entityType, UUID entityId, Pagination pagination);

  List<AuditLog> findByUser(String userId, Pagination pagination);

  /**
   * Queries audit records matching the filter. All filter fields are optional.
   *
   * @param pagination page window, or {@code null} for every match
   * @return matching records ordered by timestamp DESC
   */
  List<AuditLog> findLogs(AuditLogFilter filter, Pagination pagination);
}
