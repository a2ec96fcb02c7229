package io.b2mash.crm.crmcore.audit;

import io.b2mash.crm.crmcore.repository.Pagination;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Database-backed implementation of {@link AuditService}. Delegates persistence and querying to
 * {@link AuditLogRepository}.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditLogRepository auditLogRepository;
  private final AuditDiffCalculator diffCalculator;

  public DatabaseAuditService(
      AuditLogRepository auditLogRepository, AuditDiffCalculator diffCalculator) {
    this.auditLogRepository = auditLogRepository;
    this.diffCalculator = diffCalculator;
  }

  @Override
  public AuditLog logCreate(String entityType, UUID entityId, String userId, Object entity) {
    return record(
        new AuditEntry(
            entityType,
            entityId,
            AuditAction.CREATE,
            userId,
            Map.of("created", diffCalculator.snapshot(entity))));
  }

  @Override
  public Optional<AuditLog> logUpdate(
      String entityType, UUID entityId, String userId, Object before, Object after) {
    var changes = diffCalculator.diff(before, after);
    if (changes.isEmpty()) {
      log.debug("Skipped audit for unchanged entity: entity={}/{}", entityType, entityId);
      return Optional.empty();
    }
    return Optional.of(
        record(new AuditEntry(entityType, entityId, AuditAction.UPDATE, userId, changes)));
  }

  @Override
  public AuditLog logDelete(String entityType, UUID entityId, String userId, Object entity) {
    return record(
        new AuditEntry(
            entityType,
            entityId,
            AuditAction.DELETE,
            userId,
            Map.of("deleted", diffCalculator.snapshot(entity))));
  }

  @Override
  public List<AuditLog> findByEntity(String entityType, UUID entityId, Pagination pagination) {
    return auditLogRepository.findByEntity(entityType, entityId, pagination);
  }

  @Override
  public List<AuditLog> findByUser(String userId, Pagination pagination) {
    return auditLogRepository.findByUser(userId, pagination);
  }

  @Override
  public List<AuditLog> findLogs(AuditLogFilter filter, Pagination pagination) {
    return auditLogRepository.findAll(filter != null ? filter : AuditLogFilter.none(), pagination);
  }

  private AuditLog record(AuditEntry entry) {
    var saved = auditLogRepository.insert(entry);
    log.debug(
        "Recorded audit log: action={}, entity={}/{}, user={}",
        entry.action().value(),
        entry.entityType(),
        entry.entityId(),
        entry.userId());
    return saved;
  }
}
