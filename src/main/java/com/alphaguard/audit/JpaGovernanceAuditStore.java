package com.alphaguard.audit;

import com.alphaguard.entity.GovernanceAuditLogEntity;
import com.alphaguard.exception.AuditStorageException;
import com.alphaguard.mapper.GovernanceAuditMapper;
import com.alphaguard.repository.jpa.GovernanceAuditLogJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;

/**
 * Durable audit store backed by the governance_audit_log table.
 *
 * <p>Each append is flushed before returning. A storage failure is logged and
 * rethrown as {@link AuditStorageException}; it is never swallowed, since a
 * governance effect without its audit entry is not allowed to stand silently.
 */
public class JpaGovernanceAuditStore implements GovernanceAuditStore {

    private static final Logger log = LoggerFactory.getLogger(JpaGovernanceAuditStore.class);

    private final GovernanceAuditLogJpaRepository repository;
    private final GovernanceAuditMapper mapper;

    public JpaGovernanceAuditStore(GovernanceAuditLogJpaRepository repository, GovernanceAuditMapper mapper) {
        this.repository = repository;
        this.mapper = mapper;
    }

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        try {
            GovernanceAuditLogEntity saved = repository.saveAndFlush(mapper.toEntity(entry));
            return mapper.toDomain(saved);
        } catch (DataAccessException e) {
            log.error("Audit append failed for {} (symbol={}, constraint={})",
                    entry.getEventType(), entry.getSymbol(), entry.getConstraintId(), e);
            throw new AuditStorageException("Audit log unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public List<AuditLogEntry> query(AuditQuery query) {
        try {
            List<GovernanceAuditLogEntity> rows = repository.search(
                    query.getSymbol(),
                    query.getConstraintId(),
                    query.getEventType(),
                    query.getFrom(),
                    query.getTo(),
                    PageRequest.of(0, query.getLimit()));
            return mapper.toDomainList(rows);
        } catch (DataAccessException e) {
            log.error("Audit query failed: {}", query, e);
            throw new AuditStorageException("Audit log unavailable: " + e.getMessage(), e);
        }
    }
}
