package com.alphaguard.repository.jpa;

import com.alphaguard.domain.enums.GovernanceAuditEventType;
import com.alphaguard.entity.GovernanceAuditLogEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the governance_audit_log table.
 *
 * <p>{@link #search} serves every audit query in one statement; null
 * parameters disable their filter. Results are oldest first.
 */
@Repository
public interface GovernanceAuditLogJpaRepository extends JpaRepository<GovernanceAuditLogEntity, Long> {

    @Query("SELECT a FROM GovernanceAuditLogEntity a WHERE "
            + "(:symbol IS NULL OR a.symbol = :symbol) "
            + "AND (:constraintId IS NULL OR a.constraintId = :constraintId) "
            + "AND (:eventType IS NULL OR a.eventType = :eventType) "
            + "AND (:from IS NULL OR a.timestamp >= :from) "
            + "AND (:to IS NULL OR a.timestamp <= :to) "
            + "ORDER BY a.timestamp ASC, a.id ASC")
    List<GovernanceAuditLogEntity> search(
            @Param("symbol") String symbol,
            @Param("constraintId") String constraintId,
            @Param("eventType") GovernanceAuditEventType eventType,
            @Param("from") Instant from,
            @Param("to") Instant to,
            Pageable pageable);
}
