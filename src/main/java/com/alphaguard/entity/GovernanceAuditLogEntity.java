package com.alphaguard.entity;

import com.alphaguard.domain.enums.GovernanceAuditEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the governance_audit_log table.
 *
 * <p>Rows are inserted once and never updated or deleted. Indexed for the two
 * query shapes the audit API serves: symbol + time range, and constraint id.
 * The action_details column holds the structured payload as JSON text.
 */
@Entity
@Table(
        name = "governance_audit_log",
        indexes = {
            @Index(name = "ix_gov_audit_symbol_ts", columnList = "symbol, timestamp"),
            @Index(name = "ix_gov_audit_constraint", columnList = "constraint_id"),
            @Index(name = "ix_gov_audit_event_type", columnList = "event_type")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GovernanceAuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, columnDefinition = "varchar(50)")
    private GovernanceAuditEventType eventType;

    @Column(name = "hypothesis_id", length = 100, updatable = false)
    private String hypothesisId;

    @Column(name = "constraint_id", length = 100, updatable = false)
    private String constraintId;

    @Column(name = "symbol", length = 32, updatable = false)
    private String symbol;

    @Column(name = "strategy_id", length = 100, updatable = false)
    private String strategyId;

    @Column(name = "action_details", columnDefinition = "TEXT", updatable = false)
    private String actionDetails;

    /** Correlates the entry with the trading decision that triggered it. */
    @Column(name = "trace_id", length = 64, updatable = false)
    private String traceId;
}
