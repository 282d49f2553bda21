package com.alphaguard.audit;

import com.alphaguard.domain.enums.GovernanceAuditEventType;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Audit log filters. Null fields match everything; {@code from} and {@code to}
 * are inclusive.
 */
@Value
@Builder
public class AuditQuery {

    public static final int DEFAULT_LIMIT = 1000;
    public static final int MAX_LIMIT = 10_000;

    String symbol;

    Instant from;

    Instant to;

    String constraintId;

    GovernanceAuditEventType eventType;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public boolean matches(AuditLogEntry entry) {
        return (symbol == null || symbol.equals(entry.getSymbol()))
                && (constraintId == null || constraintId.equals(entry.getConstraintId()))
                && (eventType == null || eventType == entry.getEventType())
                && (from == null || !entry.getTimestamp().isBefore(from))
                && (to == null || !entry.getTimestamp().isAfter(to));
    }
}
