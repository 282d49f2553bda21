package com.alphaguard.pool;

import com.alphaguard.domain.enums.PoolDecision;
import lombok.Value;

/**
 * One per-symbol decision of a pool build: what happened, why, and which
 * filter or hypothesis caused it.
 */
@Value
public class PoolAuditEntry {

    String symbol;

    PoolDecision decision;

    String reason;

    /** Filter name, hypothesis id, or {@code pool_builder}. */
    String source;

    public static PoolAuditEntry excluded(String symbol, String reason, String source) {
        return new PoolAuditEntry(symbol, PoolDecision.EXCLUDED, reason, source);
    }

    public static PoolAuditEntry prioritized(String symbol, String hypothesisId) {
        return new PoolAuditEntry(symbol, PoolDecision.PRIORITIZED, "hypothesis:" + hypothesisId, hypothesisId);
    }

    public static PoolAuditEntry included(String symbol) {
        return new PoolAuditEntry(symbol, PoolDecision.INCLUDED, "passed_all_filters", "pool_builder");
    }
}
