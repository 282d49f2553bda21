package com.alphaguard.audit;

import com.alphaguard.domain.enums.GovernanceAuditEventType;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One governance effect, as written to the append-only audit log.
 *
 * <p>Key fields:
 * <ul>
 *   <li>{@code eventType} -- what happened, from a closed set</li>
 *   <li>{@code symbol} / {@code strategyId} -- the trading context, when there is one</li>
 *   <li>{@code hypothesisId} / {@code constraintId} -- the governance object responsible</li>
 *   <li>{@code actionDetails} -- structured payload, e.g. the applied multiplier</li>
 *   <li>{@code traceId} -- links the entry to the trading decision that caused it</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class AuditLogEntry {

    /** Assigned by the store on append. */
    Long id;

    Instant timestamp;

    GovernanceAuditEventType eventType;

    String hypothesisId;

    String constraintId;

    String symbol;

    String strategyId;

    @Builder.Default
    Map<String, Object> actionDetails = Map.of();

    String traceId;
}
