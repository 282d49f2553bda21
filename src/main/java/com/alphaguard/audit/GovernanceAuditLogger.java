package com.alphaguard.audit;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.domain.enums.GovernanceAuditEventType;
import com.alphaguard.domain.enums.PoolDecision;
import com.alphaguard.monitoring.FalsifierCheckResult;
import com.alphaguard.pool.Pool;
import com.alphaguard.regime.RegimeSnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Writes governance effects to the {@link GovernanceAuditStore}.
 *
 * <p>One typed method per event type keeps the action_details payload uniform
 * across callers. Entries are stamped with the injected clock and with the
 * {@code traceId} from the SLF4J MDC when the caller runs inside a traced
 * trading decision.
 *
 * <p>Writes are synchronous. A storage failure propagates to the caller as
 * {@link com.alphaguard.exception.AuditStorageException}.
 */
@Service
public class GovernanceAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(GovernanceAuditLogger.class);

    public static final String TRACE_ID_MDC_KEY = "traceId";

    private final GovernanceAuditStore store;
    private final Clock clock;

    public GovernanceAuditLogger(GovernanceAuditStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    // ========================
    // CONSTRAINT RESOLUTION
    // ========================

    public AuditLogEntry constraintActivated(String symbol, String strategyId, Constraint constraint) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("priority", constraint.getPriority());
        details.put("title", constraint.getTitle());
        details.put("actions", constraint.getActions().asMap());
        details.put("applies_to", Map.of(
                "symbols", constraint.getAppliesTo().getSymbols(),
                "strategies", constraint.getAppliesTo().getStrategies()));
        return append(AuditLogEntry.builder()
                .eventType(GovernanceAuditEventType.CONSTRAINT_ACTIVATED)
                .constraintId(constraint.getId())
                .symbol(symbol)
                .strategyId(strategyId)
                .actionDetails(details));
    }

    public AuditLogEntry vetoDowngrade(String symbol, String strategyId, String constraintId, List<String> contributing) {
        return append(AuditLogEntry.builder()
                .eventType(GovernanceAuditEventType.VETO_DOWNGRADE)
                .constraintId(constraintId)
                .symbol(symbol)
                .strategyId(strategyId)
                .actionDetails(Map.of("veto_downgrade", true, "constraint_ids", List.copyOf(contributing))));
    }

    public AuditLogEntry riskBudgetAdjusted(
            String symbol,
            String strategyId,
            String constraintId,
            double constraintMultiplier,
            double effectiveMultiplier,
            List<String> contributing) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("multiplier", constraintMultiplier);
        details.put("effective_multiplier", effectiveMultiplier);
        details.put("constraint_id", constraintId);
        details.put("constraint_ids", List.copyOf(contributing));
        return append(AuditLogEntry.builder()
                .eventType(GovernanceAuditEventType.RISK_BUDGET_ADJUSTED)
                .constraintId(constraintId)
                .symbol(symbol)
                .strategyId(strategyId)
                .actionDetails(details));
    }

    public AuditLogEntry positionCapApplied(
            String symbol, String strategyId, String constraintId, Map<String, Object> capDetails) {
        return append(AuditLogEntry.builder()
                .eventType(GovernanceAuditEventType.POSITION_CAP_APPLIED)
                .constraintId(constraintId)
                .symbol(symbol)
                .strategyId(strategyId)
                .actionDetails(capDetails));
    }

    /**
     * Records a constraint that went inactive. One entry is written per symbol the
     * constraint applies to, so a symbol query returns the deactivation next to
     * the resolutions it affected; a constraint that applies to every symbol gets
     * a single entry without a symbol.
     */
    public List<AuditLogEntry> constraintDeactivated(Constraint constraint, String hypothesisId, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("disabled_if_falsified", constraint.getActivation().getDisabledIfFalsified());
        details.put("priority", constraint.getPriority());
        details.put("applies_to", Map.of(
                "symbols", constraint.getAppliesTo().getSymbols(),
                "strategies", constraint.getAppliesTo().getStrategies()));

        List<String> symbols = constraint.getAppliesTo().getSymbols();
        List<String> targets = symbols.isEmpty() ? Collections.singletonList(null) : symbols;
        List<AuditLogEntry> written = new ArrayList<>(targets.size());
        for (String symbol : targets) {
            written.add(append(AuditLogEntry.builder()
                    .eventType(GovernanceAuditEventType.CONSTRAINT_DEACTIVATED)
                    .hypothesisId(hypothesisId)
                    .constraintId(constraint.getId())
                    .symbol(symbol)
                    .actionDetails(details)));
        }
        return written;
    }

    // ========================
    // MONITORING, POOL, REGIME
    // ========================

    public AuditLogEntry falsifierChecked(FalsifierCheckResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("falsifier_index", result.getFalsifierIndex());
        details.put("metric", result.getMetric());
        details.put("operator", result.getOperator().getSymbol());
        details.put("threshold", result.getThreshold());
        details.put("window", result.getWindow());
        details.put("metric_value", result.getMetricValue());
        details.put("trigger_action", result.getTriggerAction().getValue());
        details.put("message", result.getMessage());
        return append(AuditLogEntry.builder()
                .eventType(result.isTriggered()
                        ? GovernanceAuditEventType.FALSIFIER_CHECK_TRIGGERED
                        : GovernanceAuditEventType.FALSIFIER_CHECK_PASS)
                .hypothesisId(result.getHypothesisId())
                .actionDetails(details));
    }

    public AuditLogEntry poolBuilt(Pool pool) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("version", pool.getVersion());
        details.put("content_hash", pool.getContentHash());
        details.put("size", pool.size());
        details.put("symbols", pool.getSymbols());
        details.put("prioritized", pool.getWeights());
        details.put("excluded", pool.getAuditTrail().stream()
                .filter(e -> e.getDecision() == PoolDecision.EXCLUDED)
                .count());
        return append(AuditLogEntry.builder()
                .eventType(GovernanceAuditEventType.POOL_BUILT)
                .actionDetails(details));
    }

    public AuditLogEntry regimeChanged(RegimeSnapshot snapshot) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", snapshot.getState().name());
        details.put("previous_state", snapshot.getPreviousState() != null ? snapshot.getPreviousState().name() : null);
        details.put("pacing_multiplier", snapshot.getPacingMultiplier());
        details.put("metrics", snapshot.getMetrics());
        return append(AuditLogEntry.builder()
                .eventType(GovernanceAuditEventType.REGIME_CHANGED)
                .actionDetails(details));
    }

    // ========================
    // QUERY
    // ========================

    public List<AuditLogEntry> query(AuditQuery query) {
        return store.query(query);
    }

    private AuditLogEntry append(AuditLogEntry.AuditLogEntryBuilder builder) {
        AuditLogEntry entry = builder
                .timestamp(clock.instant())
                .traceId(MDC.get(TRACE_ID_MDC_KEY))
                .build();
        AuditLogEntry stored = store.append(entry);
        log.debug("Audit {} symbol={} constraint={} hypothesis={}",
                stored.getEventType(), stored.getSymbol(), stored.getConstraintId(), stored.getHypothesisId());
        return stored;
    }
}
