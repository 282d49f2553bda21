package com.alphaguard.notification;

import com.alphaguard.config.GovernanceProperties;
import com.alphaguard.domain.enums.AlertSeverity;
import com.alphaguard.domain.enums.TriggerAction;
import com.alphaguard.exception.EmptyPoolException;
import com.alphaguard.monitoring.FalsifierCheckResult;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds {@link Alert}s for governance conditions a human must see.
 *
 * <p>Severity mapping:
 * <ul>
 *   <li>falsifier with trigger {@code sunset}: CRITICAL</li>
 *   <li>falsifier with trigger {@code review}: WARNING</li>
 *   <li>empty pool: CRITICAL</li>
 *   <li>metric unavailable for a due falsifier: WARNING</li>
 * </ul>
 */
@Component
public class AlertGenerator {

    private final Clock clock;
    private final GovernanceProperties properties;

    public AlertGenerator(Clock clock, GovernanceProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    public Alert fromFalsifierCheck(FalsifierCheckResult result, List<String> linkedConstraintIds) {
        boolean sunset = result.getTriggerAction() == TriggerAction.SUNSET;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("falsifier_index", result.getFalsifierIndex());
        details.put("metric", result.getMetric());
        details.put("operator", result.getOperator().getSymbol());
        details.put("threshold", result.getThreshold());
        details.put("window", result.getWindow());
        details.put("metric_value", result.getMetricValue());
        details.put("trigger", result.getTriggerAction().getValue());

        return base(sunset ? AlertSeverity.CRITICAL : AlertSeverity.WARNING, "falsifier_monitor")
                .title("Falsifier triggered: " + result.getHypothesisId())
                .message(result.getMessage())
                .hypothesisId(result.getHypothesisId())
                .constraintIds(List.copyOf(linkedConstraintIds))
                .recommendedAction(sunset
                        ? "Hypothesis sunset automatically; confirm and review linked constraints"
                        : "Review hypothesis " + result.getHypothesisId() + " against its falsifier")
                .details(details)
                .build();
    }

    public Alert emptyPool(EmptyPoolException exception) {
        return base(AlertSeverity.CRITICAL, "pool_builder")
                .title("Trading pool is empty")
                .message(exception.getMessage())
                .recommendedAction("Strategy execution is blocked; review structural filters and pool gating")
                .details(Map.of("excluded_symbols", exception.getAuditTrail().size()))
                .build();
    }

    public Alert metricUnavailable(String hypothesisId, String metric, String window) {
        return base(AlertSeverity.WARNING, "falsifier_monitor")
                .title("Metric unavailable: " + metric)
                .message(String.format("Falsifier check for %s skipped: no value for %s over %s",
                        hypothesisId, metric, window))
                .hypothesisId(hypothesisId)
                .recommendedAction("Restore the metric provider for " + metric)
                .details(Map.of("metric", metric, "window", window))
                .build();
    }

    private Alert.AlertBuilder base(AlertSeverity severity, String source) {
        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .severity(severity)
                .source(source)
                .channels(List.copyOf(properties.getAlerts().getChannels()))
                .createdAt(clock.instant());
    }
}
