package com.alphaguard.monitoring;

import com.alphaguard.hypothesis.Falsifier;
import com.alphaguard.hypothesis.Hypothesis;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates falsifier rules against the {@link MetricRegistry}.
 *
 * <p>Pure evaluation: this class never changes hypothesis status, writes audit
 * entries or sends alerts. That is the {@link FalsifierMonitor}'s job.
 */
@Component
public class FalsifierChecker {

    private static final Logger log = LoggerFactory.getLogger(FalsifierChecker.class);

    private final MetricRegistry metricRegistry;
    private final Clock clock;

    public FalsifierChecker(MetricRegistry metricRegistry, Clock clock) {
        this.metricRegistry = metricRegistry;
        this.clock = clock;
    }

    /** Checks every falsifier of the hypothesis, in declaration order. */
    public List<FalsifierCheckResult> checkHypothesis(Hypothesis hypothesis) {
        List<FalsifierCheckResult> results = new ArrayList<>(hypothesis.getFalsifiers().size());
        for (int i = 0; i < hypothesis.getFalsifiers().size(); i++) {
            results.add(check(hypothesis, i));
        }
        return results;
    }

    /**
     * Checks each hypothesis independently. A hypothesis whose check fails is
     * logged and left out of the result; the others are still checked.
     */
    public Map<String, List<FalsifierCheckResult>> checkAll(Collection<Hypothesis> hypotheses) {
        Map<String, List<FalsifierCheckResult>> results = new LinkedHashMap<>();
        for (Hypothesis hypothesis : hypotheses) {
            try {
                results.put(hypothesis.getId(), checkHypothesis(hypothesis));
            } catch (RuntimeException e) {
                log.warn("Falsifier check failed for hypothesis {}: {}", hypothesis.getId(), e.getMessage(), e);
            }
        }
        return results;
    }

    public FalsifierCheckResult check(Hypothesis hypothesis, int falsifierIndex) {
        Falsifier falsifier = hypothesis.getFalsifiers().get(falsifierIndex);
        OptionalDouble value = metricRegistry.value(
                falsifier.getMetric(), hypothesis.getScope().getSymbols(), falsifier.getWindow());

        FalsifierCheckResult.FalsifierCheckResultBuilder result = FalsifierCheckResult.builder()
                .hypothesisId(hypothesis.getId())
                .falsifierIndex(falsifierIndex)
                .metric(falsifier.getMetric())
                .operator(falsifier.getOperator())
                .threshold(falsifier.getThreshold())
                .window(falsifier.getWindow())
                .triggerAction(falsifier.getTrigger())
                .checkedAt(clock.instant());

        if (value.isEmpty()) {
            log.warn("Skipping falsifier {}[{}]: metric {} unavailable over {}",
                    hypothesis.getId(), falsifierIndex, falsifier.getMetric(), falsifier.getWindow());
            return result
                    .skipped(true)
                    .message("Metric " + falsifier.getMetric() + " unavailable; check skipped")
                    .build();
        }

        double observed = value.getAsDouble();
        boolean triggered = falsifier.isMetBy(observed);
        String message = triggered
                ? String.format("Falsifier met: %s = %s %s %s over %s",
                        falsifier.getMetric(), observed, falsifier.getOperator().getSymbol(),
                        falsifier.getThreshold(), falsifier.getWindow())
                : String.format("Falsifier not met: %s = %s (needs %s %s)",
                        falsifier.getMetric(), observed, falsifier.getOperator().getSymbol(),
                        falsifier.getThreshold());
        if (triggered) {
            log.info("Hypothesis {} falsifier {} triggered: {}", hypothesis.getId(), falsifierIndex, message);
        }
        return result.metricValue(observed).triggered(triggered).message(message).build();
    }
}
