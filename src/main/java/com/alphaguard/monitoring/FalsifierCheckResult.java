package com.alphaguard.monitoring;

import com.alphaguard.domain.enums.ComparisonOperator;
import com.alphaguard.domain.enums.TriggerAction;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of evaluating one falsifier of one hypothesis.
 *
 * <p>{@code skipped} means the metric was unavailable: {@code metricValue} is
 * null and {@code triggered} is false. Missing data never counts as evidence
 * against a hypothesis.
 */
@Value
@Builder
public class FalsifierCheckResult {

    String hypothesisId;

    int falsifierIndex;

    String metric;

    ComparisonOperator operator;

    double threshold;

    String window;

    Double metricValue;

    boolean triggered;

    boolean skipped;

    TriggerAction triggerAction;

    Instant checkedAt;

    String message;
}
