package com.alphaguard.factor;

import com.alphaguard.domain.enums.ComparisonOperator;
import com.alphaguard.domain.enums.FailureAction;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Outcome of one failure rule of one factor. A null value means the metric was unavailable. */
@Value
@Builder
public class FactorHealthCheckResult {

    String factorId;

    int ruleIndex;

    String metric;

    ComparisonOperator operator;

    double threshold;

    String window;

    Double metricValue;

    boolean triggered;

    FailureAction action;

    Instant checkedAt;

    String message;
}
