package com.alphaguard.exception;

import java.util.Map;

/**
 * Thrown by a metric provider that has no value for the requested window.
 * The falsifier monitor treats it as a skipped check, never as a trigger.
 */
public class MetricUnavailableException extends BaseException {

    public MetricUnavailableException(String metric, String reason) {
        super(
                ErrorCode.METRIC_UNAVAILABLE,
                String.format("Metric '%s' unavailable: %s", metric, reason),
                Map.of("metric", metric));
    }
}
