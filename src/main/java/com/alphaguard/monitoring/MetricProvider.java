package com.alphaguard.monitoring;

import java.util.List;
import java.util.OptionalDouble;
import java.util.function.BiFunction;

/**
 * Source of one named metric, supplied by the surrounding system. The engine
 * never computes metrics itself.
 *
 * <p>A provider returns an empty value, or throws
 * {@link com.alphaguard.exception.MetricUnavailableException}, when it has no
 * data for the window. Both mean "unavailable".
 */
public interface MetricProvider {

    String metricName();

    /**
     * @param symbolScope symbols the value should cover; empty means market-wide
     * @param window      lookback window such as {@code 6m} or {@code 90d}; may be null
     */
    OptionalDouble value(List<String> symbolScope, String window);

    static MetricProvider of(String metricName, BiFunction<List<String>, String, OptionalDouble> fn) {
        return new MetricProvider() {
            @Override
            public String metricName() {
                return metricName;
            }

            @Override
            public OptionalDouble value(List<String> symbolScope, String window) {
                return fn.apply(symbolScope, window);
            }
        };
    }
}
