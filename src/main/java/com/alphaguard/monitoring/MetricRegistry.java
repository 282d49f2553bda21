package com.alphaguard.monitoring;

import com.alphaguard.exception.MetricUnavailableException;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves metric names to {@link MetricProvider}s.
 *
 * <p>Providers declared as Spring beans are registered at construction; more
 * can be added at runtime. Lookups never throw: a missing provider, a provider
 * exception, or a non-finite value all come back as an empty result, logged at
 * WARN.
 */
@Component
public class MetricRegistry {

    private static final Logger log = LoggerFactory.getLogger(MetricRegistry.class);

    private final Map<String, MetricProvider> providers = new ConcurrentHashMap<>();

    public MetricRegistry(List<MetricProvider> providerBeans) {
        providerBeans.forEach(this::register);
    }

    public void register(MetricProvider provider) {
        MetricProvider previous = providers.put(provider.metricName(), provider);
        if (previous != null) {
            log.warn("Metric provider for {} replaced", provider.metricName());
        } else {
            log.info("Registered metric provider: {}", provider.metricName());
        }
    }

    public void unregister(String metricName) {
        providers.remove(metricName);
    }

    public boolean hasProvider(String metricName) {
        return providers.containsKey(metricName);
    }

    public Set<String> metricNames() {
        return Set.copyOf(providers.keySet());
    }

    public OptionalDouble value(String metricName, List<String> symbolScope, String window) {
        MetricProvider provider = providers.get(metricName);
        if (provider == null) {
            log.warn("No provider registered for metric {}", metricName);
            return OptionalDouble.empty();
        }
        try {
            OptionalDouble value = provider.value(symbolScope, window);
            if (value.isPresent() && !Double.isFinite(value.getAsDouble())) {
                log.warn("Metric {} returned non-finite value {}", metricName, value.getAsDouble());
                return OptionalDouble.empty();
            }
            return value;
        } catch (MetricUnavailableException e) {
            log.warn("Metric {} unavailable over {}: {}", metricName, window, e.getMessage());
            return OptionalDouble.empty();
        } catch (RuntimeException e) {
            log.warn("Metric provider for {} failed over {}: {}", metricName, window, e.getMessage(), e);
            return OptionalDouble.empty();
        }
    }

    /** Market-wide value with no window. */
    public OptionalDouble value(String metricName) {
        return value(metricName, List.of(), null);
    }
}
