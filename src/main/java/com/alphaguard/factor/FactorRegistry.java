package com.alphaguard.factor;

import com.alphaguard.domain.enums.FactorStatus;
import com.alphaguard.domain.enums.FailureAction;
import com.alphaguard.domain.enums.RegistryKind;
import com.alphaguard.event.GovernanceRegistryChangedEvent;
import com.alphaguard.exception.RegistryConflictException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.monitoring.MetricRegistry;
import com.alphaguard.registry.RegistrySnapshot;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Sole owner of factor registrations and their status.
 *
 * <p>Uses the same snapshot discipline as the hypothesis and constraint
 * registries. {@link #checkHealth(String)} evaluates failure rules through the
 * {@link MetricRegistry}: when several rules fire, DISABLE beats REVIEW, and an
 * unavailable metric never fires a rule.
 */
@Component
public class FactorRegistry {

    private static final Logger log = LoggerFactory.getLogger(FactorRegistry.class);

    private final AtomicReference<RegistrySnapshot<Factor>> current =
            new AtomicReference<>(RegistrySnapshot.empty());
    private final Object writeLock = new Object();
    private final ApplicationEventPublisher applicationEventPublisher;
    private final MetricRegistry metricRegistry;
    private final Clock clock;

    public FactorRegistry(
            ApplicationEventPublisher applicationEventPublisher, MetricRegistry metricRegistry, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.metricRegistry = metricRegistry;
        this.clock = clock;
    }

    // ========================
    // WRITES
    // ========================

    public boolean register(Factor factor) {
        RegistrySnapshot<Factor> next;
        synchronized (writeLock) {
            RegistrySnapshot<Factor> snapshot = current.get();
            Optional<Factor> existing = snapshot.find(factor.getId());
            if (existing.isPresent()) {
                if (existing.get().equals(factor)) {
                    return false;
                }
                throw new RegistryConflictException("Factor", factor.getId());
            }
            next = snapshot.with(factor.getId(), factor);
            current.set(next);
        }
        log.info("Registered factor {} ({} failure rules)", factor.getId(), factor.getFailureRules().size());
        publish(List.of(factor.getId()), "register", next.getVersion());
        return true;
    }

    /** Reload swap. A factor disabled or flagged at runtime keeps that status. */
    public void replaceAll(Collection<Factor> factors, String cause) {
        RegistrySnapshot<Factor> next;
        synchronized (writeLock) {
            RegistrySnapshot<Factor> previous = current.get();
            List<Factor> merged = new ArrayList<>(factors.size());
            for (Factor loaded : factors) {
                Factor carried = previous.find(loaded.getId())
                        .filter(p -> p.getStatus() != FactorStatus.ENABLED)
                        .map(p -> loaded.withStatus(p.getStatus(), p.isEnabled()))
                        .orElse(loaded);
                merged.add(carried);
            }
            next = RegistrySnapshot.of(merged, Factor::getId, previous.getVersion() + 1);
            current.set(next);
        }
        log.info("Factor registry replaced: {} entries, version {}", next.size(), next.getVersion());
        publish(List.copyOf(next.asMap().keySet()), cause, next.getVersion());
    }

    public Factor disable(String factorId) {
        return updateStatus(factorId, FactorStatus.DISABLED, false);
    }

    public Factor enable(String factorId) {
        return updateStatus(factorId, FactorStatus.ENABLED, true);
    }

    /** Flags the factor for human review. It keeps running until a human decides. */
    public Factor markForReview(String factorId) {
        Factor factor = get(factorId);
        return updateStatus(factorId, FactorStatus.REVIEW, factor.isEnabled());
    }

    private Factor updateStatus(String factorId, FactorStatus status, boolean enabled) {
        Factor updated;
        RegistrySnapshot<Factor> next;
        synchronized (writeLock) {
            RegistrySnapshot<Factor> snapshot = current.get();
            Factor existing = snapshot.find(factorId)
                    .orElseThrow(() -> new ResourceNotFoundException("Factor", factorId));
            updated = existing.withStatus(status, enabled);
            next = snapshot.with(factorId, updated);
            current.set(next);
        }
        log.info("Factor {} status -> {}", factorId, status);
        publish(List.of(factorId), "status " + status, next.getVersion());
        return updated;
    }

    // ========================
    // READS
    // ========================

    public Optional<Factor> find(String factorId) {
        return current.get().find(factorId);
    }

    public Factor get(String factorId) {
        return find(factorId).orElseThrow(() -> new ResourceNotFoundException("Factor", factorId));
    }

    public List<Factor> list() {
        return current.get().values();
    }

    /** Factors with status ENABLED and the enabled flag set. */
    public List<Factor> enabled() {
        return list().stream()
                .filter(f -> f.getStatus() == FactorStatus.ENABLED && f.isEnabled())
                .toList();
    }

    // ========================
    // HEALTH
    // ========================

    /**
     * Evaluates every failure rule of the factor and applies the strongest
     * triggered action.
     *
     * @return one result per failure rule, in declaration order
     */
    public List<FactorHealthCheckResult> checkHealth(String factorId) {
        Factor factor = get(factorId);
        List<FactorHealthCheckResult> results = new ArrayList<>();
        boolean disable = false;
        boolean review = false;

        for (int i = 0; i < factor.getFailureRules().size(); i++) {
            FactorFailureRule rule = factor.getFailureRules().get(i);
            OptionalDouble value = metricRegistry.value(rule.getMetric(), List.of(), rule.getWindow());
            boolean triggered = value.isPresent() && rule.isMetBy(value.getAsDouble());
            String message;
            if (value.isEmpty()) {
                message = "Metric " + rule.getMetric() + " unavailable; rule skipped";
            } else if (triggered) {
                message = String.format("Failure rule met: %s = %s %s %s; action %s", rule.getMetric(),
                        value.getAsDouble(), rule.getOperator().getSymbol(), rule.getThreshold(),
                        rule.getAction().getValue());
            } else {
                message = String.format("Failure rule not met: %s = %s", rule.getMetric(), value.getAsDouble());
            }
            if (triggered) {
                disable |= rule.getAction() == FailureAction.DISABLE;
                review |= rule.getAction() == FailureAction.REVIEW;
            }
            results.add(FactorHealthCheckResult.builder()
                    .factorId(factorId)
                    .ruleIndex(i)
                    .metric(rule.getMetric())
                    .operator(rule.getOperator())
                    .threshold(rule.getThreshold())
                    .window(rule.getWindow())
                    .metricValue(value.isPresent() ? value.getAsDouble() : null)
                    .triggered(triggered)
                    .action(rule.getAction())
                    .checkedAt(clock.instant())
                    .message(message)
                    .build());
        }

        if (disable && factor.getStatus() != FactorStatus.DISABLED) {
            log.warn("Factor {} disabled by failure rule", factorId);
            disable(factorId);
        } else if (!disable && review && factor.getStatus() == FactorStatus.ENABLED) {
            log.warn("Factor {} flagged for review by failure rule", factorId);
            markForReview(factorId);
        }
        return results;
    }

    private void publish(List<String> ids, String cause, long version) {
        applicationEventPublisher.publishEvent(
                new GovernanceRegistryChangedEvent(this, RegistryKind.FACTOR, ids, cause, version));
    }
}
