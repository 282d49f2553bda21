package com.alphaguard.monitoring;

import com.alphaguard.audit.GovernanceAuditLogger;
import com.alphaguard.config.GovernanceProperties;
import com.alphaguard.constraint.Constraint;
import com.alphaguard.constraint.ConstraintRegistry;
import com.alphaguard.constraint.ConstraintResolver;
import com.alphaguard.domain.enums.MonitorState;
import com.alphaguard.domain.enums.TriggerAction;
import com.alphaguard.exception.AuditStorageException;
import com.alphaguard.exception.IllegalTransitionException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.hypothesis.Falsifier;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisLookup;
import com.alphaguard.hypothesis.HypothesisRegistry;
import com.alphaguard.notification.AlertDispatcher;
import com.alphaguard.notification.AlertGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically evaluates the falsifiers of every ACTIVE hypothesis.
 *
 * <p>Per cycle and per hypothesis:
 * <ol>
 *   <li>pick the falsifiers that are due, by the cadence of their window class
 *       (market windows daily, fundamental windows weekly by default)</li>
 *   <li>evaluate them; an unavailable metric is a skipped check, never a trigger</li>
 *   <li>audit every evaluated check, pass or trigger</li>
 *   <li>on a trigger: alert, sunset the hypothesis if the trigger says so, audit
 *       each linked constraint that went inactive, and drop the resolver cache</li>
 * </ol>
 *
 * <p>A failure while checking one hypothesis is logged and the cycle moves on,
 * except an audit storage failure, which stops the cycle and propagates.
 *
 * <p>The monitor talks to the hot path only through registry writes and cache
 * invalidation. It holds its own lock and never the resolver's.
 */
@Service
public class FalsifierMonitor {

    private static final Logger log = LoggerFactory.getLogger(FalsifierMonitor.class);

    static final String MARKET_WINDOW_CLASS = "market";
    static final String FUNDAMENTAL_WINDOW_CLASS = "fundamental";

    private final HypothesisRegistry hypothesisRegistry;
    private final ConstraintRegistry constraintRegistry;
    private final ConstraintResolver constraintResolver;
    private final FalsifierChecker falsifierChecker;
    private final GovernanceAuditLogger auditLogger;
    private final AlertGenerator alertGenerator;
    private final AlertDispatcher alertDispatcher;
    private final GovernanceProperties properties;
    private final Clock clock;

    private final Map<String, MonitorState> states = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastChecked = new ConcurrentHashMap<>();
    private final Object cycleLock = new Object();

    public FalsifierMonitor(
            HypothesisRegistry hypothesisRegistry,
            ConstraintRegistry constraintRegistry,
            ConstraintResolver constraintResolver,
            FalsifierChecker falsifierChecker,
            GovernanceAuditLogger auditLogger,
            AlertGenerator alertGenerator,
            AlertDispatcher alertDispatcher,
            GovernanceProperties properties,
            Clock clock) {
        this.hypothesisRegistry = hypothesisRegistry;
        this.constraintRegistry = constraintRegistry;
        this.constraintResolver = constraintResolver;
        this.falsifierChecker = falsifierChecker;
        this.auditLogger = auditLogger;
        this.alertGenerator = alertGenerator;
        this.alertDispatcher = alertDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${alphaguard.governance.monitor.cron:0 30 6 * * *}")
    public void scheduledCycle() {
        if (!properties.getMonitor().isEnabled()) {
            log.debug("Falsifier monitor disabled; skipping scheduled cycle");
            return;
        }
        runCycle();
    }

    public List<FalsifierCheckResult> runCycle() {
        return runCycle(false);
    }

    /**
     * Runs one monitoring cycle.
     *
     * @param force check every falsifier regardless of cadence
     * @return every check performed, skipped ones included
     */
    public List<FalsifierCheckResult> runCycle(boolean force) {
        synchronized (cycleLock) {
            Instant now = clock.instant();
            List<Hypothesis> active = hypothesisRegistry.listActive();
            List<FalsifierCheckResult> performed = new ArrayList<>();
            int triggered = 0;

            for (Hypothesis hypothesis : active) {
                List<FalsifierCheckResult> results;
                try {
                    results = checkDue(hypothesis, now, force);
                } catch (AuditStorageException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Falsifier check failed for hypothesis {}; continuing with the cycle: {}",
                            hypothesis.getId(), e.getMessage(), e);
                    states.put(hypothesis.getId(), MonitorState.NOT_YET_DUE);
                    continue;
                }
                performed.addAll(results);
                if (results.stream().anyMatch(FalsifierCheckResult::isTriggered)) {
                    triggered++;
                }
            }
            log.info("Falsifier cycle complete: {} active hypotheses, {} checks, {} triggered",
                    active.size(), performed.size(), triggered);
            return performed;
        }
    }

    /** Monitor state of a hypothesis; NOT_YET_DUE until its first check. */
    public MonitorState stateOf(String hypothesisId) {
        return states.getOrDefault(hypothesisId, MonitorState.NOT_YET_DUE);
    }

    // ========================
    // PER-HYPOTHESIS CHECK
    // ========================

    private List<FalsifierCheckResult> checkDue(Hypothesis hypothesis, Instant now, boolean force) {
        List<Integer> due = new ArrayList<>();
        for (int i = 0; i < hypothesis.getFalsifiers().size(); i++) {
            if (force || isDue(hypothesis.getId(), i, hypothesis.getFalsifiers().get(i), now)) {
                due.add(i);
            }
        }
        if (due.isEmpty()) {
            states.putIfAbsent(hypothesis.getId(), MonitorState.NOT_YET_DUE);
            return List.of();
        }

        states.put(hypothesis.getId(), MonitorState.CHECKING);
        List<FalsifierCheckResult> results = new ArrayList<>(due.size());
        List<FalsifierCheckResult> triggered = new ArrayList<>();
        for (int index : due) {
            FalsifierCheckResult result = falsifierChecker.check(hypothesis, index);
            results.add(result);
            lastChecked.put(checkKey(hypothesis.getId(), index), now);
            if (result.isSkipped()) {
                alertDispatcher.dispatch(alertGenerator.metricUnavailable(
                        hypothesis.getId(), result.getMetric(), result.getWindow()));
                continue;
            }
            auditLogger.falsifierChecked(result);
            if (result.isTriggered()) {
                triggered.add(result);
            }
        }

        if (triggered.isEmpty()) {
            states.put(hypothesis.getId(), MonitorState.PASSED);
        } else {
            states.put(hypothesis.getId(), MonitorState.TRIGGERED);
            onTriggered(hypothesis, triggered);
        }
        return results;
    }

    private void onTriggered(Hypothesis hypothesis, List<FalsifierCheckResult> triggered) {
        List<Constraint> linked = constraintRegistry.linkedTo(hypothesis.getId());
        List<String> linkedIds = linked.stream().map(Constraint::getId).toList();
        HypothesisLookup before = hypothesisRegistry.snapshot()::find;
        List<Constraint> activeBefore = linked.stream().filter(c -> c.isActive(before)).toList();

        for (FalsifierCheckResult result : triggered) {
            alertDispatcher.dispatch(alertGenerator.fromFalsifierCheck(result, linkedIds));
        }

        Optional<FalsifierCheckResult> sunsetTrigger = triggered.stream()
                .filter(r -> r.getTriggerAction() == TriggerAction.SUNSET)
                .findFirst();
        if (sunsetTrigger.isEmpty()) {
            log.info("Hypothesis {} flagged for review by {} falsifier(s)", hypothesis.getId(), triggered.size());
            return;
        }

        String reason = "falsifier triggered: " + sunsetTrigger.get().getMessage();
        try {
            hypothesisRegistry.sunset(hypothesis.getId(), reason);
        } catch (IllegalTransitionException | ResourceNotFoundException e) {
            // changed concurrently, e.g. rejected by a human during the cycle
            log.warn("Could not sunset hypothesis {}: {}", hypothesis.getId(), e.getMessage());
            return;
        }

        HypothesisLookup after = hypothesisRegistry.snapshot()::find;
        int deactivated = 0;
        for (Constraint constraint : activeBefore) {
            if (!constraint.isActive(after)) {
                auditLogger.constraintDeactivated(constraint, hypothesis.getId(), reason);
                deactivated++;
            }
        }
        if (deactivated > 0) {
            constraintResolver.invalidateAll("hypothesis " + hypothesis.getId() + " sunset");
        }
        log.warn("Hypothesis {} sunset by falsifier; {} linked constraint(s) deactivated",
                hypothesis.getId(), deactivated);
    }

    // ========================
    // CADENCE
    // ========================

    private boolean isDue(String hypothesisId, int index, Falsifier falsifier, Instant now) {
        Instant last = lastChecked.get(checkKey(hypothesisId, index));
        if (last == null) {
            return true;
        }
        Duration cadence = properties.getMonitor().getWindowCadence()
                .getOrDefault(windowClass(falsifier.getWindow()), Duration.ofDays(1));
        return !now.isBefore(last.plus(cadence));
    }

    String windowClass(String window) {
        String unit = window.substring(window.length() - 1);
        return properties.getMonitor().getFundamentalWindowUnits().contains(unit)
                ? FUNDAMENTAL_WINDOW_CLASS
                : MARKET_WINDOW_CLASS;
    }

    private static String checkKey(String hypothesisId, int index) {
        return hypothesisId + "#" + index;
    }
}
