package com.alphaguard.constraint;

import com.alphaguard.audit.GovernanceAuditLogger;
import com.alphaguard.config.GovernanceProperties;
import com.alphaguard.domain.enums.StopMode;
import com.alphaguard.domain.model.RegistryFilter;
import com.alphaguard.event.GovernanceRegistryChangedEvent;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisLookup;
import com.alphaguard.registry.GovernanceState;
import com.alphaguard.registry.GovernanceView;
import com.alphaguard.registry.RegistrySnapshot;
import com.alphaguard.util.Hashing;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Computes the aggregate effect of active constraints on a symbol.
 *
 * <p>Read-hot: called once per symbol per strategy evaluation. The common case is
 * a Caffeine lookup. A miss recomputes from in-memory registry snapshots (never
 * from disk) and writes the audit entries for that resolution; a hit writes
 * nothing.
 *
 * <p>Folding follows {@link ActionField}: constraints are ordered by priority
 * ascending (ties by id), multipliers compose multiplicatively, veto is a logical
 * OR, holding extension takes the maximum, and stop mode and strategy enablement
 * come from the highest-priority constraint that sets them. Guardrail ceilings
 * take the minimum across contributors.
 *
 * <p>Each miss folds one {@link GovernanceView}, so a resolution never mixes the
 * hypothesis set of one config generation with the constraints of another. Any
 * registry change drops the whole cache. Entries also remember the registry
 * versions they were built from, so an entry computed just before a swap is never
 * served after it.
 */
@Service
public class ConstraintResolver {

    private static final Logger log = LoggerFactory.getLogger(ConstraintResolver.class);

    private static final int VERSION_LENGTH = 16;
    private static final Comparator<Constraint> FOLD_ORDER =
            Comparator.comparing(Constraint::getPriority).thenComparing(Constraint::getId);

    private final GovernanceState governanceState;
    private final GovernanceAuditLogger auditLogger;
    private final Clock clock;

    /** Caffeine cache: key = "symbol|strategy", value = ResolvedConstraints. */
    private final Cache<String, ResolvedConstraints> cache;

    public ConstraintResolver(
            GovernanceState governanceState,
            GovernanceAuditLogger auditLogger,
            GovernanceProperties properties,
            Clock clock) {
        this.governanceState = governanceState;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getResolver().getCacheTtl())
                .maximumSize(properties.getResolver().getCacheMaxSize())
                .build();
    }

    public ResolvedConstraints resolve(String symbol) {
        return resolveForStrategy(symbol, null);
    }

    /**
     * Resolves constraints for a symbol, restricted to constraints applicable to
     * the strategy. A null strategy means constraints of every strategy apply.
     */
    public ResolvedConstraints resolveForStrategy(String symbol, String strategyId) {
        Objects.requireNonNull(symbol, "symbol");
        String key = symbol + "|" + (strategyId != null ? strategyId : "*");

        ResolvedConstraints cached = cache.getIfPresent(key);
        if (cached != null) {
            if (isCurrent(cached)) {
                log.debug("Resolver cache hit for {}", key);
                return cached;
            }
            cache.invalidate(key);
        }
        log.debug("Resolver cache miss for {}", key);
        return cache.get(key, k -> computeAndAudit(symbol, strategyId));
    }

    /** Drops every cached resolution. */
    public void invalidateAll(String reason) {
        long dropped = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Resolver cache invalidated ({} entries): {}", dropped, reason);
    }

    @EventListener
    public void onRegistryChanged(GovernanceRegistryChangedEvent event) {
        invalidateAll(event.getRegistryKind() + " registry " + event.getCause()
                + " (version " + event.getRegistryVersion() + ")");
    }

    public long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private boolean isCurrent(ResolvedConstraints resolved) {
        GovernanceView view = governanceState.capture();
        return resolved.getHypothesisRegistryVersion() == view.hypothesisVersion()
                && resolved.getConstraintRegistryVersion() == view.constraintVersion();
    }

    // ========================
    // FOLDING
    // ========================

    private ResolvedConstraints computeAndAudit(String symbol, String strategyId) {
        GovernanceView view = governanceState.capture();
        RegistrySnapshot<Hypothesis> hypotheses = view.getHypotheses();
        RegistrySnapshot<Constraint> constraints = view.getConstraints();
        HypothesisLookup lookup = view.hypothesisLookup();

        RegistryFilter filter = RegistryFilter.builder().symbol(symbol).strategy(strategyId).build();
        List<Constraint> contributing = new ArrayList<>();
        for (Constraint constraint : ConstraintRegistry.filter(constraints, filter)) {
            if (constraint.isActive(lookup)) {
                contributing.add(constraint);
            }
        }
        contributing.sort(FOLD_ORDER);

        ResolvedConstraints resolved = fold(symbol, strategyId, contributing, hypotheses, constraints);
        audit(resolved, contributing);
        return resolved;
    }

    private ResolvedConstraints fold(
            String symbol,
            String strategyId,
            List<Constraint> contributing,
            RegistrySnapshot<Hypothesis> hypotheses,
            RegistrySnapshot<Constraint> constraints) {
        Map<ActionField, Object> folded = new EnumMap<>(ActionField.class);
        Map<ActionField, String> firstSetBy = new EnumMap<>(ActionField.class);
        List<ResolvedAction> actions = new ArrayList<>();

        for (Constraint constraint : contributing) {
            for (ActionField field : ActionField.values()) {
                Object value = field.valueOf(constraint.getActions());
                if (value == null) {
                    continue;
                }
                folded.put(field, field.fold(folded.get(field), value));
                firstSetBy.putIfAbsent(field, constraint.getId());
                actions.add(new ResolvedAction(constraint.getId(), constraint.getPriority(), field.getKey(), value));
            }
        }

        List<String> ids = contributing.stream().map(Constraint::getId).toList();
        String version = Hashing.sha256Hex(
                String.join(":", ids.stream().sorted().toList())
                        + "|" + hypotheses.getVersion() + "|" + constraints.getVersion(),
                VERSION_LENGTH);

        return ResolvedConstraints.builder()
                .symbol(symbol)
                .strategyId(strategyId)
                .actions(List.copyOf(actions))
                .contributingConstraintIds(ids)
                .effectiveRiskBudgetMultiplier(number(folded, ActionField.RISK_BUDGET_MULTIPLIER).doubleValue())
                .effectivePoolBiasMultiplier(number(folded, ActionField.POOL_BIAS_MULTIPLIER).doubleValue())
                .effectivePositionCapMultiplier(number(folded, ActionField.ADD_POSITION_CAP_MULTIPLIER).doubleValue())
                .effectiveHoldingExtensionDays(number(folded, ActionField.HOLDING_EXTENSION_DAYS).intValue())
                .vetoDowngrade((Boolean) valueOrIdentity(folded, ActionField.VETO_DOWNGRADE))
                .strategyEnabled((Boolean) valueOrIdentity(folded, ActionField.ENABLE_STRATEGY))
                .stopMode((StopMode) valueOrIdentity(folded, ActionField.STOP_MODE))
                .stopModeSource(firstSetBy.get(ActionField.STOP_MODE))
                .guardrails(mergeGuardrails(contributing))
                .version(version)
                .resolvedAt(clock.instant())
                .hypothesisRegistryVersion(hypotheses.getVersion())
                .constraintRegistryVersion(constraints.getVersion())
                .build();
    }

    private static Object valueOrIdentity(Map<ActionField, Object> folded, ActionField field) {
        return folded.getOrDefault(field, field.getIdentity());
    }

    private static Number number(Map<ActionField, Object> folded, ActionField field) {
        return (Number) valueOrIdentity(folded, field);
    }

    private static ConstraintGuardrails mergeGuardrails(List<Constraint> contributing) {
        return ConstraintGuardrails.builder()
                .maxPositionPct(min(contributing, ConstraintGuardrails::getMaxPositionPct))
                .maxGrossExposureDelta(min(contributing, ConstraintGuardrails::getMaxGrossExposureDelta))
                .maxDrawdownAddon(min(contributing, ConstraintGuardrails::getMaxDrawdownAddon))
                .build();
    }

    private static Double min(List<Constraint> contributing, Function<ConstraintGuardrails, Double> ceiling) {
        Double result = null;
        for (Constraint constraint : contributing) {
            Double value = ceiling.apply(constraint.getGuardrails());
            if (value != null && (result == null || value < result)) {
                result = value;
            }
        }
        return result;
    }

    // ========================
    // AUDIT
    // ========================

    private void audit(ResolvedConstraints resolved, List<Constraint> contributing) {
        String symbol = resolved.getSymbol();
        String strategyId = resolved.getStrategyId();
        List<String> ids = resolved.getContributingConstraintIds();

        for (Constraint constraint : contributing) {
            auditLogger.constraintActivated(symbol, strategyId, constraint);
        }

        if (resolved.isVetoDowngrade()) {
            for (Constraint constraint : contributing) {
                if (Boolean.TRUE.equals(constraint.getActions().getVetoDowngrade())) {
                    auditLogger.vetoDowngrade(symbol, strategyId, constraint.getId(), ids);
                }
            }
        }

        if (resolved.getEffectiveRiskBudgetMultiplier() != 1.0) {
            for (Constraint constraint : contributing) {
                Double multiplier = constraint.getActions().getRiskBudgetMultiplier();
                if (multiplier != null) {
                    auditLogger.riskBudgetAdjusted(symbol, strategyId, constraint.getId(), multiplier,
                            resolved.getEffectiveRiskBudgetMultiplier(), ids);
                }
            }
        }

        for (Constraint constraint : contributing) {
            Double capMultiplier = constraint.getActions().getAddPositionCapMultiplier();
            Double maxPositionPct = constraint.getGuardrails().getMaxPositionPct();
            if (capMultiplier == null && maxPositionPct == null) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("add_position_cap_multiplier", capMultiplier);
            details.put("max_position_pct", maxPositionPct);
            details.put("effective_position_cap_multiplier", resolved.getEffectivePositionCapMultiplier());
            details.put("effective_max_position_pct", resolved.getGuardrails().getMaxPositionPct());
            details.put("constraint_ids", ids);
            auditLogger.positionCapApplied(symbol, strategyId, constraint.getId(), details);
        }
    }
}
