package com.alphaguard.pool;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.exception.EmptyPoolException;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisLookup;
import com.alphaguard.hypothesis.HypothesisScope;
import com.alphaguard.mapper.JsonHelper;
import com.alphaguard.registry.GovernanceState;
import com.alphaguard.registry.GovernanceView;
import com.alphaguard.registry.RegistrySnapshot;
import com.alphaguard.util.Hashing;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds deterministic, versioned trading pools.
 *
 * <p>Build steps:
 * <ol>
 *   <li>sort the base universe by symbol and drop duplicate symbols</li>
 *   <li>apply {@link StructuralFilter}s in their fixed order</li>
 *   <li>apply hypothesis gating: denylist, then allowlist, then sector bias</li>
 *   <li>hash a canonical serialization of every input and stamp the version</li>
 * </ol>
 *
 * <p>The builder reads one {@link GovernanceView} per build and has no other
 * state, so identical inputs always give identical symbols, weights, audit trail
 * and content hash. The build time only appears in {@code builtAt} and in the
 * date prefix of the version.
 */
@Component
public class PoolBuilder {

    private static final Logger log = LoggerFactory.getLogger(PoolBuilder.class);

    private static final DateTimeFormatter VERSION_DATE =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final int HASH_LENGTH = 12;

    private final GovernanceState governanceState;
    private final Clock clock;

    public PoolBuilder(GovernanceState governanceState, Clock clock) {
        this.governanceState = governanceState;
        this.clock = clock;
    }

    /**
     * Builds a pool from the universe.
     *
     * @throws EmptyPoolException if no symbol survives filtering and gating
     */
    public Pool build(List<UniverseEntry> universe, StructuralFilters filters, PoolGatingConfig gating) {
        GovernanceView view = governanceState.capture();
        RegistrySnapshot<Hypothesis> hypotheses = view.getHypotheses();
        RegistrySnapshot<Constraint> constraints = view.getConstraints();
        HypothesisLookup lookup = view.hypothesisLookup();

        List<UniverseEntry> sorted = sortedDistinct(universe);
        List<PoolAuditEntry> auditTrail = new ArrayList<>();

        // Step 1: structural filters
        List<UniverseEntry> remaining = new ArrayList<>();
        for (UniverseEntry entry : sorted) {
            Optional<StructuralFilter.Rejection> rejection = StructuralFilter.firstFailure(entry, filters);
            if (rejection.isPresent()) {
                auditTrail.add(PoolAuditEntry.excluded(
                        entry.getSymbol(), rejection.get().reason(), rejection.get().filter().getFilterName()));
            } else {
                remaining.add(entry);
            }
        }

        // Step 2: denylist
        Map<String, String> denied = denylistedSymbols(gating.getDenylistHypotheses(), hypotheses);
        List<UniverseEntry> afterDenylist = new ArrayList<>();
        for (UniverseEntry entry : remaining) {
            String hypothesisId = denied.get(entry.getSymbol());
            if (hypothesisId != null) {
                auditTrail.add(PoolAuditEntry.excluded(entry.getSymbol(), "hypothesis:" + hypothesisId, hypothesisId));
            } else {
                afterDenylist.add(entry);
            }
        }

        // Step 3: allowlist
        List<Hypothesis> allowlist = activeIn(gating.getAllowlistHypotheses(), hypotheses);
        List<UniverseEntry> gated = afterDenylist;
        if (!allowlist.isEmpty()) {
            String source = allowlist.get(0).getId();
            gated = new ArrayList<>();
            for (UniverseEntry entry : afterDenylist) {
                if (allowlist.stream().anyMatch(h -> scopeNames(h.getScope(), entry))) {
                    gated.add(entry);
                } else {
                    auditTrail.add(PoolAuditEntry.excluded(
                            entry.getSymbol(), "hypothesis_allowlist:" + source, source));
                }
            }
        }

        // Step 4: sector bias
        Map<String, Double> biasWeights = biasWeights(gating, hypotheses, constraints, lookup);
        Map<String, Double> weights = new TreeMap<>();
        for (UniverseEntry entry : gated) {
            for (Hypothesis hypothesis : activeIn(gating.getBiasHypotheses(), hypotheses)) {
                double weight = biasWeights.get(hypothesis.getId());
                if (weight != 1.0 && entry.getSector() != null
                        && hypothesis.getScope().getSectors().contains(entry.getSector())) {
                    weights.put(entry.getSymbol(), weight);
                    auditTrail.add(PoolAuditEntry.prioritized(entry.getSymbol(), hypothesis.getId()));
                    break;
                }
            }
        }

        List<String> symbols = gated.stream().map(UniverseEntry::getSymbol).toList();
        symbols.forEach(symbol -> auditTrail.add(PoolAuditEntry.included(symbol)));

        if (symbols.isEmpty()) {
            log.error("Pool build produced no symbols: {} universe entries, all excluded", sorted.size());
            throw new EmptyPoolException("Pool is empty after filtering: all symbols were excluded", auditTrail);
        }

        String contentHash = contentHash(sorted, filters, gating, hypotheses, biasWeights);
        Instant builtAt = clock.instant();
        String version = VERSION_DATE.format(builtAt) + "_" + contentHash;
        log.info("Built pool {}: {} of {} symbols, {} prioritized", version, symbols.size(), sorted.size(), weights.size());

        return Pool.builder()
                .symbols(symbols)
                .weights(Map.copyOf(weights))
                .version(version)
                .contentHash(contentHash)
                .builtAt(builtAt)
                .auditTrail(List.copyOf(auditTrail))
                .build();
    }

    // ========================
    // GATING
    // ========================

    private Map<String, String> denylistedSymbols(List<String> hypothesisIds, RegistrySnapshot<Hypothesis> hypotheses) {
        Map<String, String> denied = new LinkedHashMap<>();
        for (Hypothesis hypothesis : activeIn(hypothesisIds, hypotheses)) {
            for (String symbol : hypothesis.getScope().getSymbols()) {
                denied.putIfAbsent(symbol, hypothesis.getId());
            }
        }
        return denied;
    }

    /**
     * Weight per bias hypothesis: the product of pool_bias_multiplier over its
     * active linked constraints, or the configured default when none sets one.
     */
    private Map<String, Double> biasWeights(
            PoolGatingConfig gating,
            RegistrySnapshot<Hypothesis> hypotheses,
            RegistrySnapshot<Constraint> constraints,
            HypothesisLookup lookup) {
        Map<String, Double> weights = new TreeMap<>();
        for (Hypothesis hypothesis : activeIn(gating.getBiasHypotheses(), hypotheses)) {
            Double product = null;
            for (Constraint constraint : constraints.values()) {
                Double multiplier = constraint.getActions().getPoolBiasMultiplier();
                if (multiplier != null && constraint.dependsOn(hypothesis.getId()) && constraint.isActive(lookup)) {
                    product = product == null ? multiplier : product * multiplier;
                }
            }
            weights.put(hypothesis.getId(), product != null ? product : gating.getBiasMultiplier());
        }
        return weights;
    }

    /** ACTIVE hypotheses among the ids, in sorted id order. Unknown ids are ignored. */
    private List<Hypothesis> activeIn(List<String> hypothesisIds, RegistrySnapshot<Hypothesis> hypotheses) {
        return new TreeSet<>(hypothesisIds).stream()
                .map(hypotheses::find)
                .flatMap(Optional::stream)
                .filter(Hypothesis::isActive)
                .toList();
    }

    private boolean scopeNames(HypothesisScope scope, UniverseEntry entry) {
        return scope.getSymbols().contains(entry.getSymbol())
                || (entry.getSector() != null && scope.getSectors().contains(entry.getSector()));
    }

    // ========================
    // VERSIONING
    // ========================

    private List<UniverseEntry> sortedDistinct(List<UniverseEntry> universe) {
        Set<String> seen = new HashSet<>();
        List<UniverseEntry> sorted = new ArrayList<>(universe);
        sorted.sort(Comparator.comparing(UniverseEntry::getSymbol));
        sorted.removeIf(entry -> !seen.add(entry.getSymbol()));
        return sorted;
    }

    private String contentHash(
            List<UniverseEntry> universe,
            StructuralFilters filters,
            PoolGatingConfig gating,
            RegistrySnapshot<Hypothesis> hypotheses,
            Map<String, Double> biasWeights) {
        Set<String> gatingIds = new TreeSet<>();
        gatingIds.addAll(gating.getDenylistHypotheses());
        gatingIds.addAll(gating.getAllowlistHypotheses());
        gatingIds.addAll(gating.getBiasHypotheses());

        Map<String, Object> activeGating = new TreeMap<>();
        for (Hypothesis hypothesis : activeIn(List.copyOf(gatingIds), hypotheses)) {
            activeGating.put(hypothesis.getId(), hypothesis.getScope());
        }

        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("universe", universe);
        canonical.put("filters", filters);
        canonical.put("gating", Map.of(
                "denylist_hypotheses", new TreeSet<>(gating.getDenylistHypotheses()),
                "allowlist_hypotheses", new TreeSet<>(gating.getAllowlistHypotheses()),
                "bias_hypotheses", new TreeSet<>(gating.getBiasHypotheses()),
                "bias_multiplier", gating.getBiasMultiplier()));
        canonical.put("active_gating_hypotheses", activeGating);
        canonical.put("bias_weights", biasWeights);
        return Hashing.sha256Hex(JsonHelper.toCanonicalJson(canonical), HASH_LENGTH);
    }
}
