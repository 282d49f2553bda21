package com.alphaguard.constraint;

import com.alphaguard.domain.enums.StopMode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate effect of every active constraint on one symbol (and optionally one
 * strategy) for one resolution epoch.
 *
 * <p>This is a cache entry computed by {@link ConstraintResolver}; it is never
 * hand-authored. The registry versions it was computed from let the resolver
 * discard an entry whose inputs have moved on, even inside its TTL.
 */
@Value
@Builder
public class ResolvedConstraints {

    String symbol;

    /** Strategy the resolution was scoped to, or null for all strategies. */
    String strategyId;

    /** Every action field set by a contributing constraint, in fold order. */
    List<ResolvedAction> actions;

    /** Contributing constraint ids in fold order (priority ascending, then id). */
    List<String> contributingConstraintIds;

    double effectiveRiskBudgetMultiplier;

    double effectivePoolBiasMultiplier;

    double effectivePositionCapMultiplier;

    int effectiveHoldingExtensionDays;

    boolean vetoDowngrade;

    boolean strategyEnabled;

    StopMode stopMode;

    /** Constraint that supplied the stop mode, or null when BASELINE is the default. */
    String stopModeSource;

    /** Minimum of each ceiling across contributing constraints. */
    ConstraintGuardrails guardrails;

    String version;

    Instant resolvedAt;

    long hypothesisRegistryVersion;

    long constraintRegistryVersion;

    @JsonIgnore
    public boolean isUnconstrained() {
        return contributingConstraintIds.isEmpty();
    }

    /**
     * Applies the position cap multiplier to a proposed position fraction, then
     * clamps it to the {@code max_position_pct} guardrail. The guardrail wins
     * over any multiplier regardless of constraint priority.
     */
    public double applyPositionCeiling(double proposedPositionPct) {
        double capped = proposedPositionPct * effectivePositionCapMultiplier;
        Double ceiling = guardrails.getMaxPositionPct();
        return ceiling != null ? Math.min(capped, ceiling) : capped;
    }
}
