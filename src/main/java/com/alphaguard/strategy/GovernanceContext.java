package com.alphaguard.strategy;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * What a strategy evaluation is allowed to see of governance: pre-resolved
 * scalars only. No hypothesis text, no constraint objects, no registry
 * handles. Strings are enum names, so nothing here points back into the
 * governance packages.
 */
@Value
@Builder
public class GovernanceContext {

    String symbol;

    String strategyId;

    List<String> poolSymbols;

    String poolVersion;

    boolean inPool;

    double poolWeight;

    String regimeState;

    double pacingMultiplier;

    double riskBudgetMultiplier;

    boolean vetoDowngrade;

    String stopMode;

    int holdingExtensionDays;

    double positionCapMultiplier;

    /** Null when no contributing constraint sets a ceiling. */
    Double maxPositionPct;

    boolean strategyEnabled;

    /** Version token of the resolution these values came from. */
    String resolutionVersion;
}
