package com.alphaguard.strategy;

import com.alphaguard.constraint.ConstraintResolver;
import com.alphaguard.constraint.ResolvedConstraints;
import com.alphaguard.domain.enums.RegimeState;
import com.alphaguard.pool.Pool;
import com.alphaguard.pool.PoolService;
import com.alphaguard.regime.RegimeDetector;
import com.alphaguard.regime.RegimeSnapshot;
import org.springframework.stereotype.Service;

/**
 * The single entry point trading logic uses to read governance.
 *
 * <p>An empty pool propagates {@link com.alphaguard.exception.EmptyPoolException}:
 * the caller must stop, not degrade. Without configured regime thresholds the
 * regime is NORMAL with pacing 1.0, since there is no threshold to exceed.
 */
@Service
public class StrategyGovernanceFacade {

    private final PoolService poolService;
    private final ConstraintResolver constraintResolver;
    private final RegimeDetector regimeDetector;

    public StrategyGovernanceFacade(
            PoolService poolService, ConstraintResolver constraintResolver, RegimeDetector regimeDetector) {
        this.poolService = poolService;
        this.constraintResolver = constraintResolver;
        this.regimeDetector = regimeDetector;
    }

    public GovernanceContext contextFor(String symbol) {
        return contextFor(symbol, null);
    }

    public GovernanceContext contextFor(String symbol, String strategyId) {
        Pool pool = poolService.current();
        ResolvedConstraints resolved = constraintResolver.resolveForStrategy(symbol, strategyId);

        String regimeState = RegimeState.NORMAL.name();
        double pacing = 1.0;
        if (regimeDetector.isConfigured()) {
            RegimeSnapshot regime = regimeDetector.current();
            regimeState = regime.getState().name();
            pacing = regime.getPacingMultiplier();
        }

        return GovernanceContext.builder()
                .symbol(symbol)
                .strategyId(strategyId)
                .poolSymbols(pool.getSymbols())
                .poolVersion(pool.getVersion())
                .inPool(pool.contains(symbol))
                .poolWeight(pool.weightOf(symbol))
                .regimeState(regimeState)
                .pacingMultiplier(pacing)
                .riskBudgetMultiplier(resolved.getEffectiveRiskBudgetMultiplier())
                .vetoDowngrade(resolved.isVetoDowngrade())
                .stopMode(resolved.getStopMode().name())
                .holdingExtensionDays(resolved.getEffectiveHoldingExtensionDays())
                .positionCapMultiplier(resolved.getEffectivePositionCapMultiplier())
                .maxPositionPct(resolved.getGuardrails().getMaxPositionPct())
                .strategyEnabled(resolved.isStrategyEnabled())
                .resolutionVersion(resolved.getVersion())
                .build();
    }
}
