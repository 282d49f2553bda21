package com.alphaguard.unit.strategy;

import static com.alphaguard.unit.GovernanceFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.alphaguard.constraint.ConstraintGuardrails;
import com.alphaguard.constraint.ConstraintResolver;
import com.alphaguard.constraint.ResolvedConstraints;
import com.alphaguard.domain.enums.RegimeState;
import com.alphaguard.domain.enums.StopMode;
import com.alphaguard.exception.EmptyPoolException;
import com.alphaguard.pool.Pool;
import com.alphaguard.pool.PoolService;
import com.alphaguard.regime.RegimeDetector;
import com.alphaguard.regime.RegimeSnapshot;
import com.alphaguard.strategy.GovernanceContext;
import com.alphaguard.strategy.StrategyGovernanceFacade;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StrategyGovernanceFacadeTest {

    @Mock
    private PoolService poolService;

    @Mock
    private ConstraintResolver constraintResolver;

    @Mock
    private RegimeDetector regimeDetector;

    private StrategyGovernanceFacade facade;

    @BeforeEach
    void setUp() {
        facade = new StrategyGovernanceFacade(poolService, constraintResolver, regimeDetector);
    }

    private ResolvedConstraints resolved() {
        return ResolvedConstraints.builder()
                .symbol("MU")
                .actions(List.of())
                .contributingConstraintIds(List.of("memory_risk_budget"))
                .effectiveRiskBudgetMultiplier(1.5)
                .effectivePoolBiasMultiplier(1.0)
                .effectivePositionCapMultiplier(1.2)
                .effectiveHoldingExtensionDays(5)
                .vetoDowngrade(true)
                .strategyEnabled(true)
                .stopMode(StopMode.WIDE)
                .guardrails(ConstraintGuardrails.builder().maxPositionPct(0.08).build())
                .version("0123456789abcdef")
                .resolvedAt(NOW)
                .build();
    }

    private Pool pool() {
        return Pool.builder()
                .symbols(List.of("AAPL", "MU"))
                .weights(Map.of("MU", 1.3))
                .version("20260310_abcdefabcdef")
                .contentHash("abcdefabcdef")
                .builtAt(NOW)
                .auditTrail(List.of())
                .build();
    }

    @Test
    @DisplayName("contextFor: flattens pool, resolution and regime into scalars")
    void flattensGovernance() {
        when(poolService.current()).thenReturn(pool());
        when(constraintResolver.resolveForStrategy("MU", "swing")).thenReturn(resolved());
        when(regimeDetector.isConfigured()).thenReturn(true);
        when(regimeDetector.current()).thenReturn(RegimeSnapshot.builder()
                .state(RegimeState.TRANSITION)
                .pacingMultiplier(0.5)
                .detectedAt(NOW)
                .metrics(Map.of())
                .build());

        GovernanceContext context = facade.contextFor("MU", "swing");

        assertThat(context.isInPool()).isTrue();
        assertThat(context.getPoolWeight()).isEqualTo(1.3);
        assertThat(context.getRiskBudgetMultiplier()).isEqualTo(1.5);
        assertThat(context.getStopMode()).isEqualTo("WIDE");
        assertThat(context.getMaxPositionPct()).isEqualTo(0.08);
        assertThat(context.isVetoDowngrade()).isTrue();
        assertThat(context.getRegimeState()).isEqualTo("TRANSITION");
        assertThat(context.getPacingMultiplier()).isEqualTo(0.5);
        assertThat(context.getResolutionVersion()).isEqualTo("0123456789abcdef");
    }

    @Test
    @DisplayName("contextFor: without regime thresholds the regime is NORMAL with pacing 1.0")
    void unconfiguredRegime() {
        when(poolService.current()).thenReturn(pool());
        when(constraintResolver.resolveForStrategy("XOM", null)).thenReturn(resolved());
        when(regimeDetector.isConfigured()).thenReturn(false);

        GovernanceContext context = facade.contextFor("XOM");

        assertThat(context.isInPool()).isFalse();
        assertThat(context.getPoolWeight()).isEqualTo(1.0);
        assertThat(context.getRegimeState()).isEqualTo("NORMAL");
        assertThat(context.getPacingMultiplier()).isEqualTo(1.0);
        verify(regimeDetector, never()).current();
    }

    @Test
    @DisplayName("contextFor: an empty pool stops the caller")
    void emptyPoolPropagates() {
        when(poolService.current()).thenThrow(new EmptyPoolException("Pool is empty", List.of()));

        assertThatThrownBy(() -> facade.contextFor("MU")).isInstanceOf(EmptyPoolException.class);
    }
}
