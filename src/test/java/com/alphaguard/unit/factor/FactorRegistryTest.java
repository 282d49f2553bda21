package com.alphaguard.unit.factor;

import static com.alphaguard.unit.GovernanceFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alphaguard.domain.enums.ComparisonOperator;
import com.alphaguard.domain.enums.FactorStatus;
import com.alphaguard.domain.enums.FailureAction;
import com.alphaguard.exception.RegistryConflictException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.factor.Factor;
import com.alphaguard.factor.FactorFailureRule;
import com.alphaguard.factor.FactorHealthCheckResult;
import com.alphaguard.factor.FactorRegistry;
import com.alphaguard.monitoring.MetricProvider;
import com.alphaguard.monitoring.MetricRegistry;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link FactorRegistry}: registration, status changes and
 * failure-rule health checks.
 */
class FactorRegistryTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private final AtomicReference<Double> rollingIc = new AtomicReference<>(0.05);
    private final AtomicReference<Double> turnover = new AtomicReference<>(0.2);

    private MetricRegistry metricRegistry;
    private FactorRegistry factorRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        metricRegistry = new MetricRegistry(List.of(
                MetricProvider.of("rolling_ic", (scope, window) -> OptionalDouble.of(rollingIc.get())),
                MetricProvider.of("turnover", (scope, window) -> OptionalDouble.of(turnover.get()))));
        factorRegistry = new FactorRegistry(applicationEventPublisher, metricRegistry, fixedClock());
    }

    private static FactorFailureRule rule(String metric, ComparisonOperator op, double threshold, FailureAction action) {
        return FactorFailureRule.builder()
                .metric(metric)
                .operator(op)
                .threshold(threshold)
                .window("60d")
                .action(action)
                .build();
    }

    private static Factor earningsRevisionMomentum() {
        return Factor.builder()
                .id("earnings_revision_momentum")
                .name("Earnings revision momentum")
                .hypothesisIds(List.of("memory_supercycle"))
                .failureRules(List.of(
                        rule("rolling_ic", ComparisonOperator.LT, 0.0, FailureAction.DISABLE),
                        rule("turnover", ComparisonOperator.GT, 0.8, FailureAction.REVIEW)))
                .build();
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("register is idempotent and conflicts on changed content")
        void registerIdempotentAndConflict() {
            Factor factor = earningsRevisionMomentum();

            assertThat(factorRegistry.register(factor)).isTrue();
            assertThat(factorRegistry.register(factor)).isFalse();
            assertThatThrownBy(() -> factorRegistry.register(factor.toBuilder().name("Other").build()))
                    .isInstanceOf(RegistryConflictException.class);
        }

        @Test
        @DisplayName("replaceAll keeps a runtime-disabled status")
        void replaceAllCarriesStatus() {
            factorRegistry.replaceAll(List.of(earningsRevisionMomentum()), "load");
            factorRegistry.disable("earnings_revision_momentum");

            factorRegistry.replaceAll(List.of(earningsRevisionMomentum()), "reload");

            Factor reloaded = factorRegistry.get("earnings_revision_momentum");
            assertThat(reloaded.getStatus()).isEqualTo(FactorStatus.DISABLED);
            assertThat(reloaded.isEnabled()).isFalse();
            assertThat(factorRegistry.enabled()).isEmpty();
        }

        @Test
        @DisplayName("status changes on an unknown factor are not found")
        void unknownFactor() {
            assertThatThrownBy(() -> factorRegistry.disable("missing"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("checkHealth")
    class CheckHealth {

        @BeforeEach
        void register() {
            factorRegistry.register(earningsRevisionMomentum());
        }

        @Test
        @DisplayName("no rule met: factor stays ENABLED")
        void healthy() {
            List<FactorHealthCheckResult> results = factorRegistry.checkHealth("earnings_revision_momentum");

            assertThat(results).hasSize(2).noneMatch(FactorHealthCheckResult::isTriggered);
            assertThat(factorRegistry.get("earnings_revision_momentum").getStatus()).isEqualTo(FactorStatus.ENABLED);
        }

        @Test
        @DisplayName("review rule met: flagged for REVIEW but still enabled")
        void reviewFlags() {
            turnover.set(0.9);

            factorRegistry.checkHealth("earnings_revision_momentum");

            Factor factor = factorRegistry.get("earnings_revision_momentum");
            assertThat(factor.getStatus()).isEqualTo(FactorStatus.REVIEW);
            assertThat(factor.isEnabled()).isTrue();
        }

        @Test
        @DisplayName("disable beats review when both rules fire")
        void disableWins() {
            rollingIc.set(-0.02);
            turnover.set(0.9);

            List<FactorHealthCheckResult> results = factorRegistry.checkHealth("earnings_revision_momentum");

            assertThat(results).allMatch(FactorHealthCheckResult::isTriggered);
            Factor factor = factorRegistry.get("earnings_revision_momentum");
            assertThat(factor.getStatus()).isEqualTo(FactorStatus.DISABLED);
            assertThat(factor.isEnabled()).isFalse();
        }

        @Test
        @DisplayName("an unavailable metric never fires a rule")
        void unavailableMetric() {
            metricRegistry.unregister("rolling_ic");

            List<FactorHealthCheckResult> results = factorRegistry.checkHealth("earnings_revision_momentum");

            assertThat(results.get(0).isTriggered()).isFalse();
            assertThat(results.get(0).getMetricValue()).isNull();
            assertThat(factorRegistry.get("earnings_revision_momentum").getStatus()).isEqualTo(FactorStatus.ENABLED);
        }
    }
}
