package com.alphaguard.unit.pool;

import static com.alphaguard.unit.GovernanceFixtures.constraint;
import static com.alphaguard.unit.GovernanceFixtures.entry;
import static com.alphaguard.unit.GovernanceFixtures.fixedClock;
import static com.alphaguard.unit.GovernanceFixtures.hypothesis;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.alphaguard.constraint.ConstraintActions;
import com.alphaguard.constraint.ConstraintRegistry;
import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.domain.enums.PoolDecision;
import com.alphaguard.exception.EmptyPoolException;
import com.alphaguard.hypothesis.HypothesisRegistry;
import com.alphaguard.hypothesis.HypothesisScope;
import com.alphaguard.pool.Pool;
import com.alphaguard.pool.PoolAuditEntry;
import com.alphaguard.pool.PoolBuilder;
import com.alphaguard.pool.PoolGatingConfig;
import com.alphaguard.pool.StructuralFilters;
import com.alphaguard.pool.UniverseEntry;
import com.alphaguard.registry.GovernanceState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link PoolBuilder}.
 *
 * <p>Tests structural filter reasons, hypothesis gating, bias weights, the
 * empty-pool failure and build determinism.
 */
class PoolBuilderTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private HypothesisRegistry hypothesisRegistry;
    private ConstraintRegistry constraintRegistry;
    private PoolBuilder poolBuilder;

    private final List<UniverseEntry> universe = List.of(
            entry("AAPL", "technology", 9_000_000_000.0, 3_000_000_000_000.0, 190.0),
            entry("MU", "semiconductors", 2_000_000_000.0, 120_000_000_000.0, 105.0),
            entry("WDC", "semiconductors", 500_000_000.0, 20_000_000_000.0, 60.0),
            entry("NEE", "utilities", 800_000_000.0, 150_000_000_000.0, 72.0),
            entry("PNNY", "technology", 100_000.0, 50_000_000.0, 0.4));

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        hypothesisRegistry = new HypothesisRegistry(applicationEventPublisher);
        constraintRegistry = new ConstraintRegistry(applicationEventPublisher);
        poolBuilder = new PoolBuilder(new GovernanceState(hypothesisRegistry, constraintRegistry), fixedClock());
    }

    @Nested
    @DisplayName("structural filters")
    class StructuralFiltering {

        @Test
        @DisplayName("excluded symbols carry the first failing filter as reason")
        void excludedWithReason() {
            StructuralFilters filters = StructuralFilters.builder()
                    .minAvgDollarVolume(1_000_000.0)
                    .minPrice(1.0)
                    .build();

            Pool pool = poolBuilder.build(universe, filters, PoolGatingConfig.NONE);

            assertThat(pool.getSymbols()).containsExactly("AAPL", "MU", "NEE", "WDC");
            PoolAuditEntry excluded = pool.getAuditTrail().stream()
                    .filter(e -> e.getDecision() == PoolDecision.EXCLUDED)
                    .findFirst()
                    .orElseThrow();
            assertThat(excluded.getSymbol()).isEqualTo("PNNY");
            assertThat(excluded.getReason()).startsWith("structural_filter:min_avg_dollar_volume (");
            assertThat(excluded.getSource()).isEqualTo("min_avg_dollar_volume");
        }

        @Test
        @DisplayName("sector exclusion and missing data exclude the symbol")
        void sectorAndMissingData() {
            List<UniverseEntry> withMissing = new ArrayList<>(universe);
            withMissing.add(UniverseEntry.builder().symbol("XOM").sector("energy").build());
            StructuralFilters filters = StructuralFilters.builder()
                    .excludeSectors(List.of("utilities"))
                    .minMarketCap(1_000_000_000.0)
                    .build();

            Pool pool = poolBuilder.build(withMissing, filters, PoolGatingConfig.NONE);

            assertThat(pool.getSymbols()).containsExactly("AAPL", "MU", "WDC");
            assertThat(pool.getAuditTrail())
                    .filteredOn(e -> e.getDecision() == PoolDecision.EXCLUDED)
                    .extracting(PoolAuditEntry::getSymbol, PoolAuditEntry::getReason)
                    .contains(
                            tuple("NEE",
                                    "structural_filter:exclude_sectors (sector 'utilities' in exclusion list)"),
                            tuple("XOM",
                                    "structural_filter:min_market_cap (market_cap missing)"));
        }

        @Test
        @DisplayName("everything excluded raises EmptyPoolException with the audit trail")
        void emptyPoolThrows() {
            StructuralFilters filters = StructuralFilters.builder().minPrice(10_000.0).build();

            assertThatThrownBy(() -> poolBuilder.build(universe, filters, PoolGatingConfig.NONE))
                    .isInstanceOf(EmptyPoolException.class)
                    .satisfies(e -> assertThat(((EmptyPoolException) e).getAuditTrail()).hasSize(5));
        }
    }

    @Nested
    @DisplayName("hypothesis gating")
    class Gating {

        @Test
        @DisplayName("denylist excludes the scope symbols of an ACTIVE hypothesis only")
        void denylist() {
            hypothesisRegistry.register(hypothesis("memory_bust", HypothesisStatus.ACTIVE)
                    .scope(HypothesisScope.builder().symbols(List.of("WDC")).build())
                    .build());
            hypothesisRegistry.register(hypothesis("draft_bust", HypothesisStatus.DRAFT)
                    .scope(HypothesisScope.builder().symbols(List.of("MU")).build())
                    .build());
            PoolGatingConfig gating = PoolGatingConfig.builder()
                    .denylistHypotheses(List.of("memory_bust", "draft_bust"))
                    .build();

            Pool pool = poolBuilder.build(universe, StructuralFilters.NONE, gating);

            assertThat(pool.getSymbols()).containsExactly("AAPL", "MU", "NEE", "PNNY");
            assertThat(pool.getAuditTrail()).contains(
                    PoolAuditEntry.excluded("WDC", "hypothesis:memory_bust", "memory_bust"));
        }

        @Test
        @DisplayName("allowlist restricts the pool to scope symbols and sectors")
        void allowlist() {
            hypothesisRegistry.register(hypothesis("memory_supercycle", HypothesisStatus.ACTIVE)
                    .scope(HypothesisScope.builder()
                            .symbols(List.of("AAPL"))
                            .sectors(List.of("semiconductors"))
                            .build())
                    .build());
            PoolGatingConfig gating = PoolGatingConfig.builder()
                    .allowlistHypotheses(List.of("memory_supercycle"))
                    .build();

            Pool pool = poolBuilder.build(universe, StructuralFilters.NONE, gating);

            assertThat(pool.getSymbols()).containsExactly("AAPL", "MU", "WDC");
            assertThat(pool.getAuditTrail()).contains(
                    PoolAuditEntry.excluded("NEE", "hypothesis_allowlist:memory_supercycle", "memory_supercycle"));
        }

        @Test
        @DisplayName("bias weight comes from active linked constraints, else the configured default")
        void biasWeights() {
            hypothesisRegistry.register(hypothesis("energy_policy_tailwind", HypothesisStatus.ACTIVE)
                    .scope(HypothesisScope.builder().sectors(List.of("utilities")).build())
                    .build());
            PoolGatingConfig gating = PoolGatingConfig.builder()
                    .biasHypotheses(List.of("energy_policy_tailwind"))
                    .biasMultiplier(1.2)
                    .build();

            Pool defaultWeight = poolBuilder.build(universe, StructuralFilters.NONE, gating);
            assertThat(defaultWeight.weightOf("NEE")).isEqualTo(1.2);
            assertThat(defaultWeight.weightOf("MU")).isEqualTo(1.0);

            constraintRegistry.register(constraint("utilities_pool_bias", 50, "energy_policy_tailwind")
                    .actions(ConstraintActions.builder().poolBiasMultiplier(1.3).build())
                    .build());

            Pool constrained = poolBuilder.build(universe, StructuralFilters.NONE, gating);
            assertThat(constrained.getWeights()).containsOnlyKeys("NEE");
            assertThat(constrained.weightOf("NEE")).isEqualTo(1.3);
            assertThat(constrained.getAuditTrail()).contains(
                    PoolAuditEntry.prioritized("NEE", "energy_policy_tailwind"));
            assertThat(constrained.getContentHash()).isNotEqualTo(defaultWeight.getContentHash());
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("same inputs at different times give the same symbols and hash")
        void sameInputsSameHash() {
            PoolBuilder later = new PoolBuilder(new GovernanceState(hypothesisRegistry, constraintRegistry),
                    fixedClock(Instant.parse("2026-03-11T09:00:00Z")));
            List<UniverseEntry> shuffled = new ArrayList<>(universe);
            Collections.shuffle(shuffled, new Random(42));
            StructuralFilters filters = StructuralFilters.builder().minPrice(1.0).build();

            Pool first = poolBuilder.build(universe, filters, PoolGatingConfig.NONE);
            Pool second = later.build(shuffled, filters, PoolGatingConfig.NONE);

            assertThat(second.getSymbols()).isEqualTo(first.getSymbols());
            assertThat(second.getAuditTrail()).isEqualTo(first.getAuditTrail());
            assertThat(second.getContentHash()).isEqualTo(first.getContentHash());
            assertThat(first.getVersion()).isEqualTo("20260310_" + first.getContentHash());
            assertThat(second.getVersion()).isEqualTo("20260311_" + first.getContentHash());
            assertThat(first.getContentHash()).matches("[0-9a-f]{12}");
        }

        @Test
        @DisplayName("duplicate universe symbols collapse to one")
        void duplicatesCollapse() {
            List<UniverseEntry> duplicated = new ArrayList<>(universe);
            duplicated.add(entry("MU", "semiconductors", 1.0, 1.0, 1.0));

            Pool pool = poolBuilder.build(duplicated, StructuralFilters.NONE, PoolGatingConfig.NONE);

            assertThat(pool.getSymbols()).containsExactly("AAPL", "MU", "NEE", "PNNY", "WDC");
        }
    }
}
