package com.alphaguard.unit.constraint;

import static com.alphaguard.unit.GovernanceFixtures.activeHypothesis;
import static com.alphaguard.unit.GovernanceFixtures.constraint;
import static com.alphaguard.unit.GovernanceFixtures.hypothesis;
import static com.alphaguard.unit.GovernanceFixtures.riskBudget;
import static com.alphaguard.unit.GovernanceFixtures.symbols;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.constraint.ConstraintApplicability;
import com.alphaguard.constraint.ConstraintRegistry;
import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.domain.model.RegistryFilter;
import com.alphaguard.event.GovernanceRegistryChangedEvent;
import com.alphaguard.exception.RegistryConflictException;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisLookup;
import com.alphaguard.registry.RegistrySnapshot;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link ConstraintRegistry} and constraint activation.
 */
class ConstraintRegistryTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private ConstraintRegistry constraintRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        constraintRegistry = new ConstraintRegistry(applicationEventPublisher);
    }

    @Test
    @DisplayName("register: idempotent for identical content, conflict otherwise")
    void registerIdempotentAndConflict() {
        Constraint budget = constraint("memory_risk_budget", 10, "memory_supercycle")
                .actions(riskBudget(1.5))
                .build();

        assertThat(constraintRegistry.register(budget)).isTrue();
        assertThat(constraintRegistry.register(budget)).isFalse();
        assertThatThrownBy(() -> constraintRegistry.register(budget.toBuilder().priority(5).build()))
                .isInstanceOf(RegistryConflictException.class);

        verify(applicationEventPublisher, times(1)).publishEvent(any(GovernanceRegistryChangedEvent.class));
    }

    @Test
    @DisplayName("list: filters by symbol and strategy, empty applicability means all")
    void listFiltersBySymbolAndStrategy() {
        constraintRegistry.register(constraint("memory_only", 10).appliesTo(symbols("MU")).build());
        constraintRegistry.register(constraint("global", 50).build());
        constraintRegistry.register(constraint("swing_only", 30)
                .appliesTo(ConstraintApplicability.builder().strategies(List.of("swing")).build())
                .build());

        assertThat(constraintRegistry.list(RegistryFilter.bySymbol("MU")))
                .extracting(Constraint::getId)
                .containsExactly("global", "memory_only", "swing_only");
        assertThat(constraintRegistry.list(RegistryFilter.bySymbol("XOM")))
                .extracting(Constraint::getId)
                .containsExactly("global", "swing_only");
        assertThat(constraintRegistry.list(RegistryFilter.builder().symbol("MU").strategy("momentum").build()))
                .extracting(Constraint::getId)
                .containsExactly("global", "memory_only");
    }

    @Test
    @DisplayName("linkedTo: returns constraints whose activation names the hypothesis")
    void linkedTo() {
        constraintRegistry.register(constraint("memory_risk_budget", 10, "memory_supercycle").build());
        constraintRegistry.register(constraint("memory_stop_wide", 20, "memory_supercycle", "dram_tightness").build());
        constraintRegistry.register(constraint("oil_bias", 30, "oil_glut").build());

        assertThat(constraintRegistry.linkedTo("memory_supercycle"))
                .extracting(Constraint::getId)
                .containsExactly("memory_risk_budget", "memory_stop_wide");
    }

    @Test
    @DisplayName("isActive: requires every listed hypothesis ACTIVE; unknown hypothesis fails closed")
    void activationIsDerivedFromHypotheses() {
        RegistrySnapshot<Hypothesis> hypotheses = RegistrySnapshot.of(
                List.of(activeHypothesis("memory_supercycle", "MU"),
                        hypothesis("dram_tightness", HypothesisStatus.DRAFT).build()),
                Hypothesis::getId, 1L);
        HypothesisLookup lookup = hypotheses::find;

        assertThat(constraint("a", 10, "memory_supercycle").build().isActive(lookup)).isTrue();
        assertThat(constraint("b", 10, "memory_supercycle", "dram_tightness").build().isActive(lookup)).isFalse();
        assertThat(constraint("c", 10, "never_registered").build().isActive(lookup)).isFalse();
        assertThat(constraint("d", 10).build().isActive(lookup)).isTrue();
    }
}
