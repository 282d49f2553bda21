package com.alphaguard.unit.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.domain.enums.ComparisonOperator;
import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.domain.enums.RegimeState;
import com.alphaguard.domain.enums.StopMode;
import com.alphaguard.domain.enums.TriggerAction;
import com.alphaguard.exception.ValidationException;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.loader.GovernanceDocumentParser;
import com.alphaguard.pool.UniverseEntry;
import com.alphaguard.regime.RegimeConfig;
import jakarta.validation.Validation;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link GovernanceDocumentParser}.
 *
 * <p>Every rejection must name the file and the offending field.
 */
class GovernanceDocumentParserTest {

    private GovernanceDocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new GovernanceDocumentParser(Validation.buildDefaultValidatorFactory().getValidator());
    }

    private static final String HYPOTHESIS = """
            id: memory_supercycle
            title: Memory pricing supercycle
            statement: DRAM contract prices keep rising.
            scope:
              symbols: [MU, WDC]
            status: ACTIVE
            created_at: 2026-01-15
            falsifiers:
              - metric: dram_contract_price_qoq
                operator: "<"
                threshold: 0.0
                window: 1q
                trigger: sunset
            """;

    @Nested
    @DisplayName("hypotheses")
    class Hypotheses {

        @Test
        @DisplayName("parses a complete document with defaults filled in")
        void parsesValid() {
            Hypothesis hypothesis = parser.parseHypothesis("hypotheses/memory_supercycle.yml", HYPOTHESIS);

            assertThat(hypothesis.getId()).isEqualTo("memory_supercycle");
            assertThat(hypothesis.getStatus()).isEqualTo(HypothesisStatus.ACTIVE);
            assertThat(hypothesis.getCreatedAt()).isEqualTo(LocalDate.of(2026, 1, 15));
            assertThat(hypothesis.getScope().getSymbols()).containsExactly("MU", "WDC");
            assertThat(hypothesis.getOwner()).isEqualTo("human");
            assertThat(hypothesis.getFalsifiers()).singleElement().satisfies(f -> {
                assertThat(f.getOperator()).isEqualTo(ComparisonOperator.LT);
                assertThat(f.getTrigger()).isEqualTo(TriggerAction.SUNSET);
            });
        }

        @Test
        @DisplayName("an empty falsifier list is rejected")
        void emptyFalsifiers() {
            String content = HYPOTHESIS.substring(0, HYPOTHESIS.indexOf("falsifiers:")) + "falsifiers: []\n";

            assertThatThrownBy(() -> parser.parseHypothesis("hypotheses/h.yml", content))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getFile()).isEqualTo("hypotheses/h.yml");
                        assertThat(e.getField()).isEqualTo("falsifiers");
                    });
        }

        @Test
        @DisplayName("a missing falsifier list is rejected")
        void missingFalsifiers() {
            String content = HYPOTHESIS.substring(0, HYPOTHESIS.indexOf("falsifiers:"));

            assertThatThrownBy(() -> parser.parseHypothesis("hypotheses/h.yml", content))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("falsifiers"));
        }

        @Test
        @DisplayName("an unknown operator names the falsifier entry")
        void unknownOperator() {
            String content = HYPOTHESIS.replace("operator: \"<\"", "operator: \"~=\"");

            assertThatThrownBy(() -> parser.parseHypothesis("hypotheses/h.yml", content))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).startsWith("falsifiers[0]"));
        }

        @Test
        @DisplayName("a bad window unit is rejected by field validation")
        void badWindow() {
            String content = HYPOTHESIS.replace("window: 1q", "window: 3h");

            assertThatThrownBy(() -> parser.parseHypothesis("hypotheses/h.yml", content))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("falsifiers[0].window"));
        }

        @Test
        @DisplayName("unknown top-level keys are rejected")
        void unknownKey() {
            assertThatThrownBy(() -> parser.parseHypothesis("hypotheses/h.yml", HYPOTHESIS + "confidence: high\n"))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getField()).isEqualTo("confidence");
                        assertThat(e.getMessage()).contains("unknown field");
                    });
        }
    }

    @Nested
    @DisplayName("constraints")
    class Constraints {

        @Test
        @DisplayName("parses actions, guardrails and priority")
        void parsesValid() {
            Constraint constraint = parser.parseConstraint("constraints/memory_stop_wide.yml", """
                    id: memory_stop_wide
                    title: Wide stops for memory names
                    activation:
                      requires_hypotheses_active: [memory_supercycle]
                    actions:
                      stop_mode: wide
                      veto_downgrade: true
                      holding_extension_days: 5
                    guardrails:
                      max_drawdown_addon: 0.02
                    priority: 20
                    """);

            assertThat(constraint.getActions().getStopMode()).isEqualTo(StopMode.WIDE);
            assertThat(constraint.getActions().getVetoDowngrade()).isTrue();
            assertThat(constraint.getGuardrails().getMaxDrawdownAddon()).isEqualTo(0.02);
            assertThat(constraint.getPriority()).isEqualTo(20);
            assertThat(constraint.getActivation().getDisabledIfFalsified()).isTrue();
        }

        @Test
        @DisplayName("an action outside the closed set is rejected with the allowed list")
        void unknownAction() {
            assertThatThrownBy(() -> parser.parseConstraint("constraints/x.yml", """
                    id: memory_leverage
                    title: Leverage
                    actions:
                      leverage_multiplier: 3.0
                    """))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.getField()).isEqualTo("actions.leverage_multiplier");
                        assertThat(e.getMessage())
                                .contains("not an allowed action field")
                                .contains("risk_budget_multiplier");
                    });
        }

        @Test
        @DisplayName("a risk budget multiplier below 1.0 is out of range")
        void riskBudgetRange() {
            assertThatThrownBy(() -> parser.parseConstraint("constraints/x.yml", """
                    id: shrink
                    title: Shrink
                    actions:
                      risk_budget_multiplier: 0.5
                    """))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("actions.risk_budget_multiplier"));
        }

        @Test
        @DisplayName("an identifier with upper case letters is rejected")
        void badId() {
            assertThatThrownBy(() -> parser.parseConstraint("constraints/x.yml", "id: Memory\ntitle: t\n"))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("id"));
        }
    }

    @Nested
    @DisplayName("other documents")
    class OtherDocuments {

        @Test
        @DisplayName("a factor without failure rules is rejected")
        void factorWithoutRules() {
            assertThatThrownBy(() -> parser.parseFactor("factors/f.yml", "id: value_tilt\nname: Value tilt\n"))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("failure_rules"));
        }

        @Test
        @DisplayName("malformed YAML names the whole document")
        void malformedYaml() {
            assertThatThrownBy(() -> parser.parseConstraint("constraints/x.yml", "id: [unclosed\ntitle: t\n"))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("<document>"));
        }

        @Test
        @DisplayName("an empty document is rejected")
        void emptyDocument() {
            assertThatThrownBy(() -> parser.parseFilters("pool/filters.yml", "  \n"))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getMessage()).contains("document is empty"));
        }

        @Test
        @DisplayName("universe entries are validated with their list index")
        void universeIndex() {
            List<UniverseEntry> universe = parser.parseUniverse("pool/universe.yml", """
                    - symbol: MU
                      price: 105.0
                    """);
            assertThat(universe).extracting(UniverseEntry::getSymbol).containsExactly("MU");

            assertThatThrownBy(() -> parser.parseUniverse("pool/universe.yml", """
                    - symbol: MU
                    - symbol: WDC
                      price: -1.0
                    """))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("[1].price"));
        }

        @Test
        @DisplayName("regime thresholds must be ordered and pacing defaults apply")
        void regime() {
            RegimeConfig config = parser.parseRegime("regime/thresholds.yml", """
                    thresholds:
                      volatility_transition: 0.25
                      volatility_stress: 0.40
                      drawdown_transition: 0.08
                      drawdown_stress: 0.15
                    """);
            assertThat(config.pacingFor(RegimeState.TRANSITION)).isEqualTo(0.5);

            assertThatThrownBy(() -> parser.parseRegime("regime/thresholds.yml", """
                    thresholds:
                      volatility_transition: 0.50
                      volatility_stress: 0.40
                      drawdown_transition: 0.08
                      drawdown_stress: 0.15
                    """))
                    .isInstanceOfSatisfying(ValidationException.class,
                            e -> assertThat(e.getField()).isEqualTo("thresholds.ordered"));
        }
    }
}
