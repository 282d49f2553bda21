package com.alphaguard.unit.api;

import static com.alphaguard.unit.GovernanceFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.alphaguard.api.controller.GovernanceController;
import com.alphaguard.audit.AuditLogEntry;
import com.alphaguard.audit.AuditQuery;
import com.alphaguard.audit.GovernanceAuditLogger;
import com.alphaguard.constraint.ConstraintGuardrails;
import com.alphaguard.constraint.ConstraintResolver;
import com.alphaguard.constraint.ResolvedConstraints;
import com.alphaguard.domain.enums.GovernanceAuditEventType;
import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.domain.enums.StopMode;
import com.alphaguard.exception.EmptyPoolException;
import com.alphaguard.exception.GlobalExceptionHandler;
import com.alphaguard.exception.IllegalTransitionException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.factor.FactorRegistry;
import com.alphaguard.hypothesis.HypothesisRegistry;
import com.alphaguard.pool.PoolService;
import com.alphaguard.regime.RegimeDetector;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class GovernanceControllerTest {

    @Mock
    private GovernanceAuditLogger auditLogger;

    @Mock
    private HypothesisRegistry hypothesisRegistry;

    @Mock
    private ConstraintResolver constraintResolver;

    @Mock
    private PoolService poolService;

    @Mock
    private RegimeDetector regimeDetector;

    @Mock
    private FactorRegistry factorRegistry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GovernanceController controller = new GovernanceController(
                auditLogger, hypothesisRegistry, constraintResolver, poolService, regimeDetector, factorRegistry);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("GET /api/governance/audit")
    class Audit {

        @Test
        @DisplayName("passes every filter through and returns the entries")
        void queryWithFilters() throws Exception {
            when(auditLogger.query(any(AuditQuery.class))).thenReturn(List.of(AuditLogEntry.builder()
                    .id(1L)
                    .timestamp(NOW)
                    .eventType(GovernanceAuditEventType.RISK_BUDGET_ADJUSTED)
                    .constraintId("memory_risk_budget")
                    .symbol("MU")
                    .actionDetails(Map.of("multiplier", 1.5))
                    .build()));

            mockMvc.perform(get("/api/governance/audit")
                            .param("symbol", "MU")
                            .param("from", "2026-03-10T00:00:00Z")
                            .param("to", "2026-03-11T00:00:00Z")
                            .param("eventType", "RISK_BUDGET_ADJUSTED"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data[0].constraintId").value("memory_risk_budget"))
                    .andExpect(jsonPath("$.data[0].actionDetails.multiplier").value(1.5));

            ArgumentCaptor<AuditQuery> captor = ArgumentCaptor.forClass(AuditQuery.class);
            verify(auditLogger).query(captor.capture());
            AuditQuery query = captor.getValue();
            assertThat(query.getSymbol()).isEqualTo("MU");
            assertThat(query.getFrom()).isEqualTo("2026-03-10T00:00:00Z");
            assertThat(query.getTo()).isEqualTo("2026-03-11T00:00:00Z");
            assertThat(query.getEventType()).isEqualTo(GovernanceAuditEventType.RISK_BUDGET_ADJUSTED);
            assertThat(query.getLimit()).isEqualTo(AuditQuery.DEFAULT_LIMIT);
        }

        @Test
        @DisplayName("clamps the limit")
        void clampsLimit() throws Exception {
            when(auditLogger.query(any(AuditQuery.class))).thenReturn(List.of());

            mockMvc.perform(get("/api/governance/audit").param("limit", "500000"))
                    .andExpect(status().isOk());

            ArgumentCaptor<AuditQuery> captor = ArgumentCaptor.forClass(AuditQuery.class);
            verify(auditLogger).query(captor.capture());
            assertThat(captor.getValue().getLimit()).isEqualTo(AuditQuery.MAX_LIMIT);
        }

        @Test
        @DisplayName("an unknown event type is a bad request")
        void unknownEventType() throws Exception {
            mockMvc.perform(get("/api/governance/audit").param("eventType", "ORDER_PLACED"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

            verify(auditLogger, never()).query(any());
        }
    }

    @Nested
    @DisplayName("hypotheses")
    class Hypotheses {

        @Test
        @DisplayName("an unknown hypothesis is a 404")
        void unknownHypothesis() throws Exception {
            when(hypothesisRegistry.get("nope")).thenThrow(new ResourceNotFoundException("Hypothesis", "nope"));

            mockMvc.perform(get("/api/governance/hypotheses/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.error.path").value("/api/governance/hypotheses/nope"));
        }

        @Test
        @DisplayName("activation without an approver is rejected before reaching the registry")
        void blankApprover() throws Exception {
            mockMvc.perform(post("/api/governance/hypotheses/memory_supercycle/activate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"approver\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.approver").exists());

            verify(hypothesisRegistry, never()).activate(any(), any());
        }

        @Test
        @DisplayName("an illegal transition is a 409")
        void illegalTransition() throws Exception {
            when(hypothesisRegistry.activate("memory_supercycle", "j.doe"))
                    .thenThrow(new IllegalTransitionException(
                            "memory_supercycle", HypothesisStatus.SUNSET, HypothesisStatus.ACTIVE));

            mockMvc.perform(post("/api/governance/hypotheses/memory_supercycle/activate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"approver\":\"j.doe\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("ILLEGAL_TRANSITION"));
        }
    }

    @Test
    @DisplayName("resolved constraints for a symbol and strategy")
    void resolvedConstraints() throws Exception {
        when(constraintResolver.resolveForStrategy("MU", "momentum_v2")).thenReturn(ResolvedConstraints.builder()
                .symbol("MU")
                .strategyId("momentum_v2")
                .actions(List.of())
                .contributingConstraintIds(List.of("memory_cycle_boost", "memory_risk_budget"))
                .effectiveRiskBudgetMultiplier(3.0)
                .effectivePoolBiasMultiplier(1.0)
                .effectivePositionCapMultiplier(1.0)
                .strategyEnabled(true)
                .stopMode(StopMode.WIDE)
                .guardrails(ConstraintGuardrails.builder().build())
                .version("0123456789abcdef")
                .resolvedAt(NOW)
                .build());

        mockMvc.perform(get("/api/governance/constraints/resolved/MU").param("strategyId", "momentum_v2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.effectiveRiskBudgetMultiplier").value(3.0))
                .andExpect(jsonPath("$.data.contributingConstraintIds.length()").value(2));
    }

    @Test
    @DisplayName("an empty pool is a 422")
    void emptyPool() throws Exception {
        when(poolService.current()).thenThrow(new EmptyPoolException("No symbol passed the filters", List.of()));

        mockMvc.perform(get("/api/governance/pool"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("EMPTY_POOL"));
    }
}
