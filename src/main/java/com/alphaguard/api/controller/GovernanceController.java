package com.alphaguard.api.controller;

import com.alphaguard.api.dto.request.ActivateHypothesisRequest;
import com.alphaguard.api.dto.response.ApiResponse;
import com.alphaguard.audit.AuditLogEntry;
import com.alphaguard.audit.AuditQuery;
import com.alphaguard.audit.GovernanceAuditLogger;
import com.alphaguard.constraint.ConstraintResolver;
import com.alphaguard.constraint.ResolvedConstraints;
import com.alphaguard.domain.enums.GovernanceAuditEventType;
import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.domain.model.RegistryFilter;
import com.alphaguard.factor.Factor;
import com.alphaguard.factor.FactorRegistry;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisRegistry;
import com.alphaguard.pool.Pool;
import com.alphaguard.pool.PoolService;
import com.alphaguard.regime.RegimeDetector;
import com.alphaguard.regime.RegimeSnapshot;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only REST view of the governance engine, plus the human approval channel.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/governance/audit -- audit entries by symbol, time range, constraint, event type</li>
 *   <li>GET /api/governance/hypotheses -- hypotheses, optionally by status or symbol</li>
 *   <li>GET /api/governance/hypotheses/{id} -- one hypothesis</li>
 *   <li>POST /api/governance/hypotheses/{id}/activate -- human approval, DRAFT to ACTIVE</li>
 *   <li>GET /api/governance/constraints/resolved/{symbol} -- resolved constraints for a symbol</li>
 *   <li>GET /api/governance/pool -- current trading pool</li>
 *   <li>GET /api/governance/regime -- current market regime</li>
 *   <li>GET /api/governance/factors -- registered factors and their status</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/governance")
public class GovernanceController {

    private static final Logger log = LoggerFactory.getLogger(GovernanceController.class);

    private final GovernanceAuditLogger auditLogger;
    private final HypothesisRegistry hypothesisRegistry;
    private final ConstraintResolver constraintResolver;
    private final PoolService poolService;
    private final RegimeDetector regimeDetector;
    private final FactorRegistry factorRegistry;

    public GovernanceController(
            GovernanceAuditLogger auditLogger,
            HypothesisRegistry hypothesisRegistry,
            ConstraintResolver constraintResolver,
            PoolService poolService,
            RegimeDetector regimeDetector,
            FactorRegistry factorRegistry) {
        this.auditLogger = auditLogger;
        this.hypothesisRegistry = hypothesisRegistry;
        this.constraintResolver = constraintResolver;
        this.poolService = poolService;
        this.regimeDetector = regimeDetector;
        this.factorRegistry = factorRegistry;
    }

    @GetMapping("/audit")
    public ResponseEntity<ApiResponse<List<AuditLogEntry>>> queryAudit(
            @RequestParam(required = false) String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String constraintId,
            @RequestParam(required = false) GovernanceAuditEventType eventType,
            @RequestParam(defaultValue = "" + AuditQuery.DEFAULT_LIMIT) int limit) {
        AuditQuery query = AuditQuery.builder()
                .symbol(symbol)
                .from(from)
                .to(to)
                .constraintId(constraintId)
                .eventType(eventType)
                .limit(Math.max(1, Math.min(limit, AuditQuery.MAX_LIMIT)))
                .build();
        return ResponseEntity.ok(ApiResponse.of(auditLogger.query(query)));
    }

    @GetMapping("/hypotheses")
    public ResponseEntity<ApiResponse<List<Hypothesis>>> listHypotheses(
            @RequestParam(required = false) HypothesisStatus status,
            @RequestParam(required = false) String symbol) {
        RegistryFilter filter = RegistryFilter.builder().status(status).symbol(symbol).build();
        return ResponseEntity.ok(ApiResponse.of(hypothesisRegistry.list(filter)));
    }

    @GetMapping("/hypotheses/{id}")
    public ResponseEntity<ApiResponse<Hypothesis>> getHypothesis(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.of(hypothesisRegistry.get(id)));
    }

    /**
     * Human approval of a DRAFT hypothesis. The engine never activates a
     * hypothesis on its own; this is the only path into ACTIVE at runtime.
     */
    @PostMapping("/hypotheses/{id}/activate")
    public ResponseEntity<ApiResponse<Hypothesis>> activateHypothesis(
            @PathVariable String id, @RequestBody @Valid ActivateHypothesisRequest request) {
        log.info("Activation of hypothesis {} requested by {}", id, request.getApprover());
        return ResponseEntity.ok(ApiResponse.of(hypothesisRegistry.activate(id, request.getApprover())));
    }

    @GetMapping("/constraints/resolved/{symbol}")
    public ResponseEntity<ApiResponse<ResolvedConstraints>> resolveConstraints(
            @PathVariable String symbol, @RequestParam(required = false) String strategyId) {
        return ResponseEntity.ok(ApiResponse.of(constraintResolver.resolveForStrategy(symbol, strategyId)));
    }

    @GetMapping("/pool")
    public ResponseEntity<ApiResponse<Pool>> getPool() {
        return ResponseEntity.ok(ApiResponse.of(poolService.current()));
    }

    @GetMapping("/regime")
    public ResponseEntity<ApiResponse<RegimeSnapshot>> getRegime() {
        return ResponseEntity.ok(ApiResponse.of(regimeDetector.current()));
    }

    @GetMapping("/factors")
    public ResponseEntity<ApiResponse<List<Factor>>> listFactors() {
        return ResponseEntity.ok(ApiResponse.of(factorRegistry.list()));
    }
}
