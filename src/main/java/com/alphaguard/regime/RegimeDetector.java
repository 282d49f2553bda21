package com.alphaguard.regime;

import com.alphaguard.audit.GovernanceAuditLogger;
import com.alphaguard.domain.enums.RegimeState;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.monitoring.MetricRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Classifies the market regime for position pacing.
 *
 * <p>Reads {@code portfolio_volatility}, {@code max_drawdown} and
 * {@code cross_sectional_dispersion} from the {@link MetricRegistry}; a missing
 * value counts as 0. STRESS wins over TRANSITION, which wins over NORMAL: any
 * observation at or above its stress threshold means STRESS.
 *
 * <p>The regime only ever scales pacing. It is not an input to alpha.
 */
@Component
public class RegimeDetector {

    private static final Logger log = LoggerFactory.getLogger(RegimeDetector.class);

    public static final String VOLATILITY_METRIC = "portfolio_volatility";
    public static final String DRAWDOWN_METRIC = "max_drawdown";
    public static final String DISPERSION_METRIC = "cross_sectional_dispersion";

    private final MetricRegistry metricRegistry;
    private final GovernanceAuditLogger auditLogger;
    private final Clock clock;

    private final AtomicReference<RegimeConfig> config = new AtomicReference<>();
    private final AtomicReference<RegimeSnapshot> latest = new AtomicReference<>();

    public RegimeDetector(MetricRegistry metricRegistry, GovernanceAuditLogger auditLogger, Clock clock) {
        this.metricRegistry = metricRegistry;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public void configure(RegimeConfig regimeConfig) {
        config.set(regimeConfig);
        log.info("Regime thresholds configured: {}", regimeConfig.getThresholds());
    }

    public boolean isConfigured() {
        return config.get() != null;
    }

    /** Periodic refresh so readers of {@link #current()} see a recent regime. */
    @Scheduled(fixedRateString = "${alphaguard.governance.regime.detect-interval-ms:60000}")
    public void refresh() {
        if (isConfigured()) {
            detect();
        }
    }

    /**
     * Evaluates current metrics. Writes a REGIME_CHANGED audit entry when the
     * state differs from the previous detection.
     */
    public synchronized RegimeSnapshot detect() {
        RegimeConfig regimeConfig = config.get();
        if (regimeConfig == null) {
            throw new ResourceNotFoundException("Regime thresholds", "regime/thresholds.yml");
        }
        RegimeThresholds thresholds = regimeConfig.getThresholds();

        double volatility = metric(VOLATILITY_METRIC);
        double drawdown = metric(DRAWDOWN_METRIC);
        double dispersion = metric(DISPERSION_METRIC);

        RegimeState state;
        if (reaches(volatility, thresholds.getVolatilityStress())
                || reaches(drawdown, thresholds.getDrawdownStress())
                || reaches(dispersion, thresholds.getDispersionStress())) {
            state = RegimeState.STRESS;
        } else if (reaches(volatility, thresholds.getVolatilityTransition())
                || reaches(drawdown, thresholds.getDrawdownTransition())
                || reaches(dispersion, thresholds.getDispersionTransition())) {
            state = RegimeState.TRANSITION;
        } else {
            state = RegimeState.NORMAL;
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(VOLATILITY_METRIC, volatility);
        metrics.put(DRAWDOWN_METRIC, drawdown);
        metrics.put(DISPERSION_METRIC, dispersion);

        RegimeSnapshot previous = latest.get();
        RegimeSnapshot snapshot = RegimeSnapshot.builder()
                .state(state)
                .previousState(previous != null ? previous.getState() : null)
                .detectedAt(clock.instant())
                .metrics(Map.copyOf(metrics))
                .pacingMultiplier(regimeConfig.pacingFor(state))
                .thresholds(thresholds)
                .build();
        latest.set(snapshot);

        if (snapshot.isChanged()) {
            log.info("Regime transition: {} -> {} (vol={}, dd={}, dispersion={}, pacing={})",
                    snapshot.getPreviousState(), state, volatility, drawdown, dispersion,
                    snapshot.getPacingMultiplier());
            auditLogger.regimeChanged(snapshot);
        }
        return snapshot;
    }

    /** Latest snapshot, detecting once if nothing has been detected yet. */
    public RegimeSnapshot current() {
        RegimeSnapshot snapshot = latest.get();
        return snapshot != null ? snapshot : detect();
    }

    private double metric(String name) {
        return metricRegistry.value(name).orElse(0.0);
    }

    private static boolean reaches(double value, Double threshold) {
        return threshold != null && value >= threshold;
    }
}
