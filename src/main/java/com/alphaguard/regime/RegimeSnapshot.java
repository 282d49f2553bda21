package com.alphaguard.regime;

import com.alphaguard.domain.enums.RegimeState;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Point-in-time regime with the observations and thresholds that produced it. */
@Value
@Builder
public class RegimeSnapshot {

    RegimeState state;

    /** Null on the first detection. */
    RegimeState previousState;

    Instant detectedAt;

    Map<String, Double> metrics;

    double pacingMultiplier;

    RegimeThresholds thresholds;

    public boolean isChanged() {
        return previousState != null && previousState != state;
    }
}
