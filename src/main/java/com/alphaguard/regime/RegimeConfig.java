package com.alphaguard.regime;

import com.alphaguard.domain.enums.RegimeState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Regime thresholds plus the position pacing multiplier for each state.
 */
@Value
@Builder
@Jacksonized
public class RegimeConfig {

    public static final Map<RegimeState, Double> DEFAULT_PACING = Map.of(
            RegimeState.NORMAL, 1.0,
            RegimeState.TRANSITION, 0.5,
            RegimeState.STRESS, 0.1);

    @NotNull
    @Valid
    RegimeThresholds thresholds;

    @NotNull
    @Builder.Default
    Map<RegimeState, Double> pacingMultipliers = DEFAULT_PACING;

    public double pacingFor(RegimeState state) {
        Double pacing = pacingMultipliers.get(state);
        return pacing != null ? pacing : DEFAULT_PACING.get(state);
    }

    @JsonIgnore
    @AssertTrue(message = "pacing multipliers must be between 0 and 1")
    public boolean isPacingInRange() {
        return pacingMultipliers.values().stream().allMatch(v -> v != null && v >= 0.0 && v <= 1.0);
    }
}
