package com.alphaguard.regime;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Levels at which observed metrics move the regime to TRANSITION or STRESS.
 * Dispersion thresholds are optional; when absent dispersion is recorded but
 * never changes the state.
 */
@Value
@Builder
@Jacksonized
public class RegimeThresholds {

    @NotNull
    @PositiveOrZero
    Double volatilityTransition;

    @NotNull
    @PositiveOrZero
    Double volatilityStress;

    @NotNull
    @PositiveOrZero
    Double drawdownTransition;

    @NotNull
    @PositiveOrZero
    Double drawdownStress;

    @PositiveOrZero
    Double dispersionTransition;

    @PositiveOrZero
    Double dispersionStress;

    @JsonIgnore
    @AssertTrue(message = "transition thresholds must not exceed stress thresholds")
    public boolean isOrdered() {
        return ordered(volatilityTransition, volatilityStress)
                && ordered(drawdownTransition, drawdownStress)
                && ordered(dispersionTransition, dispersionStress);
    }

    private static boolean ordered(Double transition, Double stress) {
        return transition == null || stress == null || transition <= stress;
    }
}
