package com.alphaguard.constraint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Hard ceilings that hold regardless of any action value.
 * When several constraints apply, each ceiling resolves to its minimum.
 */
@Value
@Builder
@Jacksonized
public class ConstraintGuardrails {

    public static final ConstraintGuardrails NONE = ConstraintGuardrails.builder().build();

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double maxPositionPct;

    @PositiveOrZero
    Double maxGrossExposureDelta;

    @PositiveOrZero
    Double maxDrawdownAddon;

    @JsonIgnore
    public boolean isEmpty() {
        return maxPositionPct == null && maxGrossExposureDelta == null && maxDrawdownAddon == null;
    }
}
