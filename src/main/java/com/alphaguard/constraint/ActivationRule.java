package com.alphaguard.constraint;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * When a constraint is in force: every listed hypothesis must be ACTIVE.
 *
 * <p>{@code disabledIfFalsified} marks the constraint for deactivation reporting
 * when one of its hypotheses is sunset. No separate disabled flag exists: the
 * constraint stops being active because its hypothesis stopped being ACTIVE.
 */
@Value
@Builder
@Jacksonized
public class ActivationRule {

    public static final ActivationRule ALWAYS = ActivationRule.builder().build();

    @NotNull
    @Builder.Default
    List<String> requiresHypothesesActive = List.of();

    @NotNull
    @Builder.Default
    Boolean disabledIfFalsified = Boolean.TRUE;
}
