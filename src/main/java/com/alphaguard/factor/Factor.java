package com.alphaguard.factor;

import com.alphaguard.domain.enums.FactorStatus;
import com.alphaguard.hypothesis.Hypothesis;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Registration of a trading factor.
 *
 * <p>Factor computation happens elsewhere. Governance only keeps the factor's
 * failure rules and its enable/disable status. A factor without at least one
 * failure rule is never accepted.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Factor {

    @NotBlank
    @Pattern(regexp = Hypothesis.ID_PATTERN, message = "must match " + Hypothesis.ID_PATTERN)
    String id;

    @NotBlank
    String name;

    @Builder.Default
    String description = "";

    @NotNull
    @Builder.Default
    List<String> hypothesisIds = List.of();

    /** Input feature names. */
    @NotNull
    @Builder.Default
    List<String> inputs = List.of();

    /** Optional transform identifier, e.g. {@code zscore}. */
    String transform;

    /** IC evaluation settings, passed through to the external evaluator untouched. */
    @NotNull
    @Builder.Default
    Map<String, Object> icEvaluation = Map.of();

    @NotEmpty(message = "a factor needs at least one failure rule")
    @Valid
    @Builder.Default
    List<FactorFailureRule> failureRules = List.of();

    @NotNull
    @Builder.Default
    FactorStatus status = FactorStatus.ENABLED;

    @Builder.Default
    boolean enabled = true;

    public Factor withStatus(FactorStatus newStatus, boolean nowEnabled) {
        return toBuilder().status(newStatus).enabled(nowEnabled).build();
    }
}
