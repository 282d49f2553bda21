package com.alphaguard.factor;

import com.alphaguard.domain.enums.ComparisonOperator;
import com.alphaguard.domain.enums.FailureAction;
import com.alphaguard.hypothesis.Falsifier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Condition under which a factor is disabled or sent for review. */
@Value
@Builder
@Jacksonized
public class FactorFailureRule {

    @NotBlank
    String metric;

    @NotNull
    ComparisonOperator operator;

    @NotNull
    Double threshold;

    @NotBlank
    @Pattern(regexp = Falsifier.WINDOW_PATTERN, message = "must be a count followed by d, w, m, q or y")
    String window;

    @NotNull
    FailureAction action;

    public boolean isMetBy(double value) {
        return operator.test(value, threshold);
    }
}
