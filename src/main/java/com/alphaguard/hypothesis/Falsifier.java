package com.alphaguard.hypothesis;

import com.alphaguard.domain.enums.ComparisonOperator;
import com.alphaguard.domain.enums.TriggerAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Quantitative rule that, when met, casts doubt on its hypothesis.
 *
 * <p>Evaluated as {@code metric(window) <operator> threshold}. The window is a
 * count plus unit: {@code d} days, {@code w} weeks, {@code m} months,
 * {@code q} quarters, {@code y} years.
 */
@Value
@Builder
@Jacksonized
public class Falsifier {

    public static final String WINDOW_PATTERN = "^[0-9]+[dwmqy]$";

    @NotBlank
    String metric;

    @NotNull
    ComparisonOperator operator;

    @NotNull
    Double threshold;

    @NotBlank
    @Pattern(regexp = WINDOW_PATTERN, message = "must be a count followed by d, w, m, q or y")
    String window;

    @NotNull
    TriggerAction trigger;

    public boolean isMetBy(double value) {
        return operator.test(value, threshold);
    }

    public String describe() {
        return String.format("%s %s %s over %s", metric, operator.getSymbol(), threshold, window);
    }
}
