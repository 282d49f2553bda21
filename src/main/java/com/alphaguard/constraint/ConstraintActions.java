package com.alphaguard.constraint;

import com.alphaguard.domain.enums.StopMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The closed set of effects a constraint may request. Every field is optional;
 * a null field contributes nothing to resolution.
 *
 * <p>The set is closed on purpose: there is no map of extra values, and the
 * YAML reader rejects any key not declared here. {@link #ALLOWED_FIELDS} is the
 * same list in document spelling, taken from {@link ActionField}, and is what
 * the standalone allowlist check enforces.
 */
@Value
@Builder
@Jacksonized
public class ConstraintActions {

    public static final ConstraintActions NONE = ConstraintActions.builder().build();

    public static final Set<String> ALLOWED_FIELDS = ActionField.keys();

    Boolean enableStrategy;

    @Positive
    Double poolBiasMultiplier;

    Boolean vetoDowngrade;

    @DecimalMin(value = "1.0", message = "must be at least 1.0")
    Double riskBudgetMultiplier;

    @PositiveOrZero
    Integer holdingExtensionDays;

    @Positive
    Double addPositionCapMultiplier;

    StopMode stopMode;

    /** The fields this constraint sets, keyed by document name. */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (ActionField field : ActionField.values()) {
            Object value = field.valueOf(this);
            if (value != null) {
                map.put(field.getKey(), value instanceof StopMode mode ? mode.getValue() : value);
            }
        }
        return map;
    }
}
