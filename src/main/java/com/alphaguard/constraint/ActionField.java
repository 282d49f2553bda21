package com.alphaguard.constraint;

import com.alphaguard.domain.enums.StopMode;
import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-field reducer table for folding constraint actions.
 *
 * <p>Constraints are folded in ascending priority order. Each field declares how
 * a lower-priority value combines with what has been accumulated so far:
 * <ul>
 *   <li>{@link Reduction#PRODUCT}: multipliers compose multiplicatively</li>
 *   <li>{@link Reduction#ANY}: logical OR</li>
 *   <li>{@link Reduction#MAX}: largest value wins</li>
 *   <li>{@link Reduction#FIRST_BY_PRIORITY}: the highest-priority constraint that sets the field wins</li>
 * </ul>
 */
public enum ActionField {
    ENABLE_STRATEGY("enable_strategy", ConstraintActions::getEnableStrategy, Reduction.FIRST_BY_PRIORITY, Boolean.TRUE),
    POOL_BIAS_MULTIPLIER("pool_bias_multiplier", ConstraintActions::getPoolBiasMultiplier, Reduction.PRODUCT, 1.0),
    VETO_DOWNGRADE("veto_downgrade", ConstraintActions::getVetoDowngrade, Reduction.ANY, Boolean.FALSE),
    RISK_BUDGET_MULTIPLIER("risk_budget_multiplier", ConstraintActions::getRiskBudgetMultiplier, Reduction.PRODUCT, 1.0),
    HOLDING_EXTENSION_DAYS("holding_extension_days", ConstraintActions::getHoldingExtensionDays, Reduction.MAX, 0),
    ADD_POSITION_CAP_MULTIPLIER(
            "add_position_cap_multiplier", ConstraintActions::getAddPositionCapMultiplier, Reduction.PRODUCT, 1.0),
    STOP_MODE("stop_mode", ConstraintActions::getStopMode, Reduction.FIRST_BY_PRIORITY, StopMode.BASELINE);

    private static final Set<String> KEYS =
            Arrays.stream(values()).map(ActionField::getKey).collect(Collectors.toUnmodifiableSet());

    private final String key;
    private final Function<ConstraintActions, Object> extractor;
    private final Reduction reduction;
    private final Object identity;

    ActionField(String key, Function<ConstraintActions, Object> extractor, Reduction reduction, Object identity) {
        this.key = key;
        this.extractor = extractor;
        this.reduction = reduction;
        this.identity = identity;
    }

    public String getKey() {
        return key;
    }

    public Reduction getReduction() {
        return reduction;
    }

    /** Value used when no contributing constraint sets the field. */
    public Object getIdentity() {
        return identity;
    }

    /** The field's value on the given actions, or null if unset. */
    public Object valueOf(ConstraintActions actions) {
        return extractor.apply(actions);
    }

    /** Combines an accumulated value (null if none yet) with the next value in priority order. */
    public Object fold(Object accumulated, Object next) {
        if (accumulated == null) {
            return next;
        }
        return switch (reduction) {
            case PRODUCT -> ((Number) accumulated).doubleValue() * ((Number) next).doubleValue();
            case ANY -> (Boolean) accumulated || (Boolean) next;
            case MAX -> Math.max(((Number) accumulated).intValue(), ((Number) next).intValue());
            case FIRST_BY_PRIORITY -> accumulated;
        };
    }

    /** Document keys of the closed action set. */
    public static Set<String> keys() {
        return KEYS;
    }

    public enum Reduction {
        PRODUCT,
        ANY,
        MAX,
        FIRST_BY_PRIORITY
    }
}
