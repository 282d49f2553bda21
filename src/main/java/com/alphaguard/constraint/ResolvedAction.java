package com.alphaguard.constraint;

import lombok.Value;

/**
 * One action field contributed by one constraint during a resolution.
 */
@Value
public class ResolvedAction {

    String constraintId;

    int priority;

    /** Document key of the action field, e.g. {@code risk_budget_multiplier}. */
    String actionType;

    Object value;
}
