package com.alphaguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Action a factor failure rule takes when it fires. */
public enum FailureAction {
    DISABLE("disable"),
    REVIEW("review");

    private final String value;

    FailureAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FailureAction fromValue(String value) {
        for (FailureAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown failure action: " + value);
    }
}
