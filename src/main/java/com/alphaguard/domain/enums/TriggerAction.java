package com.alphaguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a triggered falsifier asks for. SUNSET retires the hypothesis; REVIEW only alerts. */
public enum TriggerAction {
    REVIEW("review"),
    SUNSET("sunset");

    private final String value;

    TriggerAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TriggerAction fromValue(String value) {
        for (TriggerAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown trigger action: " + value);
    }
}
