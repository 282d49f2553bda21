package com.alphaguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stop-loss handling mode a constraint can request.
 *
 * <p>BASELINE is what a symbol gets when no active constraint sets a mode.
 */
public enum StopMode {
    BASELINE("baseline"),
    WIDE("wide"),
    FUNDAMENTAL_GUARDED("fundamental_guarded");

    private final String value;

    StopMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StopMode fromValue(String value) {
        for (StopMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown stop mode: " + value);
    }
}
