package com.alphaguard.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Per-symbol outcome recorded in a pool audit trail. */
public enum PoolDecision {
    INCLUDED("included"),
    EXCLUDED("excluded"),
    PRIORITIZED("prioritized");

    private final String value;

    PoolDecision(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
