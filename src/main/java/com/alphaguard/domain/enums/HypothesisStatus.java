package com.alphaguard.domain.enums;

/**
 * Lifecycle states of a hypothesis.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>DRAFT -> ACTIVE: human approval only</li>
 *   <li>DRAFT -> REJECTED: human action</li>
 *   <li>ACTIVE -> SUNSET: falsifier trigger or human action</li>
 *   <li>ACTIVE -> REJECTED: human action</li>
 * </ul>
 * SUNSET and REJECTED are terminal.
 */
public enum HypothesisStatus {
    DRAFT,
    ACTIVE,
    SUNSET,
    REJECTED;

    public boolean isTerminal() {
        return this == SUNSET || this == REJECTED;
    }

    public boolean canTransitionTo(HypothesisStatus target) {
        return switch (this) {
            case DRAFT -> target == ACTIVE || target == REJECTED;
            case ACTIVE -> target == SUNSET || target == REJECTED;
            case SUNSET, REJECTED -> false;
        };
    }
}
