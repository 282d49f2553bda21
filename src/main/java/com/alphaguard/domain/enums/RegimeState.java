package com.alphaguard.domain.enums;

/**
 * Market regime used for position pacing only. Never an alpha input.
 */
public enum RegimeState {
    NORMAL,
    TRANSITION,
    STRESS
}
