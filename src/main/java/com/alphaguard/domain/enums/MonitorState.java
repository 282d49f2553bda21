package com.alphaguard.domain.enums;

/**
 * Per-hypothesis state of the falsifier monitor.
 *
 * <p>NOT_YET_DUE -> CHECKING -> (TRIGGERED | PASSED). A hypothesis returns to
 * CHECKING on its next due cycle.
 */
public enum MonitorState {
    NOT_YET_DUE,
    CHECKING,
    TRIGGERED,
    PASSED
}
