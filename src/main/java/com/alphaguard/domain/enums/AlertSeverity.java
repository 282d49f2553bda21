package com.alphaguard.domain.enums;

/**
 * Severity level for governance alerts.
 *
 * <ul>
 *   <li>CRITICAL: a hypothesis was sunset or the pool could not be built</li>
 *   <li>WARNING: a falsifier asks for human review</li>
 *   <li>INFO: informational only</li>
 * </ul>
 */
public enum AlertSeverity {

    /** Requires immediate attention; trading behaviour has already changed. */
    CRITICAL,

    /** Requires human review but nothing changed automatically. */
    WARNING,

    /** Informational, no action required. */
    INFO
}
