package com.alphaguard.domain.enums;

/**
 * Closed set of governance effects recorded in the audit log.
 */
public enum GovernanceAuditEventType {
    CONSTRAINT_ACTIVATED,
    CONSTRAINT_DEACTIVATED,
    FALSIFIER_CHECK_PASS,
    FALSIFIER_CHECK_TRIGGERED,
    VETO_DOWNGRADE,
    RISK_BUDGET_ADJUSTED,
    POSITION_CAP_APPLIED,
    POOL_BUILT,
    REGIME_CHANGED
}
