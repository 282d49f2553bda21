package com.alphaguard.domain.enums;

/** Factor lifecycle. REVIEW keeps the factor running but flags it for a human. */
public enum FactorStatus {
    ENABLED,
    DISABLED,
    REVIEW
}
