package com.alphaguard.domain.enums;

public enum RegistryKind {
    HYPOTHESIS,
    CONSTRAINT,
    FACTOR
}
