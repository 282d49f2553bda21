package com.alphaguard.exception;

import java.util.Map;

public class RegistryConflictException extends BaseException {

    public RegistryConflictException(String entityType, String id) {
        super(
                ErrorCode.REGISTRY_CONFLICT,
                String.format("%s '%s' is already registered with different content", entityType, id),
                Map.of("entityType", entityType, "id", id));
    }
}
