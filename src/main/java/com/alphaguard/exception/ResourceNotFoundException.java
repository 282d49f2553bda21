package com.alphaguard.exception;

import java.util.Map;

/** Unknown hypothesis, constraint or factor id, or a pool or regime that was never configured. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s not found with identifier: %s", resourceType, identifier),
                Map.of("resourceType", resourceType, "id", identifier));
    }
}
