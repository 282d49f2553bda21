package com.alphaguard.exception;

import java.util.Map;

/** The audit store could not durably persist an entry. Always escalated. */
public class AuditStorageException extends BaseException {

    public AuditStorageException(String message, Throwable cause) {
        super(ErrorCode.AUDIT_STORAGE_UNAVAILABLE, message, Map.of(), cause);
    }
}
