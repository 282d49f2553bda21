package com.alphaguard.audit;

import java.util.List;

/**
 * Append-only storage for governance audit entries.
 *
 * <p>{@link #append} is synchronous and durable: when it returns, the entry is
 * stored. The only permitted failure is storage unavailability, reported as
 * {@link com.alphaguard.exception.AuditStorageException}. There is no update or
 * delete operation.
 */
public interface GovernanceAuditStore {

    /** Stores the entry and returns it with its assigned id. */
    AuditLogEntry append(AuditLogEntry entry);

    /** Entries matching every non-null filter, oldest first. */
    List<AuditLogEntry> query(AuditQuery query);
}
