package com.alphaguard.exception;

import com.alphaguard.pool.PoolAuditEntry;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when structural filters and gating leave no symbol in the pool.
 *
 * <p>Fatal for the caller: strategy execution must stop rather than fall back
 * to another pool. The audit trail explains why each symbol was dropped.
 */
@Getter
public class EmptyPoolException extends BaseException {

    private final List<PoolAuditEntry> auditTrail;

    public EmptyPoolException(String message, List<PoolAuditEntry> auditTrail) {
        super(ErrorCode.EMPTY_POOL, message, Map.of("excludedSymbols", auditTrail.size()));
        this.auditTrail = List.copyOf(auditTrail);
    }
}
