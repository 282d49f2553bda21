package com.alphaguard.audit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local audit store, selected with {@code alphaguard.governance.audit.store=memory}.
 * Used by tests and local runs; contents are lost on restart.
 */
public class InMemoryGovernanceAuditStore implements GovernanceAuditStore {

    private final List<AuditLogEntry> entries = new ArrayList<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        AuditLogEntry stored = entry.toBuilder().id(idSequence.incrementAndGet()).build();
        synchronized (entries) {
            entries.add(stored);
        }
        return stored;
    }

    @Override
    public List<AuditLogEntry> query(AuditQuery query) {
        List<AuditLogEntry> copy;
        synchronized (entries) {
            copy = new ArrayList<>(entries);
        }
        return copy.stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(AuditLogEntry::getTimestamp).thenComparing(AuditLogEntry::getId))
                .limit(query.getLimit())
                .toList();
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
