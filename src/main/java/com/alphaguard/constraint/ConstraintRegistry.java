package com.alphaguard.constraint;

import com.alphaguard.domain.enums.RegistryKind;
import com.alphaguard.domain.model.RegistryFilter;
import com.alphaguard.event.GovernanceRegistryChangedEvent;
import com.alphaguard.exception.RegistryConflictException;
import com.alphaguard.exception.ResourceNotFoundException;
import com.alphaguard.registry.RegistrySnapshot;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Sole owner and writer of the constraint set.
 *
 * <p>Same snapshot discipline as the hypothesis registry: lock-free reads of an
 * immutable snapshot, serialized writers, atomic publish, one
 * {@link GovernanceRegistryChangedEvent} per successful write.
 */
@Component
public class ConstraintRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConstraintRegistry.class);

    private final AtomicReference<RegistrySnapshot<Constraint>> current =
            new AtomicReference<>(RegistrySnapshot.empty());
    private final Object writeLock = new Object();
    private final ApplicationEventPublisher applicationEventPublisher;

    public ConstraintRegistry(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Registers a constraint. Idempotent for identical content, conflict for a
     * reused identifier with different content.
     *
     * @return true if the registry changed
     */
    public boolean register(Constraint constraint) {
        RegistrySnapshot<Constraint> next;
        synchronized (writeLock) {
            RegistrySnapshot<Constraint> snapshot = current.get();
            Optional<Constraint> existing = snapshot.find(constraint.getId());
            if (existing.isPresent()) {
                if (existing.get().equals(constraint)) {
                    return false;
                }
                throw new RegistryConflictException("Constraint", constraint.getId());
            }
            next = snapshot.with(constraint.getId(), constraint);
            current.set(next);
        }
        log.info("Registered constraint {} (priority {})", constraint.getId(), constraint.getPriority());
        publish(List.of(constraint.getId()), "register", next.getVersion());
        return true;
    }

    public void replaceAll(Collection<Constraint> constraints, String cause) {
        announceReplaced(swapAll(constraints), cause);
    }

    /** Swaps in the whole set without publishing a change event. */
    public RegistrySnapshot<Constraint> swapAll(Collection<Constraint> constraints) {
        synchronized (writeLock) {
            RegistrySnapshot<Constraint> next =
                    RegistrySnapshot.of(constraints, Constraint::getId, current.get().getVersion() + 1);
            current.set(next);
            return next;
        }
    }

    public void announceReplaced(RegistrySnapshot<Constraint> replaced, String cause) {
        log.info("Constraint registry replaced: {} entries, version {}", replaced.size(), replaced.getVersion());
        publish(List.copyOf(replaced.asMap().keySet()), cause, replaced.getVersion());
    }

    public Optional<Constraint> find(String constraintId) {
        return current.get().find(constraintId);
    }

    public Constraint get(String constraintId) {
        return find(constraintId).orElseThrow(() -> new ResourceNotFoundException("Constraint", constraintId));
    }

    /** Constraints applicable to the filter's symbol and strategy, in identifier order. */
    public List<Constraint> list(RegistryFilter filter) {
        return filter(current.get(), filter);
    }

    /** Constraints whose activation rule names the hypothesis. */
    public List<Constraint> linkedTo(String hypothesisId) {
        return current.get().values().stream()
                .filter(c -> c.dependsOn(hypothesisId))
                .toList();
    }

    public RegistrySnapshot<Constraint> snapshot() {
        return current.get();
    }

    public long version() {
        return current.get().getVersion();
    }

    static List<Constraint> filter(RegistrySnapshot<Constraint> snapshot, RegistryFilter filter) {
        return snapshot.values().stream()
                .filter(c -> filter.getSymbol() == null || c.getAppliesTo().coversSymbol(filter.getSymbol()))
                .filter(c -> filter.getStrategy() == null || c.getAppliesTo().coversStrategy(filter.getStrategy()))
                .toList();
    }

    private void publish(List<String> ids, String cause, long version) {
        applicationEventPublisher.publishEvent(
                new GovernanceRegistryChangedEvent(this, RegistryKind.CONSTRAINT, ids, cause, version));
    }
}
